package com.staticpress.core.template;

import com.staticpress.core.content.ContentUnit;

import java.util.Map;
import java.util.Objects;

/**
 * Renders a unit's metadata and content through the template it names.
 *
 * <p>The template is taken from the {@code template} metadata key, falling back to the
 * configured default. The identifier {@value #INLINE_TEMPLATE} renders the content itself as
 * an expression template. One engine is created per build and is shared by all workers.
 */
public class TemplateEngine {

    /** Identifier meaning "the content is the template". */
    public static final String INLINE_TEMPLATE = "none";

    private final TemplateLoader loader;
    private final String defaultTemplate;

    /**
     * Creates an engine.
     *
     * @param loader template source
     * @param defaultTemplate identifier used when metadata names no template
     */
    public TemplateEngine(TemplateLoader loader, String defaultTemplate) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.defaultTemplate = Objects.requireNonNull(defaultTemplate, "defaultTemplate must not be null");
    }

    /**
     * Renders metadata and content.
     *
     * @param metadata unit metadata, may carry a {@code template} key
     * @param content body markup
     * @return rendered document
     */
    public String render(Map<String, Object> metadata, String content) {
        RenderEnvironment environment = new RenderEnvironment(metadata, content);
        String identifier = resolve(environment.metadata());
        if (INLINE_TEMPLATE.equals(identifier)) {
            return ExpressionTemplate.compile("inline", environment.content()).render(environment);
        }
        return loader.load(identifier).render(environment);
    }

    /**
     * Renders a content unit.
     *
     * @param unit unit to render
     * @return rendered document
     */
    public String render(ContentUnit unit) {
        return render(unit.metadata(), unit.body());
    }

    /**
     * Checks that a template resolves, without rendering it.
     *
     * @param identifier template identifier
     * @throws com.staticpress.core.config.ConfigurationException if it does not resolve
     */
    public void verify(String identifier) {
        if (!INLINE_TEMPLATE.equals(identifier)) {
            loader.load(identifier);
        }
    }

    /**
     * Returns the configured default template identifier.
     *
     * @return identifier
     */
    public String defaultTemplate() {
        return defaultTemplate;
    }

    private String resolve(Map<String, Object> metadata) {
        Object template = metadata.get(ContentUnit.TEMPLATE);
        if (template == null || template.toString().isBlank()) {
            return defaultTemplate;
        }
        return template.toString().trim();
    }
}
