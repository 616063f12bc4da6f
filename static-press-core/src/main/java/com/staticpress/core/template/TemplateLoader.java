package com.staticpress.core.template;

import com.staticpress.core.config.ConfigurationException;
import com.staticpress.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads templates from the {@code templates/} directory of the input directory.
 *
 * <p>The file extension selects the {@link TemplateMode}. Loaded templates are cached, so each
 * file is read and parsed at most once per loader.
 */
public class TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    public static final String DIRECTORY_NAME = "templates";

    private final Path templatesDirectory;
    private final Charset charset;
    private final Map<String, Template> cache = new ConcurrentHashMap<>();

    /**
     * Creates a loader.
     *
     * @param templatesDirectory directory holding template files
     * @param charset encoding of template files
     */
    public TemplateLoader(Path templatesDirectory, Charset charset) {
        this.templatesDirectory = Objects.requireNonNull(templatesDirectory, "templatesDirectory must not be null");
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    /**
     * Returns the template with the given identifier.
     *
     * @param identifier file name relative to the templates directory
     * @return loaded template
     * @throws ConfigurationException if the file does not exist or has an unsupported extension
     * @throws TemplateException if an expression template does not parse
     */
    public Template load(String identifier) {
        Template cached = cache.get(identifier);
        if (cached != null) {
            return cached;
        }
        Template template = read(identifier);
        Template previous = cache.putIfAbsent(identifier, template);
        return previous != null ? previous : template;
    }

    private Template read(String identifier) {
        Path file = templatesDirectory.resolve(identifier).normalize();
        if (!file.startsWith(templatesDirectory.normalize()) || !Files.isRegularFile(file)) {
            throw new ConfigurationException("Template not found: " + identifier + " (looked in " + templatesDirectory + ")");
        }

        String extension = FileUtils.getExtension(file);
        TemplateMode mode = TemplateMode.forExtension(extension)
            .orElseThrow(() -> new ConfigurationException(
                "Unsupported template type '" + extension + "' for template: " + identifier));

        String source;
        try {
            source = Files.readString(file, charset);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read template: " + file, e);
        }

        log.debug("Loaded {} template {}", mode, identifier);
        return switch (mode) {
            case EXPRESSION -> ExpressionTemplate.compile(identifier, source);
            case SUBSTITUTION -> new SubstitutionTemplate(identifier, source);
        };
    }
}
