package com.staticpress.core.template;

/**
 * A loaded template, in one of the two {@link TemplateMode}s.
 *
 * <p>Callers render through this interface and never need to know the mode. Implementations
 * must be safe to render from several threads at once.
 *
 * @see ExpressionTemplate
 * @see SubstitutionTemplate
 */
public interface Template {

    /**
     * Returns the identifier the template was loaded under.
     *
     * @return template name
     */
    String name();

    /**
     * Returns the rendering mode.
     *
     * @return mode
     */
    TemplateMode mode();

    /**
     * Renders the template.
     *
     * @param environment metadata and content bindings
     * @return rendered markup
     * @throws TemplateException if evaluation fails
     */
    String render(RenderEnvironment environment);
}
