package com.staticpress.core.template;

import com.staticpress.core.template.expr.ExpressionEvaluator;
import com.staticpress.core.template.expr.PageExpressionCompiler;
import com.staticpress.parser.PageExpressionParser;

import java.util.Objects;

/**
 * Template written in the page expression language.
 *
 * <p>The source is parsed once by {@link #compile(String, String)}; every render evaluates the
 * parse tree with a fresh {@link ExpressionEvaluator}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * doctype("html5")
 * html(
 *   head(title(metadata.title)),
 *   body(h1(metadata.title), div({class: "post"}, content))
 * )
 * }</pre>
 */
public final class ExpressionTemplate implements Template {

    private final String name;
    private final PageExpressionParser.TemplateContext tree;

    private ExpressionTemplate(String name, PageExpressionParser.TemplateContext tree) {
        this.name = name;
        this.tree = tree;
    }

    /**
     * Parses an expression template.
     *
     * @param name template identifier, used in error messages
     * @param source template source
     * @return compiled template
     * @throws TemplateException on a syntax error
     */
    public static ExpressionTemplate compile(String name, String source) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        return new ExpressionTemplate(name, PageExpressionCompiler.parse(name, source));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TemplateMode mode() {
        return TemplateMode.EXPRESSION;
    }

    @Override
    public String render(RenderEnvironment environment) {
        return new ExpressionEvaluator(name, environment).render(tree);
    }
}
