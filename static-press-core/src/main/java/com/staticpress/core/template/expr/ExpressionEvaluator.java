package com.staticpress.core.template.expr;

import com.staticpress.core.template.RenderEnvironment;
import com.staticpress.core.template.TemplateException;
import com.staticpress.parser.PageExpressionBaseVisitor;
import com.staticpress.parser.PageExpressionParser;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a parsed page expression template against one {@link RenderEnvironment}.
 *
 * <p>One evaluator is created per render, so evaluation holds no state shared between
 * units. The only names an expression can reach are {@code metadata}, {@code content}, the
 * built-ins of {@link MarkupFunctions} and HTML element builders.
 */
public final class ExpressionEvaluator extends PageExpressionBaseVisitor<Object> {

    private final String templateName;
    private final RenderEnvironment environment;

    /**
     * Creates an evaluator.
     *
     * @param templateName name used in error messages
     * @param environment bindings for this render
     */
    public ExpressionEvaluator(String templateName, RenderEnvironment environment) {
        this.templateName = templateName;
        this.environment = environment;
    }

    /**
     * Evaluates every top-level expression and concatenates the results.
     *
     * @param template parse tree from {@link PageExpressionCompiler#parse(String, String)}
     * @return rendered markup
     * @throws TemplateException if an expression cannot be evaluated
     */
    public String render(PageExpressionParser.TemplateContext template) {
        StringBuilder out = new StringBuilder();
        for (PageExpressionParser.ExpressionContext expression : template.expression()) {
            out.append(MarkupFunctions.toMarkup(visit(expression)));
        }
        return out.toString();
    }

    @Override
    public Object visitMemberAccess(PageExpressionParser.MemberAccessContext ctx) {
        Object target = visit(ctx.expression());
        String member = ctx.identifier().getText();
        if (target == null) {
            return null;
        }
        if (target instanceof Map<?, ?> map) {
            return map.get(member);
        }
        throw error(ctx, "cannot read ." + member + " of a " + target.getClass().getSimpleName());
    }

    @Override
    public Object visitIndexAccess(PageExpressionParser.IndexAccessContext ctx) {
        Object target = visit(ctx.expression(0));
        Object key = visit(ctx.expression(1));
        try {
            return MarkupFunctions.lookup(target, key);
        } catch (TemplateException e) {
            throw error(ctx, e.getMessage());
        }
    }

    @Override
    public Object visitCall(PageExpressionParser.CallContext ctx) {
        String name = ctx.identifier().getText();
        List<Object> args = new ArrayList<>();
        if (ctx.argumentList() != null) {
            for (PageExpressionParser.ExpressionContext argument : ctx.argumentList().expression()) {
                args.add(visit(argument));
            }
        }

        try {
            if (MarkupFunctions.isBuiltin(name)) {
                return MarkupFunctions.invoke(name, args);
            }
            if (MarkupFunctions.isElementName(name)) {
                return MarkupFunctions.element(name, args);
            }
        } catch (TemplateException e) {
            throw error(ctx, e.getMessage());
        }
        throw error(ctx, "unknown function or element '" + name + "'");
    }

    @Override
    public Object visitMapLiteral(PageExpressionParser.MapLiteralContext ctx) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (PageExpressionParser.EntryContext entry : ctx.entry()) {
            PageExpressionParser.EntryKeyContext key = entry.entryKey();
            String name = key.STRING() != null ? unquote(key.STRING().getText()) : key.IDENTIFIER().getText();
            map.put(name, visit(entry.expression()));
        }
        return map;
    }

    @Override
    public Object visitListLiteral(PageExpressionParser.ListLiteralContext ctx) {
        List<Object> list = new ArrayList<>();
        for (PageExpressionParser.ExpressionContext element : ctx.expression()) {
            list.add(visit(element));
        }
        return list;
    }

    @Override
    public Object visitStringLiteral(PageExpressionParser.StringLiteralContext ctx) {
        return unquote(ctx.STRING().getText());
    }

    @Override
    public Object visitNumberLiteral(PageExpressionParser.NumberLiteralContext ctx) {
        String text = ctx.NUMBER().getText();
        return text.contains(".") ? (Object) Double.valueOf(text) : (Object) Long.valueOf(text);
    }

    @Override
    public Object visitBooleanLiteral(PageExpressionParser.BooleanLiteralContext ctx) {
        return ctx.TRUE() != null;
    }

    @Override
    public Object visitNullLiteral(PageExpressionParser.NullLiteralContext ctx) {
        return null;
    }

    @Override
    public Object visitReference(PageExpressionParser.ReferenceContext ctx) {
        String name = ctx.identifier().getText();
        return switch (name) {
            case RenderEnvironment.METADATA -> environment.metadata();
            case RenderEnvironment.CONTENT -> environment.content();
            default -> throw error(ctx, "unknown name '" + name + "', only metadata and content are bound");
        };
    }

    private TemplateException error(ParserRuleContext ctx, String message) {
        return new TemplateException("Template " + templateName + " at "
            + ctx.getStart().getLine() + ":" + ctx.getStart().getCharPositionInLine() + ": " + message);
    }

    /**
     * Strips the quotes of a string literal and resolves backslash escapes.
     */
    static String unquote(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                out.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                default -> out.append(next);
            }
        }
        return out.toString();
    }
}
