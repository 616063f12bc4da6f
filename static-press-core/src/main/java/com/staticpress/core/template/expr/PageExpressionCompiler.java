package com.staticpress.core.template.expr;

import com.staticpress.core.template.TemplateException;
import com.staticpress.parser.PageExpressionLexer;
import com.staticpress.parser.PageExpressionParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Parses page expression source with the ANTLR-generated {@link PageExpressionParser}.
 *
 * <p>The first syntax error aborts parsing with a {@link TemplateException} carrying the
 * template name, line and column. The returned tree is read-only and may be evaluated from
 * several threads.
 */
public final class PageExpressionCompiler {

    private PageExpressionCompiler() {
        // Utility class
    }

    /**
     * Parses a template.
     *
     * @param templateName name used in error messages
     * @param source page expression source
     * @return parse tree of the whole template
     * @throws TemplateException on the first syntax error
     */
    public static PageExpressionParser.TemplateContext parse(String templateName, String source) {
        FailFastErrorListener errorListener = new FailFastErrorListener(templateName);

        PageExpressionLexer lexer = new PageExpressionLexer(CharStreams.fromString(source, templateName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        PageExpressionParser parser = new PageExpressionParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        return parser.template();
    }

    /**
     * Turns the first reported syntax error into an exception.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        private final String templateName;

        private FailFastErrorListener(String templateName) {
            this.templateName = templateName;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new TemplateException("Syntax error in template " + templateName
                + " at " + line + ":" + charPositionInLine + ": " + msg, e);
        }
    }
}
