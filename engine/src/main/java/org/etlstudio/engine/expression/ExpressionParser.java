package org.etlstudio.engine.expression;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Parses filter predicates and derive expressions with the ANTLR-generated
 * PipelineExpression lexer and parser.
 */
public final class ExpressionParser {

    private ExpressionParser() {
        // Static utility class
    }

    /**
     * Parses an expression string.
     *
     * @param text The expression text
     * @return The parsed expression
     * @throws ExpressionException if parsing fails
     */
    public static ScalarExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionException("Expression is empty");
        }
        PipelineExpressionLexer lexer = new PipelineExpressionLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PipelineExpressionParser parser = new PipelineExpressionParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());

        PipelineExpressionParser.ParseContext tree = parser.parse();
        return new ExpressionAstBuilder().visit(tree);
    }

    /**
     * Error listener that converts ANTLR errors to ExpressionException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new ExpressionException(
                    "Invalid expression at position " + charPositionInLine + ": " + msg);
        }
    }
}
