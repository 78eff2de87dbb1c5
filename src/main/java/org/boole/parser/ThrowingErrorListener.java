package org.boole.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.boole.support.ExpressionSyntaxException;

/**
 * Listener ANTLR che trasforma il primo errore di lessico o sintassi in eccezione,
 * impedendo il recupero automatico e quindi alberi parziali.
 */
final class ThrowingErrorListener extends BaseErrorListener {

    private final String expression;

    ThrowingErrorListener(String expression) {
        this.expression = expression;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        throw new ExpressionSyntaxException(expression,
                "struttura non riconosciuta in posizione " + charPositionInLine + " (" + msg + ")");
    }
}
