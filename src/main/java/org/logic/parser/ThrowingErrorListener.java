package org.logic.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Listener ANTLR che interrompe lexing e parsing al primo errore.
 *
 * Sostituisce il ConsoleErrorListener di default: nessun messaggio su stderr e nessun
 * tentativo di recupero, così il chiamante ottiene un albero completo oppure nulla.
 */
final class ThrowingErrorListener extends BaseErrorListener {

    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        throw new ParseCancellationException("posizione " + charPositionInLine + ": " + msg, e);
    }
}
