package org.logic.error;

/**
 * Struttura non riconosciuta: parentesi, operandi, token residui o giustificazioni malformate.
 */
public class SyntaxException extends LogicException {

    public SyntaxException(String message) {
        super(ErrorKind.SYNTAX, message);
    }

    public SyntaxException(String message, Throwable cause) {
        super(ErrorKind.SYNTAX, message, cause);
    }
}
