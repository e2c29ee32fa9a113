package org.logic.error;

/**
 * Carattere non appartenente all'alfabeto delle formule.
 */
public class LexicalException extends LogicException {

    public LexicalException(String message) {
        super(ErrorKind.LEXICAL, message);
    }

    public LexicalException(String message, Throwable cause) {
        super(ErrorKind.LEXICAL, message, cause);
    }
}
