package org.logic.error;

/**
 * Regola sconosciuta, arità dei riferimenti errata o formula che non corrisponde alla regola.
 */
public class SemanticException extends LogicException {

    public SemanticException(String message) {
        super(ErrorKind.SEMANTIC, message);
    }

    public SemanticException(String message, Throwable cause) {
        super(ErrorKind.SEMANTIC, message, cause);
    }
}
