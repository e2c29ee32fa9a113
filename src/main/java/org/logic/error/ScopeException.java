package org.logic.error;

/**
 * Violazione delle regole di scope: marcatori sbilanciati o riferimenti non accessibili.
 */
public class ScopeException extends LogicException {

    public ScopeException(String message) {
        super(ErrorKind.SCOPE, message);
    }

    public ScopeException(String message, Throwable cause) {
        super(ErrorKind.SCOPE, message, cause);
    }
}
