package org.logic.error;

/**
 * ECCEZIONE LOGICA - Radice della tassonomia degli errori classificati
 *
 * Tutte le operazioni pubbliche del workbench convertono queste eccezioni in risultati
 * definiti (esito positivo o fallimento classificato): nessuna eccezione controllata
 * oltrepassa il confine delle API di alto livello.
 */
public abstract class LogicException extends Exception {

    private final ErrorKind kind;

    protected LogicException(ErrorKind kind, String message) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("Tipo di errore non può essere null");
        }
        this.kind = kind;
    }

    protected LogicException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("Tipo di errore non può essere null");
        }
        this.kind = kind;
    }

    /**
     * @return categoria dell'errore
     */
    public ErrorKind getKind() {
        return kind;
    }
}
