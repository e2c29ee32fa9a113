package org.logic.deduction;

import org.logic.error.LogicException;
import org.logic.formula.Formula;

/**
 * Esito dell'applicazione di una regola singola: la formula derivata oppure il rifiuto
 * con la sua causa. In output il rifiuto diventa "Rule Cannot Be Applied".
 */
public final class RuleApplication {

    private final Formula result;
    private final LogicException cause;

    private RuleApplication(Formula result, LogicException cause) {
        this.result = result;
        this.cause = cause;
    }

    public static RuleApplication applied(Formula result) {
        if (result == null) {
            throw new IllegalArgumentException("Formula derivata non può essere null");
        }
        return new RuleApplication(result, null);
    }

    public static RuleApplication rejected(LogicException cause) {
        if (cause == null) {
            throw new IllegalArgumentException("Causa del rifiuto non può essere null");
        }
        return new RuleApplication(null, cause);
    }

    public boolean isApplied() {
        return result != null;
    }

    /**
     * @return formula derivata, null se la regola è stata rifiutata
     */
    public Formula getResult() {
        return result;
    }

    public LogicException getCause() {
        return cause;
    }

    public String render() {
        return isApplied() ? result.toString() : "Rule Cannot Be Applied";
    }

    @Override
    public String toString() {
        return isApplied() ? "RuleApplication{" + result + "}" : "RuleApplication{rifiutata: " + cause.getMessage() + "}";
    }
}
