package org.logic.deduction;

import org.logic.error.SemanticException;
import org.logic.formula.Formula;

import java.util.List;

/**
 * Regola in forma produttiva: dalle premesse calcola la formula derivata.
 */
@FunctionalInterface
public interface Derivation {

    /**
     * @param premises formule referenziate, nell'ordine della giustificazione
     * @return formula derivata
     * @throws SemanticException se le premesse non hanno la forma richiesta
     */
    Formula derive(List<Formula> premises) throws SemanticException;
}
