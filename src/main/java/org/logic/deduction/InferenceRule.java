package org.logic.deduction;

import org.logic.error.LogicException;

/**
 * Verifica di una regola di inferenza su un ingresso già risolto.
 */
@FunctionalInterface
public interface InferenceRule {

    /**
     * @throws LogicException se la formula corrente non è giustificata dalla regola
     */
    void check(RuleInput input) throws LogicException;
}
