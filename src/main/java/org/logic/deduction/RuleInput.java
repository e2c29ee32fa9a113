package org.logic.deduction;

import org.logic.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ingresso uniforme di una regola di inferenza: la formula da giustificare, le formule
 * delle righe referenziate, le sottoprove referenziate e la profondità corrente.
 *
 * @param current formula della riga in verifica
 * @param lines formule dei riferimenti a riga singola, nell'ordine della giustificazione
 * @param subproofs sottoprove dei riferimenti a intervallo, nell'ordine della giustificazione
 * @param depth profondità di scope corrente
 */
public record RuleInput(Formula current, List<Formula> lines, List<Subproof> subproofs, int depth) {

    public RuleInput {
        if (current == null) {
            throw new IllegalArgumentException("Formula corrente non può essere null");
        }
        lines = Collections.unmodifiableList(new ArrayList<>(lines));
        subproofs = Collections.unmodifiableList(new ArrayList<>(subproofs));
    }

    public Formula line(int index) {
        return lines.get(index);
    }

    public Subproof subproof(int index) {
        return subproofs.get(index);
    }
}
