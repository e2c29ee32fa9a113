package org.logic.horn;

import org.logic.formula.Formula;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * CLAUSOLA DI HORN - Coppia premessa → conclusione
 *
 * La premessa è un insieme di atomi (vuoto per ⊤), la conclusione è un atomo oppure ⊥.
 *
 * @param premise atomi della premessa, ordinati lessicograficamente
 * @param conclusion nome dell'atomo concluso, oppure {@link #BOTTOM}
 */
public record HornClause(Set<String> premise, String conclusion) {

    /** Marcatore della conclusione ⊥ */
    public static final String BOTTOM = Formula.Type.BOTTOM.symbol();

    public HornClause {
        if (premise == null || conclusion == null) {
            throw new IllegalArgumentException("Premessa e conclusione non possono essere null");
        }
        for (String atom : premise) {
            if (!Formula.isAtomName(atom)) {
                throw new IllegalArgumentException("Atomo di premessa non valido: " + atom);
            }
        }
        if (!BOTTOM.equals(conclusion) && !Formula.isAtomName(conclusion)) {
            throw new IllegalArgumentException("Conclusione non valida: " + conclusion);
        }
        premise = Collections.unmodifiableSet(new TreeSet<>(premise));
    }

    public static HornClause fact(String atom) {
        return new HornClause(Set.of(), atom);
    }

    public boolean concludesBottom() {
        return BOTTOM.equals(conclusion);
    }

    /**
     * Verifica se la clausola è soddisfatta dall'insieme di atomi veri indicato.
     */
    public boolean isSatisfiedBy(Set<String> trueAtoms) {
        if (!trueAtoms.containsAll(premise)) {
            return true;
        }
        return !concludesBottom() && trueAtoms.contains(conclusion);
    }

    @Override
    public String toString() {
        String left = premise.isEmpty()
                ? Formula.Type.TOP.symbol()
                : String.join(Formula.Type.AND.symbol(), premise);
        return left + Formula.Type.IMPLIES.symbol() + conclusion;
    }
}
