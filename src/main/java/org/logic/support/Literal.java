package org.logic.support;

import org.logic.formula.Formula;

import java.util.Map;

/**
 * LETTERALE - Atomo o atomo negato all'interno di una clausola CNF
 *
 * L'identità del letterale è il nome per un letterale positivo e "¬nome" per uno
 * negativo: è la chiave usata per la deduplicazione all'interno delle clausole.
 *
 * @param atom nome dell'atomo (singola lettera minuscola)
 * @param negated true per il letterale negativo
 */
public record Literal(String atom, boolean negated) {

    public Literal {
        if (!Formula.isAtomName(atom)) {
            throw new IllegalArgumentException("Nome atomo non valido per letterale: " + atom);
        }
    }

    public static Literal positive(String atom) {
        return new Literal(atom, false);
    }

    public static Literal negative(String atom) {
        return new Literal(atom, true);
    }

    /**
     * Costruisce il letterale corrispondente a un nodo ATOM o NOT(ATOM).
     *
     * @throws IllegalArgumentException se la formula non è un letterale
     */
    public static Literal fromFormula(Formula formula) {
        if (formula == null || !formula.isLiteral()) {
            throw new IllegalArgumentException("La formula non è un letterale: " + formula);
        }
        return formula.is(Formula.Type.ATOM)
                ? positive(formula.getName())
                : negative(formula.getOperand().getName());
    }

    /**
     * Chiave di deduplicazione: "p" oppure "¬p".
     */
    public String identity() {
        return negated ? "¬" + atom : atom;
    }

    public boolean evaluate(Map<String, Boolean> assignment) {
        Boolean value = assignment.get(atom);
        if (value == null) {
            throw new IllegalArgumentException("Atomo non assegnato: " + atom);
        }
        return negated != value;
    }

    public Formula toFormula() {
        Formula atomNode = Formula.atom(atom);
        return negated ? Formula.not(atomNode) : atomNode;
    }

    @Override
    public String toString() {
        return identity();
    }
}
