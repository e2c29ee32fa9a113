package org.logic.support;

import org.logic.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * FORMULA CNF - Sequenza di clausole combinate in congiunzione
 *
 * Rappresentazione a clausole prodotta dal CNFConverter. La sequenza vuota denota la
 * formula banalmente vera; una clausola vuota al suo interno denota ⊥.
 *
 * OPERAZIONI DI COMBINAZIONE:
 * • concatenate: congiunzione, le sequenze di clausole vengono accodate
 * • distribute: disgiunzione, prodotto cartesiano delle clausole a coppie
 *
 * FORMATO OUTPUT:
 * • Clausole unite da ∧, letterali uniti da ∨, senza spazi
 * • Clausole con più di un letterale tra parentesi, a meno che la formula abbia
 *   esattamente una clausola
 * • Stringa vuota per la formula senza clausole
 */
public final class CNFFormula {

    private static final Logger LOGGER = Logger.getLogger(CNFFormula.class.getName());

    private static final CNFFormula TRUE = new CNFFormula(List.of());

    /** Clausole in ordine di produzione, immutabili dopo la costruzione */
    private final List<Clause> clauses;

    private CNFFormula(List<Clause> clauses) {
        this.clauses = clauses;
    }

    //region COSTRUZIONE

    public static CNFFormula of(List<Clause> clauses) {
        if (clauses == null || clauses.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista clausole non può essere null o contenere null");
        }
        return new CNFFormula(Collections.unmodifiableList(new ArrayList<>(clauses)));
    }

    public static CNFFormula of(Clause... clauses) {
        return of(List.of(clauses));
    }

    /**
     * Formula senza clausole (⊤).
     */
    public static CNFFormula empty() {
        return TRUE;
    }

    /**
     * Formula con la sola clausola vuota (⊥).
     */
    public static CNFFormula contradiction() {
        return of(Clause.empty());
    }

    public static CNFFormula ofLiteral(Literal literal) {
        return of(Clause.of(literal));
    }

    //endregion

    //region COMBINAZIONE

    /**
     * CNF di una congiunzione: concatenazione delle sequenze di clausole.
     */
    public CNFFormula concatenate(CNFFormula other) {
        List<Clause> combined = new ArrayList<>(clauses.size() + other.clauses.size());
        combined.addAll(clauses);
        combined.addAll(other.clauses);
        return of(combined);
    }

    /**
     * CNF di una disgiunzione: prodotto cartesiano delle clausole.
     *
     * (C1 ∧ C2) ∨ (D1 ∧ D2) → (C1∨D1) ∧ (C1∨D2) ∧ (C2∨D1) ∧ (C2∨D2)
     *
     * Il numero di clausole prodotte è |this| × |other|: la crescita esponenziale nel
     * caso peggiore è una proprietà nota della conversione per distribuzione.
     */
    public CNFFormula distribute(CNFFormula other) {
        List<Clause> product = new ArrayList<>(clauses.size() * other.clauses.size());
        for (Clause left : clauses) {
            for (Clause right : other.clauses) {
                product.add(left.combine(right));
            }
        }

        if (product.size() > 1024) {
            LOGGER.fine("Distribuzione con " + product.size() + " clausole prodotte");
        }
        return of(product);
    }

    //endregion

    //region INTERROGAZIONI

    public List<Clause> getClauses() {
        return clauses;
    }

    public int getClausesCount() {
        return clauses.size();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /**
     * Atomi menzionati nelle clausole, in ordine lessicografico.
     */
    public Set<String> atoms() {
        Set<String> atoms = new TreeSet<>();
        for (Clause clause : clauses) {
            for (Literal literal : clause.getLiterals()) {
                atoms.add(literal.atom());
            }
        }
        return atoms;
    }

    /**
     * Vera se ogni clausola è vera; la formula vuota è vera.
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        for (Clause clause : clauses) {
            if (!clause.evaluate(assignment)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Ricostruisce una {@link Formula}: congiunzione associata a sinistra delle clausole,
     * ⊤ per la formula vuota.
     */
    public Formula toFormula() {
        if (clauses.isEmpty()) {
            return Formula.top();
        }
        Formula result = clauses.get(0).toFormula();
        for (int i = 1; i < clauses.size(); i++) {
            result = Formula.and(result, clauses.get(i).toFormula());
        }
        return result;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Formato di output delle formule CNF.
     */
    public String format() {
        if (clauses.isEmpty()) {
            return "";
        }

        boolean singleClause = clauses.size() == 1;
        StringBuilder builder = new StringBuilder();

        for (int i = 0; i < clauses.size(); i++) {
            if (i > 0) {
                builder.append(Formula.Type.AND.symbol());
            }

            Clause clause = clauses.get(i);
            if (clause.size() > 1 && !singleClause) {
                builder.append('(').append(clause.format()).append(')');
            } else {
                builder.append(clause.format());
            }
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CNFFormula)) return false;
        return clauses.equals(((CNFFormula) obj).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }

    //endregion
}
