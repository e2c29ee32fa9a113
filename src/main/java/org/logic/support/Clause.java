package org.logic.support;

import org.logic.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLAUSOLA - Disgiunzione ordinata di letterali
 *
 * I letterali sono deduplicati per identità preservando l'ordine della prima apparizione.
 * Un atomo e la sua negazione possono coesistere: le tautologie non vengono eliminate.
 * La clausola vuota rappresenta ⊥.
 */
public final class Clause {

    private static final Clause EMPTY = new Clause(List.of());

    private final List<Literal> literals;

    private Clause(List<Literal> literals) {
        this.literals = literals;
    }

    /**
     * Costruisce una clausola deduplicando i letterali per identità.
     */
    public static Clause of(List<Literal> literals) {
        if (literals == null) {
            throw new IllegalArgumentException("Lista letterali non può essere null");
        }
        Map<String, Literal> unique = new LinkedHashMap<>();
        for (Literal literal : literals) {
            if (literal == null) {
                throw new IllegalArgumentException("Letterale null nella clausola");
            }
            unique.putIfAbsent(literal.identity(), literal);
        }
        return new Clause(Collections.unmodifiableList(new ArrayList<>(unique.values())));
    }

    public static Clause of(Literal... literals) {
        return of(List.of(literals));
    }

    public static Clause empty() {
        return EMPTY;
    }

    /**
     * Unisce due clausole: concatenazione dei letterali e deduplicazione.
     */
    public Clause combine(Clause other) {
        List<Literal> combined = new ArrayList<>(literals.size() + other.literals.size());
        combined.addAll(literals);
        combined.addAll(other.literals);
        return of(combined);
    }

    public List<Literal> getLiterals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    /**
     * Una clausola è vera se almeno un letterale è vero; la clausola vuota è falsa.
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        for (Literal literal : literals) {
            if (literal.evaluate(assignment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Disgiunzione associata a sinistra dei letterali, ⊥ per la clausola vuota.
     */
    public Formula toFormula() {
        if (literals.isEmpty()) {
            return Formula.bottom();
        }
        Formula result = literals.get(0).toFormula();
        for (int i = 1; i < literals.size(); i++) {
            result = Formula.or(result, literals.get(i).toFormula());
        }
        return result;
    }

    /**
     * Letterali uniti da ∨ senza spazi; ⊥ per la clausola vuota.
     */
    public String format() {
        if (literals.isEmpty()) {
            return Formula.Type.BOTTOM.symbol();
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < literals.size(); i++) {
            if (i > 0) {
                builder.append(Formula.Type.OR.symbol());
            }
            builder.append(literals.get(i).identity());
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Clause)) return false;
        return literals.equals(((Clause) obj).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
