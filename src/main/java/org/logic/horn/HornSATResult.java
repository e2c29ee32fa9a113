package org.logic.horn;

import org.logic.error.LogicException;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * RISULTATO HORN-SAT - Esito immutabile di una decisione sul frammento di Horn
 *
 * ESITI POSSIBILI:
 * • SATISFIABLE: nessuna clausola ⊥ attivata, il modello minimo è l'insieme marcato
 * • UNSATISFIABLE: almeno una clausola ⊥ ha la premessa interamente marcata
 * • INVALID: il testo non appartiene al frammento di Horn, con la causa classificata
 *
 * FORMATO OUTPUT (render):
 * • "Satisfiable" oppure "Satisfiable p q" con gli atomi in ordine lessicografico
 * • "Unsatisfiable"
 * • "Invalid Horn Formula"
 */
public final class HornSATResult {

    public enum Verdict {
        SATISFIABLE, UNSATISFIABLE, INVALID
    }

    private final Verdict verdict;

    /** Modello minimo per SATISFIABLE, insieme marcato al termine per UNSATISFIABLE */
    private final Set<String> markedAtoms;

    private final HornSATStatistics statistics;

    /** Causa del rifiuto, solo per INVALID */
    private final LogicException cause;

    private HornSATResult(Verdict verdict, Set<String> markedAtoms, HornSATStatistics statistics,
                          LogicException cause) {
        this.verdict = verdict;
        this.markedAtoms = Collections.unmodifiableSet(new TreeSet<>(markedAtoms));
        this.statistics = statistics;
        this.cause = cause;
    }

    //region FACTORY METHODS

    public static HornSATResult satisfiable(Set<String> model, HornSATStatistics statistics) {
        if (model == null || statistics == null) {
            throw new IllegalArgumentException("Modello e statistiche non possono essere null");
        }
        return new HornSATResult(Verdict.SATISFIABLE, model, statistics, null);
    }

    public static HornSATResult unsatisfiable(Set<String> marked, HornSATStatistics statistics) {
        if (marked == null || statistics == null) {
            throw new IllegalArgumentException("Insieme marcato e statistiche non possono essere null");
        }
        return new HornSATResult(Verdict.UNSATISFIABLE, marked, statistics, null);
    }

    public static HornSATResult invalid(LogicException cause) {
        if (cause == null) {
            throw new IllegalArgumentException("Causa del rifiuto non può essere null");
        }
        return new HornSATResult(Verdict.INVALID, Set.of(), new HornSATStatistics(), cause);
    }

    //endregion

    //region ACCESSORS

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isSatisfiable() {
        return verdict == Verdict.SATISFIABLE;
    }

    public boolean isValidInput() {
        return verdict != Verdict.INVALID;
    }

    /**
     * @return atomi marcati veri, in ordine lessicografico; vuoto per INVALID
     */
    public Set<String> getMarkedAtoms() {
        return markedAtoms;
    }

    public HornSATStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return causa del rifiuto, null se l'input era valido
     */
    public LogicException getCause() {
        return cause;
    }

    //endregion

    //region OUTPUT

    public String render() {
        return switch (verdict) {
            case SATISFIABLE -> markedAtoms.isEmpty()
                    ? "Satisfiable"
                    : "Satisfiable " + String.join(" ", markedAtoms);
            case UNSATISFIABLE -> "Unsatisfiable";
            case INVALID -> "Invalid Horn Formula";
        };
    }

    @Override
    public String toString() {
        return String.format("HornSATResult{%s, marcati=%s, tempo=%dms}",
                verdict, markedAtoms, statistics.getExecutionTimeMs());
    }

    //endregion
}
