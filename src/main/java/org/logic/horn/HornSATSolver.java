package org.logic.horn;

import org.logic.error.LogicException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * SOLUTORE HORN-SAT - Algoritmo di marking con propagazione a worklist
 *
 * Decide la soddisfacibilità di una congiunzione di clausole di Horn in tempo lineare
 * nella dimensione dell'istanza.
 *
 * ALGORITMO:
 * 1. Ogni clausola mantiene il numero di atomi di premessa non ancora marcati
 * 2. Le clausole con premessa vuota (⊤) attivano subito la loro conclusione
 * 3. Ogni atomo marcato entra nella worklist una sola volta; estrarlo decrementa il
 *    contatore delle clausole che lo menzionano in premessa
 * 4. Una clausola il cui contatore arriva a 0 marca la propria conclusione
 *
 * DECISIONE:
 * • Unsatisfiable se una clausola con conclusione ⊥ arriva a contatore 0
 * • Satisfiable altrimenti, e l'insieme marcato è il modello minimo
 *
 * L'insieme marcato finale coincide con il punto fisso della scansione ripetuta
 * ed è indipendente dall'ordine delle clausole.
 */
public class HornSATSolver {

    private static final Logger LOGGER = Logger.getLogger(HornSATSolver.class.getName());

    //region INTERFACCIA PUBBLICA

    /**
     * Analizza e risolve una formula di Horn in forma testuale.
     *
     * @param text formula nel formato "premessa→conclusione" o "(c)∧(c)…"
     * @return esito della decisione, INVALID se il testo è fuori dal frammento
     */
    public HornSATResult solve(String text) {
        List<HornClause> clauses;
        try {
            clauses = HornParser.parse(text);
        } catch (LogicException e) {
            LOGGER.warning("Formula Horn rifiutata: " + e.getMessage());
            return HornSATResult.invalid(e);
        }
        return solve(clauses);
    }

    /**
     * Esegue il marking sulle clausole date.
     *
     * @param clauses clausole di Horn (non null, eventualmente vuota)
     * @return esito SATISFIABLE o UNSATISFIABLE
     */
    public HornSATResult solve(List<HornClause> clauses) {
        if (clauses == null || clauses.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista clausole non può essere null o contenere null");
        }

        HornSATStatistics statistics = new HornSATStatistics();
        statistics.setInstanceSize(clauses.size(), countAtoms(clauses));

        Set<String> marked = new TreeSet<>();
        boolean bottomReached = propagate(clauses, marked, statistics);
        statistics.stopTimer();

        HornSATResult result = bottomReached
                ? HornSATResult.unsatisfiable(marked, statistics)
                : HornSATResult.satisfiable(marked, statistics);

        LOGGER.info("Horn-SAT completato: " + result);
        return result;
    }

    //endregion

    //region PROPAGAZIONE

    /**
     * Calcola il punto fisso del marking.
     *
     * @return true se una clausola con conclusione ⊥ è stata attivata
     */
    private boolean propagate(List<HornClause> clauses, Set<String> marked, HornSATStatistics statistics) {
        int[] missing = new int[clauses.size()];
        Map<String, List<Integer>> watchers = new HashMap<>();
        Deque<String> worklist = new ArrayDeque<>();
        boolean bottomReached = false;

        for (int i = 0; i < clauses.size(); i++) {
            HornClause clause = clauses.get(i);
            missing[i] = clause.premise().size();
            for (String atom : clause.premise()) {
                watchers.computeIfAbsent(atom, key -> new ArrayList<>()).add(i);
            }
            if (missing[i] == 0) {
                bottomReached |= fire(clause, marked, worklist, statistics);
            }
        }

        while (!worklist.isEmpty()) {
            String atom = worklist.poll();
            for (int index : watchers.getOrDefault(atom, List.of())) {
                missing[index]--;
                if (missing[index] == 0) {
                    bottomReached |= fire(clauses.get(index), marked, worklist, statistics);
                }
            }
        }

        return bottomReached;
    }

    /**
     * Attiva una clausola con premessa interamente marcata.
     *
     * @return true se la conclusione è ⊥
     */
    private boolean fire(HornClause clause, Set<String> marked, Deque<String> worklist,
                         HornSATStatistics statistics) {
        statistics.incrementFiredClauses();

        if (clause.concludesBottom()) {
            LOGGER.fine("Clausola ⊥ attivata: " + clause);
            return true;
        }

        if (marked.add(clause.conclusion())) {
            statistics.incrementPropagations();
            worklist.add(clause.conclusion());
            LOGGER.finest("Atomo marcato: " + clause.conclusion());
        }
        return false;
    }

    private int countAtoms(List<HornClause> clauses) {
        Set<String> atoms = new TreeSet<>();
        for (HornClause clause : clauses) {
            atoms.addAll(clause.premise());
            if (!clause.concludesBottom()) {
                atoms.add(clause.conclusion());
            }
        }
        return atoms.size();
    }

    //endregion
}
