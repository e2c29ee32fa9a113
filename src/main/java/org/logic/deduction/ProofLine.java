package org.logic.deduction;

import org.logic.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Riga accettata di una prova. Creata al momento dell'accettazione e mai modificata.
 *
 * @param number numero di riga, strettamente crescente nella prova
 * @param formula formula derivata
 * @param rule nome della regola applicata
 * @param references riferimenti della giustificazione
 * @param depth profondità di scope al momento della derivazione
 * @param assumption true se la riga è l'assunzione del proprio frame
 * @param scopeId identificatore del frame in cui la riga è stata derivata
 */
public record ProofLine(int number, Formula formula, String rule, List<Reference> references,
                        int depth, boolean assumption, int scopeId) {

    public ProofLine {
        if (number <= 0) {
            throw new IllegalArgumentException("Numero di riga non positivo: " + number);
        }
        if (formula == null || rule == null) {
            throw new IllegalArgumentException("Formula e regola non possono essere null");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Profondità negativa: " + depth);
        }
        references = Collections.unmodifiableList(new ArrayList<>(references));
    }
}
