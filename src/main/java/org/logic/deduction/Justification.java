package org.logic.deduction;

import org.logic.error.SyntaxException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Giustificazione di una riga di prova: nome della regola seguito dai riferimenti,
 * nel formato "Regola, ref, ref".
 *
 * @param ruleName nome della regola, così come compare nel testo
 * @param references riferimenti in ordine
 */
public record Justification(String ruleName, List<Reference> references) {

    public Justification {
        if (ruleName == null || ruleName.isBlank()) {
            throw new IllegalArgumentException("Nome della regola mancante");
        }
        references = Collections.unmodifiableList(new ArrayList<>(references));
    }

    /**
     * @throws SyntaxException se il nome della regola manca o un riferimento è malformato
     */
    public static Justification parse(String text) throws SyntaxException {
        String[] parts = text.split(",", -1);
        String ruleName = parts[0].trim();
        if (ruleName.isEmpty()) {
            throw new SyntaxException("Giustificazione senza nome di regola: '" + text + "'");
        }

        List<Reference> references = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            references.add(Reference.parse(parts[i]));
        }
        return new Justification(ruleName, references);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(ruleName);
        for (Reference reference : references) {
            builder.append(", ").append(reference);
        }
        return builder.toString();
    }
}
