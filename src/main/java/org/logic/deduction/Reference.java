package org.logic.deduction;

import org.logic.error.SyntaxException;

/**
 * Riferimento di una giustificazione: una singola riga "n" oppure un intervallo "s-e"
 * che delimita una sottoprova chiusa.
 *
 * @param start prima riga (coincide con end per i riferimenti a riga singola)
 * @param end ultima riga
 * @param range true per gli intervalli
 */
public record Reference(int start, int end, boolean range) {

    public Reference {
        if (start <= 0 || end <= 0) {
            throw new IllegalArgumentException("Numero di riga non positivo: " + start + "-" + end);
        }
        if (!range && start != end) {
            throw new IllegalArgumentException("Riferimento a riga singola con estremi diversi");
        }
    }

    public static Reference line(int number) {
        return new Reference(number, number, false);
    }

    public static Reference range(int start, int end) {
        return new Reference(start, end, true);
    }

    /**
     * Analizza un riferimento testuale.
     *
     * @param text "n" oppure "s-e", spazi esterni ignorati
     * @throws SyntaxException se il testo non è un numero o un intervallo di numeri positivi
     */
    public static Reference parse(String text) throws SyntaxException {
        String trimmed = text.trim();
        int dash = trimmed.indexOf('-');

        try {
            if (dash < 0) {
                return line(parsePositive(trimmed));
            }
            return range(parsePositive(trimmed.substring(0, dash).trim()),
                    parsePositive(trimmed.substring(dash + 1).trim()));
        } catch (NumberFormatException e) {
            throw new SyntaxException("Riferimento non valido: '" + trimmed + "'", e);
        }
    }

    private static int parsePositive(String digits) {
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            throw new NumberFormatException("non numerico: '" + digits + "'");
        }
        int value = Integer.parseInt(digits);
        if (value <= 0) {
            throw new NumberFormatException("riga non positiva: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return range ? start + "-" + end : String.valueOf(start);
    }
}
