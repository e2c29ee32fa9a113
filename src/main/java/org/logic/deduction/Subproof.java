package org.logic.deduction;

import org.logic.support.ScopeFrame;

/**
 * Sottoprova chiusa individuata da un riferimento a intervallo.
 *
 * @param assumption prima riga, assunzione del frame
 * @param conclusion ultima riga, conclusione della sottoprova
 * @param frame frame chiuso che contiene entrambe le righe
 */
public record Subproof(ProofLine assumption, ProofLine conclusion, ScopeFrame frame) {

    public int start() {
        return assumption.number();
    }

    public int end() {
        return conclusion.number();
    }

    public boolean overlaps(Subproof other) {
        return Math.max(start(), other.start()) <= Math.min(end(), other.end());
    }
}
