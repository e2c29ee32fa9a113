package org.logic.deduction;

import java.util.List;

/**
 * Forma dei riferimenti richiesta da una regola: numero e tipo (riga o intervallo)
 * di ciascuna posizione.
 */
public enum ReferenceShape {
    NONE(),
    LINE(false),
    LINE_LINE(false, false),
    RANGE(true),
    LINE_RANGE_RANGE(false, true, true);

    /** Per ogni posizione, true se è richiesto un intervallo */
    private final boolean[] ranges;

    ReferenceShape(boolean... ranges) {
        this.ranges = ranges;
    }

    public int arity() {
        return ranges.length;
    }

    /**
     * @return numero di riferimenti a riga singola richiesti
     */
    public int lineCount() {
        int count = 0;
        for (boolean range : ranges) {
            if (!range) count++;
        }
        return count;
    }

    public boolean matches(List<Reference> references) {
        if (references.size() != ranges.length) {
            return false;
        }
        for (int i = 0; i < ranges.length; i++) {
            if (references.get(i).range() != ranges[i]) {
                return false;
            }
        }
        return true;
    }
}
