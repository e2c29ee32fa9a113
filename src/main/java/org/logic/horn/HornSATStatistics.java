package org.logic.horn;

/**
 * STATISTICHE HORN-SAT - Metriche di una singola esecuzione del marking
 *
 * Raccoglie dimensioni dell'istanza, lavoro di propagazione e tempo di esecuzione.
 * Il timer parte alla costruzione e viene fermato dal solver al termine.
 */
public class HornSATStatistics {

    //region CONTATORI

    /** Numero di clausole dell'istanza */
    private int clauses = 0;

    /** Numero di atomi distinti menzionati dalle clausole */
    private int atoms = 0;

    /** Atomi marcati veri durante la propagazione */
    private int propagations = 0;

    /** Clausole la cui premessa è stata interamente soddisfatta */
    private int firedClauses = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public HornSATStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region AGGIORNAMENTO

    void setInstanceSize(int clauses, int atoms) {
        if (clauses < 0 || atoms < 0) {
            throw new IllegalArgumentException("Dimensioni istanza negative: " + clauses + ", " + atoms);
        }
        this.clauses = clauses;
        this.atoms = atoms;
    }

    void incrementPropagations() {
        propagations++;
    }

    void incrementFiredClauses() {
        firedClauses++;
    }

    /**
     * Ferma la misurazione del tempo. Chiamate successive non hanno effetto.
     */
    void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public int getClauses() {
        return clauses;
    }

    public int getAtoms() {
        return atoms;
    }

    public int getPropagations() {
        return propagations;
    }

    public int getFiredClauses() {
        return firedClauses;
    }

    /**
     * @return tempo di esecuzione in ms, parziale se il timer è ancora attivo
     */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("HornSATStatistics{clausole=%d, atomi=%d, propagazioni=%d, attivazioni=%d, tempo=%dms}",
                clauses, atoms, propagations, firedClauses, getExecutionTimeMs());
    }
}
