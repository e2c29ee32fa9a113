package org.logic.deduction;

import org.logic.error.LogicException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RISULTATO DELLA VALIDAZIONE - Esito di una prova di deduzione naturale
 *
 * Una prova valida porta tutte le righe accettate; una prova non valida porta anche il
 * numero della prima riga rifiutata e la causa classificata.
 *
 * FORMATO OUTPUT (render):
 * • "Valid Deduction"
 * • "Invalid Deduction at Line N"
 */
public final class DeductionResult {

    private final boolean valid;
    private final int failingLine;
    private final LogicException cause;
    private final List<ProofLine> acceptedLines;

    private DeductionResult(boolean valid, int failingLine, LogicException cause, List<ProofLine> acceptedLines) {
        this.valid = valid;
        this.failingLine = failingLine;
        this.cause = cause;
        this.acceptedLines = Collections.unmodifiableList(new ArrayList<>(acceptedLines));
    }

    public static DeductionResult valid(List<ProofLine> acceptedLines) {
        return new DeductionResult(true, 0, null, acceptedLines);
    }

    public static DeductionResult invalidAt(int failingLine, LogicException cause, List<ProofLine> acceptedLines) {
        if (failingLine <= 0 || cause == null) {
            throw new IllegalArgumentException("Fallimento richiede riga positiva e causa: " + failingLine);
        }
        return new DeductionResult(false, failingLine, cause, acceptedLines);
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @throws IllegalStateException se la prova è valida
     */
    public int getFailingLine() {
        if (valid) {
            throw new IllegalStateException("Prova valida: nessuna riga rifiutata");
        }
        return failingLine;
    }

    /**
     * @return causa del rifiuto, null per una prova valida
     */
    public LogicException getCause() {
        return cause;
    }

    public List<ProofLine> getAcceptedLines() {
        return acceptedLines;
    }

    public String render() {
        return valid ? "Valid Deduction" : "Invalid Deduction at Line " + failingLine;
    }

    @Override
    public String toString() {
        if (valid) {
            return "DeductionResult{valida, righe=" + acceptedLines.size() + "}";
        }
        return "DeductionResult{riga " + failingLine + ", " + cause.getKind() + ": " + cause.getMessage() + "}";
    }
}
