package org.logic.deduction;

import org.logic.error.ScopeException;
import org.logic.support.ScopeFrame;
import org.logic.support.ScopeStack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * STATO DELLA PROVA - Macchina a stati del validatore di deduzione naturale
 *
 * COMPONENTI:
 * • Pila corrente degli scope aperti ({@link ScopeStack}, valore immutabile)
 * • Registro di tutti i frame mai aperti, per verificare i riferimenti a intervallo
 * • Mappa append-only numero di riga → {@link ProofLine}
 * • Flag "assunzione richiesta" dopo ogni BeginScope
 * • Ultimo numero di riga accettato
 *
 * REGOLE DI ACCESSIBILITÀ:
 * • Riga singola: esiste, profondità ≤ profondità corrente, frame ancora aperto
 * • Intervallo s-e: entrambe le righe esistono, s ≤ e, stesso frame; il frame è chiuso,
 *   a profondità d+1, figlio diretto del frame corrente, e s è la sua assunzione
 */
public class ProofState {

    private static final Logger LOGGER = Logger.getLogger(ProofState.class.getName());

    private ScopeStack scopes = ScopeStack.root();

    /** Registro dei frame per identificatore, radice inclusa */
    private final Map<Integer, ScopeFrame> frames = new HashMap<>();

    /** Identificatore del frame → numero di riga della sua assunzione */
    private final Map<Integer, Integer> frameAssumptions = new HashMap<>();

    private final Map<Integer, ProofLine> lines = new LinkedHashMap<>();

    private boolean assumptionRequired = false;
    private int lastLineNumber = 0;
    private int nextFrameId = ScopeFrame.ROOT_ID + 1;

    public ProofState() {
        frames.put(ScopeFrame.ROOT_ID, scopes.top());
    }

    //region MARCATORI DI SCOPE

    /**
     * BeginScope: apre un frame figlio del frame corrente e richiede un'assunzione.
     *
     * @throws ScopeException se lo scope aperto in precedenza non ha ancora un'assunzione
     */
    public void beginScope() throws ScopeException {
        requireNoPendingAssumption("BeginScope");

        scopes = scopes.push(nextFrameId++);
        frames.put(scopes.top().id(), scopes.top());
        assumptionRequired = true;
    }

    /**
     * EndScope: chiude il frame corrente.
     *
     * @throws ScopeException se non ci sono scope aperti o lo scope non ha un'assunzione
     */
    public void endScope() throws ScopeException {
        requireNoPendingAssumption("EndScope");
        scopes = scopes.pop();
    }

    /**
     * @throws ScopeException se uno scope aperto attende ancora la propria assunzione
     */
    public void requireNoPendingAssumption(String context) throws ScopeException {
        if (assumptionRequired) {
            throw new ScopeException(context + ": lo scope " + scopes.top().id() + " non ha un'assunzione");
        }
    }

    //endregion

    //region RISOLUZIONE RIFERIMENTI

    /**
     * Risolve un riferimento a riga singola.
     *
     * @throws ScopeException se la riga non esiste o non è accessibile dallo scope corrente
     */
    public ProofLine resolveLine(int number) throws ScopeException {
        ProofLine line = lines.get(number);
        if (line == null) {
            throw new ScopeException("Riferimento a riga inesistente: " + number);
        }
        if (!isAccessible(line)) {
            throw new ScopeException("Riga " + number + " non accessibile: appartiene a uno scope chiuso");
        }
        return line;
    }

    public boolean isAccessible(ProofLine line) {
        return line.depth() <= scopes.depth() && scopes.isOpen(line.scopeId());
    }

    /**
     * Risolve un riferimento a intervallo in una sottoprova chiusa.
     *
     * @throws ScopeException se l'intervallo non individua una sottoprova chiusa figlia
     *                        diretta dello scope corrente
     */
    public Subproof resolveRange(Reference reference) throws ScopeException {
        ProofLine start = lines.get(reference.start());
        ProofLine end = lines.get(reference.end());

        if (start == null || end == null) {
            throw new ScopeException("Intervallo " + reference + " riferisce righe inesistenti");
        }
        if (reference.start() > reference.end()) {
            throw new ScopeException("Intervallo " + reference + " con estremi invertiti");
        }
        if (start.scopeId() != end.scopeId()) {
            throw new ScopeException("Intervallo " + reference + " attraversa scope diversi");
        }

        ScopeFrame frame = frames.get(start.scopeId());
        if (frame.isRoot() || scopes.isOpen(frame.id())) {
            throw new ScopeException("Intervallo " + reference + " non individua uno scope chiuso");
        }
        if (frame.depth() != scopes.depth() + 1 || frame.parentId() != scopes.top().id()) {
            throw new ScopeException("Intervallo " + reference + " non è una sottoprova diretta dello scope corrente");
        }

        Integer assumption = frameAssumptions.get(frame.id());
        if (assumption == null || assumption != reference.start() || !start.assumption()) {
            throw new ScopeException("Intervallo " + reference + " non inizia con l'assunzione dello scope");
        }

        return new Subproof(start, end, frame);
    }

    //endregion

    //region ACCETTAZIONE RIGHE

    /**
     * Registra una riga accettata. La riga deve appartenere al frame corrente.
     */
    public void accept(ProofLine line) {
        if (line.number() <= lastLineNumber) {
            throw new IllegalStateException("Numero di riga non crescente: " + line.number());
        }
        if (line.scopeId() != scopes.top().id()) {
            throw new IllegalStateException("Riga " + line.number() + " fuori dal frame corrente");
        }

        lines.put(line.number(), line);
        lastLineNumber = line.number();

        if (line.assumption()) {
            frameAssumptions.put(line.scopeId(), line.number());
            assumptionRequired = false;
        }
        LOGGER.finest("Riga accettata: " + line.number() + " " + line.formula() + " [" + line.rule() + "]");
    }

    //endregion

    //region INTERROGAZIONI

    public int depth() {
        return scopes.depth();
    }

    public int currentFrameId() {
        return scopes.top().id();
    }

    public boolean isAssumptionRequired() {
        return assumptionRequired;
    }

    public int getLastLineNumber() {
        return lastLineNumber;
    }

    public List<ProofLine> getLines() {
        return Collections.unmodifiableList(new ArrayList<>(lines.values()));
    }

    //endregion
}
