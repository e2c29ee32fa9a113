package org.logic.support;

import org.logic.error.ScopeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * SCOPE STACK - Pila immutabile degli scope aperti di una prova
 *
 * Modella esplicitamente come valore la pila degli scope, così che l'accessibilità di
 * una riga sia una funzione pura di (riga, pila corrente).
 *
 * ORGANIZZAZIONE:
 * • Indice 0: frame radice (profondità 0), sempre presente e mai rimosso
 * • Indice i>0: scope aperto da un BeginScope, profondità i
 *
 * OPERAZIONI:
 * • push: apertura di un nuovo scope figlio del frame in cima
 * • pop: chiusura dello scope in cima (errore se si tenta di chiudere la radice)
 * • isOpen: interrogazione dell'apertura di un frame
 *
 * Ogni operazione restituisce una nuova pila: le istanze non cambiano mai.
 */
public final class ScopeStack {

    private static final Logger LOGGER = Logger.getLogger(ScopeStack.class.getName());

    private static final ScopeStack ROOT = new ScopeStack(List.of(ScopeFrame.root()));

    /** Frame aperti, dalla radice alla cima */
    private final List<ScopeFrame> frames;

    private ScopeStack(List<ScopeFrame> frames) {
        this.frames = frames;
    }

    /**
     * Pila iniziale di ogni prova: solo il frame radice.
     */
    public static ScopeStack root() {
        return ROOT;
    }

    //region OPERAZIONI DI APERTURA E CHIUSURA

    /**
     * Apre un nuovo scope figlio del frame corrente.
     *
     * @param frameId identificatore del nuovo frame (positivo, mai usato nella pila)
     * @return nuova pila con il frame aggiunto in cima
     */
    public ScopeStack push(int frameId) {
        if (frameId <= ScopeFrame.ROOT_ID || isOpen(frameId)) {
            throw new IllegalArgumentException("Identificatore di frame non valido: " + frameId);
        }

        List<ScopeFrame> extended = new ArrayList<>(frames);
        extended.add(new ScopeFrame(frameId, top().id(), depth() + 1));

        LOGGER.finest("Scope " + frameId + " aperto a profondità " + (depth() + 1));
        return new ScopeStack(Collections.unmodifiableList(extended));
    }

    /**
     * Chiude lo scope in cima.
     *
     * @return nuova pila senza il frame in cima
     * @throws ScopeException se la pila contiene solo la radice
     */
    public ScopeStack pop() throws ScopeException {
        if (frames.size() <= 1) {
            throw new ScopeException("EndScope senza BeginScope corrispondente");
        }

        LOGGER.finest("Scope " + top().id() + " chiuso a profondità " + depth());
        return new ScopeStack(Collections.unmodifiableList(new ArrayList<>(frames.subList(0, frames.size() - 1))));
    }

    //endregion

    //region INTERROGAZIONI

    public int depth() {
        return frames.size() - 1;
    }

    public ScopeFrame top() {
        return frames.get(frames.size() - 1);
    }

    /**
     * @return true se il frame indicato è ancora aperto
     */
    public boolean isOpen(int frameId) {
        for (ScopeFrame frame : frames) {
            if (frame.id() == frameId) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScopeStack)) return false;
        return frames.equals(((ScopeStack) obj).frames);
    }

    @Override
    public int hashCode() {
        return frames.hashCode();
    }

    @Override
    public String toString() {
        return "ScopeStack" + frames;
    }

    //endregion
}
