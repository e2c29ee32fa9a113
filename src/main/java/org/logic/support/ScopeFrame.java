package org.logic.support;

/**
 * Frame di scope di una prova: identificatore, frame genitore e profondità.
 *
 * @param id identificatore univoco nella prova (0 per il frame radice)
 * @param parentId identificatore del frame che lo contiene, -1 per la radice
 * @param depth profondità di annidamento (0 per la radice)
 */
public record ScopeFrame(int id, int parentId, int depth) {

    public static final int ROOT_ID = 0;

    public ScopeFrame {
        if (id < 0 || depth < 0) {
            throw new IllegalArgumentException("Frame di scope malformato: id=" + id + ", depth=" + depth);
        }
        if ((id == ROOT_ID) != (depth == 0)) {
            throw new IllegalArgumentException("Solo il frame radice ha profondità 0");
        }
    }

    public static ScopeFrame root() {
        return new ScopeFrame(ROOT_ID, -1, 0);
    }

    public boolean isRoot() {
        return id == ROOT_ID;
    }
}
