package org.logic.parser;

/**
 * Modalità grammaticali del parser.
 *
 * PRECEDENCE è la grammatica di riferimento: ¬ più stretto, ∧/∨ allo stesso livello e
 * associativi a sinistra, → più largo e associativo a destra.
 *
 * STRICT riproduce la variante restrittiva: ogni livello di parentesi (incluso quello
 * esterno) può contenere al più un operatore binario fuori dalle parentesi annidate.
 * Ogni formula accettata in STRICT produce lo stesso albero che in PRECEDENCE.
 */
public enum GrammarMode {
    PRECEDENCE,
    STRICT;

    /**
     * Risolve il nome usato da linea di comando ("precedence", "strict").
     *
     * @throws IllegalArgumentException se il nome non corrisponde ad alcuna modalità
     */
    public static GrammarMode fromName(String name) {
        if (name != null) {
            for (GrammarMode mode : values()) {
                if (mode.name().equalsIgnoreCase(name.trim())) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Modalità grammaticale sconosciuta: " + name +
                ". Supportate: precedence, strict");
    }
}
