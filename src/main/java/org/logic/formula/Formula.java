package org.logic.formula;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile condiviso da tutti i moduli
 *
 * Rappresenta una formula della logica proposizionale come variante etichettata:
 * ogni nodo ha un {@link Type} e, a seconda dell'arità del tipo, zero, uno o due figli.
 * I nodi sono immutabili e costruiti esclusivamente tramite factory methods validanti.
 *
 * TIPI DI NODO:
 * • ATOM: variabile proposizionale, una singola lettera minuscola
 * • TOP / BOTTOM: costanti ⊤ e ⊥
 * • NOT: negazione, un operando
 * • AND / OR / IMPLIES: connettivi binari, operando sinistro e destro
 *
 * INVARIANTI MANTENUTE:
 * • Ogni nodo interno ha esattamente tanti figli quanti ne richiede il suo tipo, mai null
 * • L'albero è aciclico (immutabilità + costruzione bottom-up)
 * • L'uguaglianza è strutturale e ordinata: tipo e figli confrontati ricorsivamente,
 *   mai la rappresentazione testuale
 *
 * RAPPRESENTAZIONE CANONICA (toString):
 * • Atomi e costanti: il simbolo stesso
 * • Negazione: ¬x, con parentesi se x è a sua volta una negazione
 * • Binari: "sinistro OP destro", tra parentesi tranne che per il nodo più esterno
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati, con simbolo e arità.
     */
    public enum Type {
        ATOM(null, 0),
        TOP("⊤", 0),
        BOTTOM("⊥", 0),
        NOT("¬", 1),
        AND("∧", 2),
        OR("∨", 2),
        IMPLIES("→", 2);

        private final String symbol;
        private final int arity;

        Type(String symbol, int arity) {
            this.symbol = symbol;
            this.arity = arity;
        }

        public String symbol() {
            return symbol;
        }

        public int arity() {
            return arity;
        }

        public boolean isBinary() {
            return arity == 2;
        }
    }

    private static final Formula TOP_CONSTANT = new Formula(Type.TOP, null, null, null);
    private static final Formula BOTTOM_CONSTANT = new Formula(Type.BOTTOM, null, null, null);

    private final Type type;

    /** Nome dell'atomo (solo per ATOM) */
    private final String name;

    /** Operando unico per NOT, operando sinistro per i binari */
    private final Formula left;

    /** Operando destro (solo per i binari) */
    private final Formula right;

    /** Hash strutturale calcolato una sola volta: i nodi sono immutabili */
    private final int hash;

    private Formula(Type type, String name, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(type, name, left, right);
    }

    //endregion

    //region FACTORY METHODS

    /**
     * Crea un atomo proposizionale.
     *
     * @param name singola lettera ASCII minuscola
     * @throws IllegalArgumentException se il nome non è una lettera minuscola
     */
    public static Formula atom(String name) {
        if (!isAtomName(name)) {
            throw new IllegalArgumentException("Nome atomo non valido: " + name);
        }
        return new Formula(Type.ATOM, name, null, null);
    }

    public static Formula atom(char name) {
        return atom(String.valueOf(name));
    }

    public static Formula top() {
        return TOP_CONSTANT;
    }

    public static Formula bottom() {
        return BOTTOM_CONSTANT;
    }

    public static Formula not(Formula operand) {
        requireOperand(operand, Type.NOT);
        return new Formula(Type.NOT, null, operand, null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Type.IMPLIES, left, right);
    }

    /**
     * Crea un nodo binario del tipo indicato.
     *
     * @throws IllegalArgumentException se il tipo non è binario o un operando è null
     */
    public static Formula binary(Type type, Formula left, Formula right) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo non binario: " + type);
        }
        requireOperand(left, type);
        requireOperand(right, type);
        return new Formula(type, null, left, right);
    }

    private static void requireOperand(Formula operand, Type type) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando null per nodo " + type);
        }
    }

    /**
     * Verifica se il testo è un nome di atomo ammesso.
     */
    public static boolean isAtomName(String text) {
        return text != null && text.length() == 1 && text.charAt(0) >= 'a' && text.charAt(0) <= 'z';
    }

    //endregion

    //region ACCESSORS E INTERROGAZIONI

    public Type getType() {
        return type;
    }

    public boolean is(Type candidate) {
        return type == candidate;
    }

    /**
     * @return nome dell'atomo
     * @throws IllegalStateException se il nodo non è un atomo
     */
    public String getName() {
        if (type != Type.ATOM) {
            throw new IllegalStateException("Nodo " + type + " non ha nome");
        }
        return name;
    }

    /**
     * @return operando della negazione
     * @throws IllegalStateException se il nodo non è una negazione
     */
    public Formula getOperand() {
        if (type != Type.NOT) {
            throw new IllegalStateException("Nodo " + type + " non è una negazione");
        }
        return left;
    }

    public Formula getLeft() {
        requireBinary();
        return left;
    }

    public Formula getRight() {
        requireBinary();
        return right;
    }

    private void requireBinary() {
        if (!type.isBinary()) {
            throw new IllegalStateException("Nodo " + type + " non è binario");
        }
    }

    /**
     * Letterale: atomo o negazione di un atomo.
     */
    public boolean isLiteral() {
        return type == Type.ATOM || (type == Type.NOT && left.type == Type.ATOM);
    }

    /**
     * Verifica se il nodo è una doppia negazione ¬¬A.
     */
    public boolean isDoubleNegation() {
        return type == Type.NOT && left.type == Type.NOT;
    }

    /**
     * Raccoglie gli atomi della formula in ordine lessicografico.
     */
    public Set<String> atoms() {
        Set<String> atoms = new TreeSet<>();
        collectAtoms(atoms);
        return atoms;
    }

    private void collectAtoms(Set<String> atoms) {
        switch (type) {
            case ATOM -> atoms.add(name);
            case TOP, BOTTOM -> { /* nessun atomo */ }
            case NOT -> left.collectAtoms(atoms);
            case AND, OR, IMPLIES -> {
                left.collectAtoms(atoms);
                right.collectAtoms(atoms);
            }
        }
    }

    /**
     * Numero di nodi dell'albero.
     */
    public int size() {
        return switch (type) {
            case ATOM, TOP, BOTTOM -> 1;
            case NOT -> 1 + left.size();
            case AND, OR, IMPLIES -> 1 + left.size() + right.size();
        };
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta la formula sotto un assegnamento di verità.
     *
     * @param assignment mappa atomo → valore; deve coprire tutti gli atomi della formula
     * @return valore di verità della formula
     * @throws IllegalArgumentException se un atomo non è assegnato
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return switch (type) {
            case ATOM -> {
                Boolean value = assignment.get(name);
                if (value == null) {
                    throw new IllegalArgumentException("Atomo non assegnato: " + name);
                }
                yield value;
            }
            case TOP -> true;
            case BOTTOM -> false;
            case NOT -> !left.evaluate(assignment);
            case AND -> left.evaluate(assignment) && right.evaluate(assignment);
            case OR -> left.evaluate(assignment) || right.evaluate(assignment);
            case IMPLIES -> !left.evaluate(assignment) || right.evaluate(assignment);
        };
    }

    //endregion

    //region UGUAGLIANZA STRUTTURALE

    /**
     * Uguaglianza strutturale: stesso tipo, stesso nome, figli uguali nello stesso ordine.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula)) return false;

        Formula other = (Formula) obj;
        if (this.type != other.type || this.hash != other.hash) return false;

        return switch (type) {
            case ATOM -> name.equals(other.name);
            case TOP, BOTTOM -> true;
            case NOT -> left.equals(other.left);
            case AND, OR, IMPLIES -> left.equals(other.left) && right.equals(other.right);
        };
    }

    @Override
    public int hashCode() {
        return hash;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione canonica: il nodo corrente è trattato come il più esterno.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        render(builder, true);
        return builder.toString();
    }

    private void render(StringBuilder builder, boolean outermost) {
        switch (type) {
            case ATOM -> builder.append(name);
            case TOP, BOTTOM -> builder.append(type.symbol());
            case NOT -> {
                builder.append(type.symbol());
                if (left.type == Type.NOT) {
                    builder.append('(');
                    left.render(builder, false);
                    builder.append(')');
                } else {
                    left.render(builder, false);
                }
            }
            case AND, OR, IMPLIES -> {
                if (!outermost) builder.append('(');
                left.render(builder, false);
                builder.append(' ').append(type.symbol()).append(' ');
                right.render(builder, false);
                if (!outermost) builder.append(')');
            }
        }
    }

    //endregion
}
