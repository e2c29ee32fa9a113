package org.logic.deduction;

import org.logic.error.ScopeException;
import org.logic.error.SemanticException;
import org.logic.formula.Formula;
import org.logic.formula.Formula.Type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * TABELLA DELLE REGOLE - Sistema di deduzione naturale
 *
 * Dispatch per nome verso definizioni con firma uniforme. d indica la profondità
 * di scope corrente.
 *
 * REGOLE PRODUTTIVE (condivise con l'applicatore di regole singole):
 * • ∧i: da A e B deriva A ∧ B
 * • ∧e1 / ∧e2: da A ∧ B deriva A (risp. B)
 * • →e: da A → B e A, in qualunque ordine, deriva B
 * • ¬e: da ¬A e A, in qualunque ordine, deriva ⊥
 * • ¬¬e: da ¬¬A deriva A
 * • ¬¬i: da A deriva ¬¬A
 * • MT: da A → B e ¬B deriva ¬A
 *
 * REGOLE DI SOLA VERIFICA:
 * • Premise (solo a d=0), Assumption (posizione verificata dal validatore), Copy
 * • ∨i1 / ∨i2, ⊥e, LEM
 * • →i, ¬i, PBC, ∨e: chiusura di sottoprove tramite riferimenti a intervallo
 */
public final class RuleTable {

    public static final String PREMISE = "Premise";
    public static final String ASSUMPTION = "Assumption";

    private static final Map<String, RuleDefinition> RULES = buildTable();

    private RuleTable() {
    }

    //region CONSULTAZIONE

    /**
     * @throws SemanticException se il nome non corrisponde a nessuna regola
     */
    public static RuleDefinition lookup(String name) throws SemanticException {
        RuleDefinition definition = RULES.get(name);
        if (definition == null) {
            throw new SemanticException("Regola sconosciuta: '" + name + "'");
        }
        return definition;
    }

    public static Optional<RuleDefinition> find(String name) {
        return Optional.ofNullable(RULES.get(name));
    }

    /**
     * @return nomi delle regole, nell'ordine di registrazione
     */
    public static Set<String> names() {
        return Collections.unmodifiableSet(RULES.keySet());
    }

    //endregion

    //region COSTRUZIONE TABELLA

    private static Map<String, RuleDefinition> buildTable() {
        Map<String, RuleDefinition> table = new LinkedHashMap<>();

        register(table, RuleDefinition.checked(PREMISE, ReferenceShape.NONE, input -> {
            if (input.depth() != 0) {
                throw new ScopeException("Premise ammessa solo fuori da ogni scope, profondità " + input.depth());
            }
        }));
        register(table, RuleDefinition.checked(ASSUMPTION, ReferenceShape.NONE, input -> { }));
        register(table, RuleDefinition.checked("Copy", ReferenceShape.LINE,
                input -> requireEqual("Copy", input.line(0), input.current())));

        // Produttive
        register(table, RuleDefinition.derived("∧i", ReferenceShape.LINE_LINE,
                premises -> Formula.and(premises.get(0), premises.get(1))));
        register(table, RuleDefinition.derived("∧e1", ReferenceShape.LINE,
                premises -> requireType("∧e1", premises.get(0), Type.AND).getLeft()));
        register(table, RuleDefinition.derived("∧e2", ReferenceShape.LINE,
                premises -> requireType("∧e2", premises.get(0), Type.AND).getRight()));
        register(table, RuleDefinition.derived("→e", ReferenceShape.LINE_LINE, RuleTable::modusPonens));
        register(table, RuleDefinition.derived("¬e", ReferenceShape.LINE_LINE, RuleTable::contradiction));
        register(table, RuleDefinition.derived("¬¬e", ReferenceShape.LINE, premises -> {
            Formula premise = premises.get(0);
            if (!premise.isDoubleNegation()) {
                throw new SemanticException("¬¬e: " + premise + " non è una doppia negazione");
            }
            return premise.getOperand().getOperand();
        }));
        register(table, RuleDefinition.derived("¬¬i", ReferenceShape.LINE,
                premises -> Formula.not(Formula.not(premises.get(0)))));
        register(table, RuleDefinition.derived("MT", ReferenceShape.LINE_LINE, RuleTable::modusTollens));

        // Introduzione della disgiunzione e ⊥e
        register(table, RuleDefinition.checked("∨i1", ReferenceShape.LINE, input -> {
            Formula disjunction = requireType("∨i1", input.current(), Type.OR);
            requireEqual("∨i1", input.line(0), disjunction.getLeft());
        }));
        register(table, RuleDefinition.checked("∨i2", ReferenceShape.LINE, input -> {
            Formula disjunction = requireType("∨i2", input.current(), Type.OR);
            requireEqual("∨i2", input.line(0), disjunction.getRight());
        }));
        register(table, RuleDefinition.checked("⊥e", ReferenceShape.LINE,
                input -> requireType("⊥e", input.line(0), Type.BOTTOM)));

        // Chiusura di sottoprove
        register(table, RuleDefinition.checked("→i", ReferenceShape.RANGE, input -> {
            Subproof subproof = input.subproof(0);
            Formula implication = requireType("→i", input.current(), Type.IMPLIES);
            requireEqual("→i", subproof.assumption().formula(), implication.getLeft());
            requireEqual("→i", subproof.conclusion().formula(), implication.getRight());
        }));
        register(table, RuleDefinition.checked("¬i", ReferenceShape.RANGE, input -> {
            Subproof subproof = input.subproof(0);
            requireType("¬i", subproof.conclusion().formula(), Type.BOTTOM);
            Formula negation = requireType("¬i", input.current(), Type.NOT);
            requireEqual("¬i", subproof.assumption().formula(), negation.getOperand());
        }));
        register(table, RuleDefinition.checked("PBC", ReferenceShape.RANGE, input -> {
            Subproof subproof = input.subproof(0);
            requireType("PBC", subproof.conclusion().formula(), Type.BOTTOM);
            Formula negatedAssumption = requireType("PBC", subproof.assumption().formula(), Type.NOT);
            requireEqual("PBC", negatedAssumption.getOperand(), input.current());
        }));
        register(table, RuleDefinition.checked("∨e", ReferenceShape.LINE_RANGE_RANGE, RuleTable::disjunctionElimination));

        register(table, RuleDefinition.checked("LEM", ReferenceShape.NONE, input -> {
            Formula disjunction = requireType("LEM", input.current(), Type.OR);
            if (!isNegationOf(disjunction.getRight(), disjunction.getLeft())
                    && !isNegationOf(disjunction.getLeft(), disjunction.getRight())) {
                throw new SemanticException("LEM: " + disjunction + " non ha la forma A ∨ ¬A");
            }
        }));

        return Collections.unmodifiableMap(table);
    }

    private static void register(Map<String, RuleDefinition> table, RuleDefinition definition) {
        if (table.put(definition.getName(), definition) != null) {
            throw new IllegalStateException("Regola registrata due volte: " + definition.getName());
        }
    }

    //endregion

    //region REGOLE CON PIÙ CASI

    private static Formula modusPonens(List<Formula> premises) throws SemanticException {
        Formula first = premises.get(0);
        Formula second = premises.get(1);

        if (first.is(Type.IMPLIES) && first.getLeft().equals(second)) {
            return first.getRight();
        }
        if (second.is(Type.IMPLIES) && second.getLeft().equals(first)) {
            return second.getRight();
        }
        throw new SemanticException("→e: nessuna implicazione con antecedente " + first + " o " + second);
    }

    private static Formula contradiction(List<Formula> premises) throws SemanticException {
        Formula first = premises.get(0);
        Formula second = premises.get(1);

        if (isNegationOf(first, second) || isNegationOf(second, first)) {
            return Formula.bottom();
        }
        throw new SemanticException("¬e: " + first + " e " + second + " non sono contraddittorie");
    }

    private static Formula modusTollens(List<Formula> premises) throws SemanticException {
        Formula implication = requireType("MT", premises.get(0), Type.IMPLIES);
        Formula negation = requireType("MT", premises.get(1), Type.NOT);

        requireEqual("MT", implication.getRight(), negation.getOperand());
        return Formula.not(implication.getLeft());
    }

    /**
     * ∨e: da A ∨ B, una sottoprova A ... C e una sottoprova B ... C, deriva C.
     */
    private static void disjunctionElimination(RuleInput input) throws ScopeException, SemanticException {
        Subproof left = input.subproof(0);
        Subproof right = input.subproof(1);

        if (left.overlaps(right)) {
            throw new ScopeException("∨e: le sottoprove " + left.start() + "-" + left.end() + " e " +
                    right.start() + "-" + right.end() + " si sovrappongono");
        }

        Formula disjunction = requireType("∨e", input.line(0), Type.OR);
        requireEqual("∨e", disjunction.getLeft(), left.assumption().formula());
        requireEqual("∨e", disjunction.getRight(), right.assumption().formula());
        requireEqual("∨e", left.conclusion().formula(), right.conclusion().formula());
        requireEqual("∨e", left.conclusion().formula(), input.current());
    }

    //endregion

    //region CONFRONTI STRUTTURALI

    private static boolean isNegationOf(Formula candidate, Formula operand) {
        return candidate.is(Type.NOT) && candidate.getOperand().equals(operand);
    }

    private static Formula requireType(String rule, Formula formula, Type type) throws SemanticException {
        if (!formula.is(type)) {
            throw new SemanticException(rule + ": atteso nodo " + type + ", trovato " + formula);
        }
        return formula;
    }

    private static void requireEqual(String rule, Formula expected, Formula actual) throws SemanticException {
        if (!expected.equals(actual)) {
            throw new SemanticException(rule + ": atteso " + expected + ", trovato " + actual);
        }
    }

    //endregion
}
