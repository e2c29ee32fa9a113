package org.logic.support;

import org.junit.jupiter.api.Test;
import org.logic.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CNFFormulaTest {

    private static final Literal P = Literal.positive("p");
    private static final Literal NOT_P = Literal.negative("p");
    private static final Literal Q = Literal.positive("q");

    @Test
    void literalIdentityAndConstruction() {
        assertEquals("p", P.identity());
        assertEquals("¬p", NOT_P.identity());
        assertEquals(NOT_P, Literal.fromFormula(Formula.not(Formula.atom("p"))));
        assertThrows(IllegalArgumentException.class,
                () -> Literal.fromFormula(Formula.and(Formula.atom("p"), Formula.atom("q"))));
    }

    @Test
    void buildsFromImmutableLists() {
        CNFFormula single = CNFFormula.ofLiteral(P);
        assertEquals("p", single.format());

        CNFFormula fromList = CNFFormula.of(List.of(Clause.of(P, Q), Clause.of(NOT_P)));
        assertEquals("(p∨q)∧¬p", fromList.format());
        assertEquals(2, fromList.getClausesCount());
    }

    @Test
    void rejectsNullClauses() {
        List<Clause> withNull = new ArrayList<>();
        withNull.add(Clause.of(P));
        withNull.add(null);

        assertThrows(IllegalArgumentException.class, () -> CNFFormula.of(withNull));
        assertThrows(IllegalArgumentException.class, () -> CNFFormula.of((List<Clause>) null));
    }

    @Test
    void clauseDeduplicatesInFirstSeenOrder() {
        Clause clause = Clause.of(Q, P, Q, NOT_P, P);
        assertEquals(List.of(Q, P, NOT_P), clause.getLiterals());
        assertEquals("q∨p∨¬p", clause.format());
    }

    @Test
    void combineConcatenatesAndDeduplicates() {
        Clause combined = Clause.of(P, Q).combine(Clause.of(Q, NOT_P));
        assertEquals(List.of(P, Q, NOT_P), combined.getLiterals());
    }

    @Test
    void emptyClauseIsFalse() {
        assertTrue(Clause.empty().isEmpty());
        assertFalse(Clause.empty().evaluate(Map.of()));
        assertEquals("⊥", Clause.empty().format());
        assertEquals(Formula.bottom(), Clause.empty().toFormula());
    }

    @Test
    void emptyFormulaIsTrue() {
        assertTrue(CNFFormula.empty().evaluate(Map.of()));
        assertEquals("", CNFFormula.empty().format());
        assertEquals(Formula.top(), CNFFormula.empty().toFormula());
        assertFalse(CNFFormula.contradiction().evaluate(Map.of()));
    }

    @Test
    void distributeBuildsTheCrossProduct() {
        CNFFormula left = CNFFormula.of(Clause.of(P), Clause.of(Q));
        CNFFormula right = CNFFormula.of(Clause.of(NOT_P), Clause.of(Literal.positive("r")));

        CNFFormula product = left.distribute(right);
        assertEquals(4, product.getClausesCount());
        assertEquals("(p∨¬p)∧(p∨r)∧(q∨¬p)∧(q∨r)", product.format());
        assertEquals(Set.of("p", "q", "r"), product.atoms());
    }

    @Test
    void distributingWithTheEmptyFormulaYieldsTheEmptyFormula() {
        assertTrue(CNFFormula.ofLiteral(P).distribute(CNFFormula.empty()).isEmpty());
        assertEquals("p", CNFFormula.ofLiteral(P).distribute(CNFFormula.contradiction()).format());
    }

    @Test
    void concatenateKeepsOrder() {
        CNFFormula formula = CNFFormula.ofLiteral(Q).concatenate(CNFFormula.of(Clause.of(P, NOT_P)));
        assertEquals("q∧(p∨¬p)", formula.format());
        assertEquals(formula.format(), formula.toString());
    }
}
