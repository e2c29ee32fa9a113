package org.logic.formula;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormulaTest {

    private static final Formula P = Formula.atom("p");
    private static final Formula Q = Formula.atom("q");
    private static final Formula R = Formula.atom("r");

    @Test
    void equalityIsStructuralAndOrdered() {
        assertEquals(Formula.and(P, Q), Formula.and(Formula.atom('p'), Formula.atom('q')));
        assertEquals(Formula.and(P, Q).hashCode(), Formula.and(P, Q).hashCode());
        assertNotEquals(Formula.and(P, Q), Formula.and(Q, P));
        assertNotEquals(Formula.and(P, Q), Formula.or(P, Q));
        assertNotEquals(Formula.not(P), P);
    }

    @Test
    void rejectsInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> Formula.atom("pq"));
        assertThrows(IllegalArgumentException.class, () -> Formula.atom("P"));
        assertThrows(IllegalArgumentException.class, () -> Formula.not(null));
        assertThrows(IllegalArgumentException.class, () -> Formula.and(P, null));
        assertThrows(IllegalArgumentException.class, () -> Formula.binary(Formula.Type.NOT, P, Q));
    }

    @Test
    void accessorsEnforceNodeType() {
        assertThrows(IllegalStateException.class, P::getLeft);
        assertThrows(IllegalStateException.class, () -> Formula.and(P, Q).getOperand());
        assertThrows(IllegalStateException.class, () -> Formula.not(P).getName());
        assertEquals(P, Formula.not(P).getOperand());
        assertEquals(Q, Formula.implies(P, Q).getRight());
    }

    @Test
    void canonicalRendering() {
        assertEquals("p", P.toString());
        assertEquals("⊥", Formula.bottom().toString());
        assertEquals("p ∧ q", Formula.and(P, Q).toString());
        assertEquals("(p ∧ q) ∨ r", Formula.or(Formula.and(P, Q), R).toString());
        assertEquals("p → (q → r)", Formula.implies(P, Formula.implies(Q, R)).toString());
        assertEquals("¬p", Formula.not(P).toString());
        assertEquals("¬(¬p)", Formula.not(Formula.not(P)).toString());
        assertEquals("¬(p ∨ q)", Formula.not(Formula.or(P, Q)).toString());
    }

    @Test
    void literalsAndDoubleNegation() {
        assertTrue(P.isLiteral());
        assertTrue(Formula.not(P).isLiteral());
        assertFalse(Formula.not(Formula.not(P)).isLiteral());
        assertTrue(Formula.not(Formula.not(P)).isDoubleNegation());
        assertFalse(Formula.top().isLiteral());
    }

    @Test
    void atomsAndSize() {
        Formula formula = Formula.implies(Formula.and(R, P), Formula.or(P, Formula.not(Q)));
        assertEquals(Set.of("p", "q", "r"), formula.atoms());
        assertEquals("[p, q, r]", formula.atoms().toString());
        assertEquals(8, formula.size());
    }

    @Test
    void evaluatesUnderAssignment() {
        Map<String, Boolean> assignment = Map.of("p", true, "q", false);

        assertFalse(Formula.implies(P, Q).evaluate(assignment));
        assertTrue(Formula.implies(Q, P).evaluate(assignment));
        assertTrue(Formula.or(Q, Formula.top()).evaluate(assignment));
        assertFalse(Formula.and(P, Formula.bottom()).evaluate(assignment));
        assertTrue(Formula.not(Q).evaluate(assignment));
        assertThrows(IllegalArgumentException.class, () -> R.evaluate(assignment));
    }
}
