package org.logic.deduction;

import org.junit.jupiter.api.Test;
import org.logic.error.ErrorKind;
import org.logic.error.SemanticException;
import org.logic.error.SyntaxException;
import org.logic.formula.Formula;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleApplierTest {

    private final RuleApplier applier = new RuleApplier();

    private String apply(String... lines) {
        return applier.apply(List.of(lines)).render();
    }

    @Test
    void modusPonens() {
        assertEquals("q", apply("1    p → q", "2    p", "→e, 1, 2"));
        assertEquals("q", apply("1    p", "2    p → q", "→e, 1, 2"));
    }

    @Test
    void productiveRules() {
        assertEquals("p ∧ (q ∨ r)", apply("1    p", "2    q∨r", "∧i, 1, 2"));
        assertEquals("q ∨ r", apply("1    p∧(q∨r)", "∧e2, 1"));
        assertEquals("p", apply("1    p∧(q∨r)", "∧e1, 1"));
        assertEquals("⊥", apply("1    ¬p", "2    p", "¬e, 1, 2"));
        assertEquals("¬(¬(p ∧ q))", apply("1    p∧q", "¬¬i, 1"));
        assertEquals("p → q", apply("1    ¬¬(p→q)", "¬¬e, 1"));
        assertEquals("¬p", apply("1    p→q", "2    ¬q", "MT, 1, 2"));
    }

    @Test
    void resultKeepsTheFormula() {
        RuleApplication application = applier.apply("1  p\n2  q\n∧i, 2, 1");

        assertTrue(application.isApplied());
        assertEquals(Formula.and(Formula.atom("q"), Formula.atom("p")), application.getResult());
        assertNull(application.getCause());
    }

    @Test
    void rejectsInapplicableRules() {
        assertEquals("Rule Cannot Be Applied", apply("1    p∨q", "∧e1, 1"));
        assertEquals("Rule Cannot Be Applied", apply("1    p", "2    q", "¬e, 1, 2"));
        assertEquals("Rule Cannot Be Applied", apply("1    p", "∨i1, 1"));
        assertEquals("Rule Cannot Be Applied", apply("1    p", "Magic, 1"));
        assertEquals("Rule Cannot Be Applied", apply("1    p", "∧i, 1"));
        assertEquals("Rule Cannot Be Applied", apply("1    p∧q", "∧e1, 3"));
    }

    @Test
    void rejectionCarriesTheCause() {
        RuleApplication missingInvocation = applier.apply(List.of("1    p", "2    q"));
        assertFalse(missingInvocation.isApplied());
        assertInstanceOf(SyntaxException.class, missingInvocation.getCause());

        RuleApplication badReference = applier.apply(List.of("1    p∧q", "∧e1, x"));
        assertEquals(ErrorKind.SYNTAX, badReference.getCause().getKind());

        RuleApplication badFormula = applier.apply(List.of("1    p∧", "∧e1, 1"));
        assertEquals(ErrorKind.SYNTAX, badFormula.getCause().getKind());

        RuleApplication notConjunction = applier.apply(List.of("1    p", "∧e1, 1"));
        assertInstanceOf(SemanticException.class, notConjunction.getCause());
    }

    @Test
    void appliesToNumberedFormulas() {
        Map<Integer, Formula> formulas = Map.of(
                1, Formula.not(Formula.not(Formula.atom("r"))),
                7, Formula.atom("s"));

        assertEquals(Formula.atom("r"), applier.apply(formulas, "¬¬e", List.of(1)).getResult());
        assertEquals("s ∧ ¬(¬r)", applier.apply(formulas, "∧i", List.of(7, 1)).render());
        assertFalse(applier.apply(formulas, "¬¬e", List.of(7)).isApplied());
    }
}
