package org.logic.cnf;

import org.junit.jupiter.api.Test;
import org.logic.error.LogicException;
import org.logic.formula.Formula;
import org.logic.parser.FormulaParser;
import org.logic.support.CNFFormula;
import org.logic.support.Clause;
import org.logic.support.Literal;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CNFConverterTest {

    private static final String ATOMS = "pqrstu";

    private final FormulaParser parser = new FormulaParser();
    private final CNFConverter converter = new CNFConverter();

    private String cnf(String text) throws LogicException {
        return converter.convert(parser.parse(text)).format();
    }

    @Test
    void distributesDisjunctionOverConjunction() throws LogicException {
        assertEquals("(p∨r)∧(q∨r)", cnf("(p∧q)∨r"));
        assertEquals("(p∨q)∧(p∨r)", cnf("p∨(q∧r)"));
    }

    @Test
    void eliminatesImplicationsAndPushesNegations() throws LogicException {
        assertEquals("¬p∨q", cnf("p→q"));
        assertEquals("p∧¬q", cnf("¬(p→q)"));
        assertEquals("¬p∨¬q", cnf("¬(p∧q)"));
        assertEquals("¬p∧¬q", cnf("¬(p∨q)"));
        assertEquals("p", cnf("¬¬p"));
    }

    @Test
    void singleClauseIsNotParenthesized() throws LogicException {
        assertEquals("p∨q∨r", cnf("p∨q∨r"));
        assertEquals("p∧q", cnf("p∧q"));
    }

    @Test
    void literalsAreDeduplicatedWithoutTautologyElimination() throws LogicException {
        assertEquals("p", cnf("p∨p"));
        assertEquals("p∨¬p", cnf("p∨¬p"));
        assertEquals("(p∨q)∧(¬p∨q)", cnf("(p∧¬p)∨q"));
    }

    @Test
    void constants() throws LogicException {
        assertTrue(converter.convert(Formula.top()).isEmpty());
        assertEquals("", cnf("⊤"));
        assertEquals("⊥", cnf("⊥"));
        assertEquals("⊥", cnf("¬⊤"));
        assertEquals("", cnf("¬⊥"));
        assertEquals("p", cnf("p∧⊤"));
        assertEquals("p∧⊥", cnf("p∧⊥"));
    }

    @Test
    void keepsClauseStructure() throws LogicException {
        CNFFormula result = converter.convert(parser.parse("(p∧q)∨r"));
        assertEquals(List.of(
                Clause.of(Literal.positive("p"), Literal.positive("r")),
                Clause.of(Literal.positive("q"), Literal.positive("r"))), result.getClauses());
        assertEquals(2, result.getClausesCount());
    }

    @Test
    void rejectsNullFormula() {
        assertThrows(IllegalArgumentException.class, () -> converter.convert(null));
    }

    @Test
    void conversionIsSoundOnRandomFormulas() {
        Random random = new Random(20240917L);

        for (int n = 0; n < 300; n++) {
            Formula formula = randomFormula(random, 4);
            CNFFormula result = converter.convert(formula);

            assertTrue(isConjunctionOfClauses(result.toFormula()), "forma non clausale per " + formula);
            for (int mask = 0; mask < (1 << ATOMS.length()); mask++) {
                Map<String, Boolean> assignment = assignment(mask);
                assertEquals(formula.evaluate(assignment), result.evaluate(assignment),
                        "CNF non equivalente per " + formula + " sotto " + assignment);
            }
        }
    }

    @Test
    void reconstructedFormulaIsEquivalent() throws LogicException {
        Formula formula = parser.parse("¬(p→(q∨¬r))∨(r∧p)");
        Formula reconstructed = converter.convert(formula).toFormula();
        for (int mask = 0; mask < (1 << ATOMS.length()); mask++) {
            Map<String, Boolean> assignment = assignment(mask);
            assertEquals(formula.evaluate(assignment), reconstructed.evaluate(assignment));
        }
    }

    @Test
    void shapeCheckRejectsNonClausalTrees() throws LogicException {
        assertTrue(isConjunctionOfClauses(parser.parse("(p∨¬q)∧r∧(¬r∨s∨t)")));
        assertTrue(isConjunctionOfClauses(converter.convert(parser.parse("¬((p→q)∨(r∧¬s))")).toFormula()));
        assertFalse(isConjunctionOfClauses(parser.parse("(p∧q)∨r")));
        assertFalse(isConjunctionOfClauses(parser.parse("¬¬p∧q")));
        assertFalse(isConjunctionOfClauses(parser.parse("p→q")));
    }

    /**
     * Congiunzione di clausole: sotto gli ∧ solo disgiunzioni di letterali, ⊥ per la
     * clausola vuota, ⊤ per la formula senza clausole.
     */
    private static boolean isConjunctionOfClauses(Formula node) {
        if (node.is(Formula.Type.AND)) {
            return isConjunctionOfClauses(node.getLeft()) && isConjunctionOfClauses(node.getRight());
        }
        return node.is(Formula.Type.TOP) || isDisjunctionOfLiterals(node);
    }

    private static boolean isDisjunctionOfLiterals(Formula node) {
        if (node.is(Formula.Type.OR)) {
            return isDisjunctionOfLiterals(node.getLeft()) && isDisjunctionOfLiterals(node.getRight());
        }
        return node.isLiteral() || node.is(Formula.Type.BOTTOM);
    }

    private static Map<String, Boolean> assignment(int mask) {
        Map<String, Boolean> assignment = new HashMap<>();
        for (int i = 0; i < ATOMS.length(); i++) {
            assignment.put(String.valueOf(ATOMS.charAt(i)), (mask & (1 << i)) != 0);
        }
        return assignment;
    }

    private static Formula randomFormula(Random random, int depth) {
        if (depth == 0 || random.nextInt(4) == 0) {
            int leaf = random.nextInt(ATOMS.length() + 2);
            if (leaf == ATOMS.length()) return Formula.top();
            if (leaf == ATOMS.length() + 1) return Formula.bottom();
            return Formula.atom(ATOMS.charAt(leaf));
        }

        return switch (random.nextInt(4)) {
            case 0 -> Formula.not(randomFormula(random, depth - 1));
            case 1 -> Formula.and(randomFormula(random, depth - 1), randomFormula(random, depth - 1));
            case 2 -> Formula.or(randomFormula(random, depth - 1), randomFormula(random, depth - 1));
            default -> Formula.implies(randomFormula(random, depth - 1), randomFormula(random, depth - 1));
        };
    }
}
