package org.logic.deduction;

import org.junit.jupiter.api.Test;
import org.logic.error.ErrorKind;
import org.logic.formula.Formula;
import org.logic.parser.GrammarMode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProofValidatorTest {

    private final ProofValidator validator = new ProofValidator();

    private DeductionResult validate(String... lines) {
        return validator.validate(List.of(lines));
    }

    private void assertValid(String... lines) {
        DeductionResult result = validate(lines);
        assertTrue(result.isValid(), () -> "attesa prova valida, ottenuto " + result);
        assertEquals("Valid Deduction", result.render());
        assertNull(result.getCause());
    }

    private void assertInvalidAt(int line, ErrorKind kind, String... lines) {
        DeductionResult result = validate(lines);
        assertFalse(result.isValid(), "attesa prova non valida");
        assertEquals(line, result.getFailingLine(), () -> "causa: " + result.getCause().getMessage());
        assertEquals(kind, result.getCause().getKind(), () -> "causa: " + result.getCause().getMessage());
        assertEquals("Invalid Deduction at Line " + line, result.render());
    }

    //region SCENARI DI BASE

    @Test
    void conjunctionEliminationLeft() {
        assertValid(
                "1  p∧q  Premise",
                "2  p  ∧e1, 1");
    }

    @Test
    void wrongConjunctionEliminationIsReportedAtItsLine() {
        assertInvalidAt(2, ErrorKind.SEMANTIC,
                "1  p∧q  Premise",
                "2  p  ∧e2, 1");
    }

    @Test
    void failFastReportsTheFirstInvalidLine() {
        assertInvalidAt(3, ErrorKind.SEMANTIC,
                "1  p∧q  Premise",
                "2  q  ∧e2, 1",
                "3  r  ∧e1, 1",
                "4  s  ∧e1, 1",
                "5  q∧  Copy, 2");
    }

    @Test
    void blankLinesAreIgnored() {
        assertValid("", "1  p  Premise", "   ", "2  p  Copy, 1", "");
        assertValid();
    }

    @Test
    void acceptsWholeTextAndRecordsLines() {
        DeductionResult result = validator.validate(String.join("\n",
                "1  p→q  Premise",
                "BeginScope",
                "2  p  Assumption",
                "3  q  →e, 1, 2",
                "EndScope",
                "4  p→q  →i, 2-3"));

        assertTrue(result.isValid());
        List<ProofLine> lines = result.getAcceptedLines();
        assertEquals(4, lines.size());

        ProofLine assumption = lines.get(1);
        assertEquals(2, assumption.number());
        assertEquals(1, assumption.depth());
        assertTrue(assumption.assumption());
        assertEquals(Formula.atom("p"), assumption.formula());

        ProofLine closing = lines.get(3);
        assertEquals(0, closing.depth());
        assertEquals("→i", closing.rule());
        assertEquals(List.of(Reference.range(2, 3)), closing.references());
        assertThrows(IllegalStateException.class, () -> DeductionResult.valid(lines).getFailingLine());
    }

    //endregion

    //region REGOLE

    @Test
    void implicationIntroductionAndElimination() {
        assertValid(
                "1  p→q  Premise",
                "2  q→r  Premise",
                "BeginScope",
                "3  p  Assumption",
                "4  q  →e, 1, 3",
                "5  r  →e, 4, 2",
                "EndScope",
                "6  p→r  →i, 3-5");
    }

    @Test
    void negationIntroductionAndModusTollens() {
        assertValid(
                "1  p→q  Premise",
                "2  ¬q  Premise",
                "BeginScope",
                "3  p  Assumption",
                "4  q  →e, 1, 3",
                "5  ⊥  ¬e, 4, 2",
                "EndScope",
                "6  ¬p  ¬i, 3-5",
                "7  ¬p  MT, 1, 2");
    }

    @Test
    void proofByContradiction() {
        assertValid(
                "1  ¬¬p  Premise",
                "BeginScope",
                "2  ¬p  Assumption",
                "3  ⊥  ¬e, 1, 2",
                "EndScope",
                "4  p  PBC, 2-3");
    }

    @Test
    void disjunctionElimination() {
        assertValid(
                "1  p∨q  Premise",
                "BeginScope",
                "2  p  Assumption",
                "3  q∨p  ∨i2, 2",
                "EndScope",
                "BeginScope",
                "4  q  Assumption",
                "5  q∨p  ∨i1, 4",
                "EndScope",
                "6  q∨p  ∨e, 1, 2-3, 4-5");
    }

    @Test
    void disjunctionEliminationRejectsOverlappingSubproofs() {
        assertInvalidAt(4, ErrorKind.SCOPE,
                "1  p∨p  Premise",
                "BeginScope",
                "2  p  Assumption",
                "3  p  Copy, 2",
                "EndScope",
                "4  p  ∨e, 1, 2-3, 2-3");
    }

    @Test
    void disjunctionEliminationRequiresMatchingConclusions() {
        assertInvalidAt(6, ErrorKind.SEMANTIC,
                "1  p∨q  Premise",
                "BeginScope",
                "2  p  Assumption",
                "3  p∨q  ∨i1, 2",
                "EndScope",
                "BeginScope",
                "4  q  Assumption",
                "5  q∨p  ∨i1, 4",
                "EndScope",
                "6  p∨q  ∨e, 1, 2-3, 4-5");
    }

    @Test
    void negationRulesAndBottomElimination() {
        assertValid(
                "1  p  Premise",
                "2  ¬p  Premise",
                "3  ⊥  ¬e, 2, 1",
                "4  q∧r  ⊥e, 3",
                "5  ¬¬p  ¬¬i, 1",
                "6  p  ¬¬e, 5",
                "7  p∧¬p  ∧i, 1, 2");
    }

    @Test
    void bottomEliminationRequiresBottom() {
        assertInvalidAt(2, ErrorKind.SEMANTIC,
                "1  p  Premise",
                "2  q  ⊥e, 1");
    }

    @Test
    void conjunctionIntroductionIsOrdered() {
        assertInvalidAt(3, ErrorKind.SEMANTIC,
                "1  p  Premise",
                "2  q  Premise",
                "3  q∧p  ∧i, 1, 2");
    }

    @Test
    void excludedMiddleInBothOrientations() {
        assertValid("1  p∨¬p  LEM", "2  ¬(q∧r)∨(q∧r)  LEM");
        assertInvalidAt(1, ErrorKind.SEMANTIC, "1  p∨q  LEM");
    }

    @Test
    void copyRequiresStructuralEquality() {
        assertValid("1  p∧q  Premise", "2  (p)∧(q)  Copy, 1");
        assertInvalidAt(2, ErrorKind.SEMANTIC, "1  p∧q  Premise", "2  q∧p  Copy, 1");
    }

    @Test
    void nestedSubproofs() {
        assertValid(
                "BeginScope",
                "1  p  Assumption",
                "BeginScope",
                "2  q  Assumption",
                "3  p  Copy, 1",
                "EndScope",
                "4  q→p  →i, 2-3",
                "EndScope",
                "5  p→(q→p)  →i, 1-4");
    }

    //endregion

    //region SCOPE E ACCESSIBILITÀ

    @Test
    void linesOfClosedScopesAreNotAccessible() {
        assertInvalidAt(7, ErrorKind.SCOPE,
                "1  p→q  Premise",
                "BeginScope",
                "2  p  Assumption",
                "3  q  →e, 1, 2",
                "EndScope",
                "4  p→q  →i, 2-3",
                "7  q  Copy, 3");
    }

    @Test
    void linesOfClosedSiblingScopesAreNotAccessible() {
        assertInvalidAt(3, ErrorKind.SCOPE,
                "BeginScope",
                "1  p  Assumption",
                "EndScope",
                "BeginScope",
                "2  q  Assumption",
                "3  p  Copy, 1");
    }

    @Test
    void referenceToMissingLine() {
        assertInvalidAt(2, ErrorKind.SCOPE, "1  p  Premise", "2  p  Copy, 9");
    }

    @Test
    void rangeOfAnOpenScopeIsRejected() {
        assertInvalidAt(4, ErrorKind.SCOPE,
                "1  p→q  Premise",
                "BeginScope",
                "2  p  Assumption",
                "3  q  →e, 1, 2",
                "4  p→q  →i, 2-3");
    }

    @Test
    void rangeMustStartAtTheAssumption() {
        assertInvalidAt(5, ErrorKind.SCOPE,
                "1  p  Premise",
                "BeginScope",
                "2  q  Assumption",
                "3  p  Copy, 1",
                "4  p  Copy, 3",
                "EndScope",
                "5  p→p  →i, 3-4");
    }

    @Test
    void rangeMustBeADirectChildScope() {
        assertInvalidAt(4, ErrorKind.SCOPE,
                "BeginScope",
                "1  p  Assumption",
                "BeginScope",
                "2  q  Assumption",
                "3  p  Copy, 1",
                "EndScope",
                "EndScope",
                "4  q→p  →i, 2-3");
    }

    @Test
    void reversedRangeIsRejected() {
        assertInvalidAt(4, ErrorKind.SCOPE,
                "BeginScope",
                "1  p  Assumption",
                "2  p  Copy, 1",
                "EndScope",
                "4  p→p  →i, 2-1");
    }

    @Test
    void beginScopeRequiresAnAssumption() {
        assertInvalidAt(2, ErrorKind.SCOPE,
                "1  p  Premise",
                "BeginScope",
                "2  q  Copy, 1");
    }

    @Test
    void assumptionOnlyDirectlyAfterBeginScope() {
        assertInvalidAt(1, ErrorKind.SCOPE, "1  p  Assumption");
        assertInvalidAt(3, ErrorKind.SCOPE,
                "BeginScope",
                "1  p  Assumption",
                "2  p  Copy, 1",
                "3  q  Assumption");
    }

    @Test
    void premiseOnlyOutsideScopes() {
        assertInvalidAt(2, ErrorKind.SCOPE,
                "BeginScope",
                "1  p  Assumption",
                "2  q  Premise");
    }

    @Test
    void unbalancedMarkersReportTheNextLineNumber() {
        assertInvalidAt(2, ErrorKind.SCOPE, "1  p  Premise", "EndScope");
        assertInvalidAt(3, ErrorKind.SCOPE, "1  p  Premise", "BeginScope", "2  q  Assumption");
        assertInvalidAt(2, ErrorKind.SCOPE, "1  p  Premise", "BeginScope", "EndScope");
        assertInvalidAt(2, ErrorKind.SCOPE, "1  p  Premise", "BeginScope", "BeginScope");
    }

    //endregion

    //region ERRORI DI FORMATO

    @Test
    void lineNumbersMustIncrease() {
        assertInvalidAt(2, ErrorKind.SYNTAX, "2  p  Premise", "2  q  Premise");
        assertInvalidAt(1, ErrorKind.SYNTAX, "3  p  Premise", "1  q  Premise");
    }

    @Test
    void malformedLines() {
        assertInvalidAt(2, ErrorKind.SYNTAX, "1  p  Premise", "2 p");
        assertInvalidAt(2, ErrorKind.SYNTAX, "1  p  Premise", "not a proof line");
        assertInvalidAt(2, ErrorKind.SYNTAX, "1  p  Premise", "2  p∧  Copy, 1");
        assertInvalidAt(2, ErrorKind.LEXICAL, "1  p  Premise", "2  p&q  Copy, 1");
        assertInvalidAt(2, ErrorKind.SYNTAX, "1  p  Premise", "2  p  Copy, x");
    }

    @Test
    void unknownRuleOrWrongShape() {
        assertInvalidAt(2, ErrorKind.SEMANTIC, "1  p  Premise", "2  p  Magic, 1");
        assertInvalidAt(2, ErrorKind.SEMANTIC, "1  p∧q  Premise", "2  p  ∧e1, 1, 1");
        assertInvalidAt(2, ErrorKind.SEMANTIC, "1  p∧q  Premise", "2  p  ∧e1, 1-1");
        assertInvalidAt(2, ErrorKind.SEMANTIC, "1  p  Premise", "2  p→p  →i, 1");
    }

    @Test
    void strictGrammarAppliesToProofFormulas() {
        ProofValidator strict = new ProofValidator(GrammarMode.STRICT);
        DeductionResult result = strict.validate(List.of("1  p∧q∧r  Premise"));
        assertEquals(1, result.getFailingLine());
        assertTrue(validate("1  p∧q∧r  Premise").isValid());
    }

    //endregion
}
