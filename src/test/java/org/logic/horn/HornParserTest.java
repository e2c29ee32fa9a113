package org.logic.horn;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.error.LexicalException;
import org.logic.error.LogicException;
import org.logic.error.SyntaxException;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HornParserTest {

    @Test
    void parsesParenthesizedConjunction() throws LogicException {
        List<HornClause> clauses = HornParser.parse("(p→q)∧(⊤→p)∧(q∧r→⊥)");

        assertEquals(List.of(
                new HornClause(Set.of("p"), "q"),
                HornClause.fact("p"),
                new HornClause(Set.of("q", "r"), HornClause.BOTTOM)), clauses);
        assertTrue(clauses.get(2).concludesBottom());
    }

    @Test
    void parsesBareSingleClause() throws LogicException {
        assertEquals(List.of(new HornClause(Set.of("p", "q"), "r")), HornParser.parse("p ∧ q → r"));
        assertEquals(List.of(HornClause.fact("s")), HornParser.parse("⊤→s"));
    }

    @Test
    void emptyInputHasNoClauses() throws LogicException {
        assertTrue(HornParser.parse("").isEmpty());
        assertTrue(HornParser.parse("   ").isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"p", "p→q∨r", "¬p→q", "(p→q)∧", "(p→q)(q→r)", "p→q∧(q→r)", "((p→q))",
            "p→⊤", "⊤∧p→q", "(p→q)∧q→r", "p∨q→r", "→p", "(p→q"})
    void rejectsFormulasOutsideTheFragment(String text) {
        assertThrows(SyntaxException.class, () -> HornParser.parse(text));
    }

    @Test
    void lexicalErrorsAreRejected() {
        assertThrows(LexicalException.class, () -> HornParser.parse("p → Q"));
    }

    @Test
    void clauseRendering() {
        assertEquals("⊤→p", HornClause.fact("p").toString());
        assertEquals("p∧q→⊥", new HornClause(Set.of("q", "p"), HornClause.BOTTOM).toString());
    }
}
