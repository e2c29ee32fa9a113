package org.logic.parser;

import org.junit.jupiter.api.Test;
import org.logic.error.ErrorKind;
import org.logic.error.LexicalException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

    @Test
    void producesOneTokenPerSymbolSkippingWhitespace() throws LexicalException {
        List<Token> tokens = Tokenizer.tokenize(" ( p ∧\tq ) → ¬ ⊥ ∨ ⊤ ");

        assertEquals(List.of(TokenKind.LPAR, TokenKind.ATOM, TokenKind.AND, TokenKind.ATOM, TokenKind.RPAR,
                        TokenKind.IMPLIES, TokenKind.NOT, TokenKind.BOTTOM, TokenKind.OR, TokenKind.TOP),
                tokens.stream().map(Token::kind).toList());
        assertEquals("p", tokens.get(1).symbol());
        assertEquals(3, tokens.get(1).position());
    }

    @Test
    void adjacentLettersAreSeparateAtoms() throws LexicalException {
        List<Token> tokens = Tokenizer.tokenize("pq");
        assertEquals(2, tokens.size());
        assertEquals("q", tokens.get(1).symbol());
    }

    @Test
    void emptyInputGivesEmptySequence() throws LexicalException {
        assertTrue(Tokenizer.tokenize("").isEmpty());
        assertTrue(Tokenizer.tokenize("   ").isEmpty());
    }

    @Test
    void rejectsCharactersOutsideTheAlphabet() {
        for (String text : List.of("p & q", "P", "p1", "p -> q", "p ∧ q!")) {
            LexicalException e = assertThrows(LexicalException.class, () -> Tokenizer.tokenize(text));
            assertEquals(ErrorKind.LEXICAL, e.getKind());
        }
    }
}
