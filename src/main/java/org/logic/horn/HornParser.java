package org.logic.horn;

import org.logic.error.LexicalException;
import org.logic.error.SyntaxException;
import org.logic.parser.Token;
import org.logic.parser.TokenKind;
import org.logic.parser.Tokenizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * PARSER HORN - Parser dedicato al frammento di Horn
 *
 * Riconosce esclusivamente congiunzioni di clausole "premessa → conclusione":
 *
 * <pre>
 * Formula    := Clause | '(' Clause ')' ( '∧' '(' Clause ')' )*
 * Clause     := Premise '→' Conclusion
 * Premise    := '⊤' | Atom ( '∧' Atom )*
 * Conclusion := Atom | '⊥'
 * </pre>
 *
 * Qualsiasi formula fuori dal frammento (negazioni, disgiunzioni, parentesi annidate,
 * token residui) viene rifiutata. Il testo vuoto è una formula valida senza clausole.
 * Un'istanza analizza un solo testo e non va riutilizzata.
 */
public class HornParser {

    private static final Logger LOGGER = Logger.getLogger(HornParser.class.getName());

    private final List<Token> tokens;
    private int position = 0;

    private HornParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Analizza una formula di Horn.
     *
     * @param text testo della formula
     * @return clausole nell'ordine del testo
     * @throws LexicalException se il testo contiene caratteri fuori dall'alfabeto
     * @throws SyntaxException se il testo non appartiene al frammento di Horn
     */
    public static List<HornClause> parse(String text) throws LexicalException, SyntaxException {
        List<HornClause> clauses = new HornParser(Tokenizer.tokenize(text)).parseFormula();
        LOGGER.fine("Formula Horn analizzata: " + clauses.size() + " clausole");
        return clauses;
    }

    //region DISCESA RICORSIVA

    private List<HornClause> parseFormula() throws SyntaxException {
        List<HornClause> clauses = new ArrayList<>();
        if (tokens.isEmpty()) {
            return clauses;
        }

        if (current() == TokenKind.LPAR) {
            // Congiunzione di clausole tra parentesi
            while (true) {
                expect(TokenKind.LPAR);
                clauses.add(parseClause());
                expect(TokenKind.RPAR);

                if (current() != TokenKind.AND) {
                    break;
                }
                advance();
            }
        } else {
            // Clausola singola senza parentesi
            clauses.add(parseClause());
        }

        if (position < tokens.size()) {
            throw error("token residuo '" + tokens.get(position).symbol() + "'");
        }
        return clauses;
    }

    private HornClause parseClause() throws SyntaxException {
        Set<String> premise = parsePremise();
        expect(TokenKind.IMPLIES);

        TokenKind kind = current();
        if (kind != TokenKind.ATOM && kind != TokenKind.BOTTOM) {
            throw error("la conclusione deve essere un atomo o ⊥");
        }
        String conclusion = tokens.get(position).symbol();
        advance();

        return new HornClause(premise, conclusion);
    }

    private Set<String> parsePremise() throws SyntaxException {
        Set<String> premise = new LinkedHashSet<>();

        if (current() == TokenKind.TOP) {
            advance();
            return premise;
        }

        premise.add(expectAtom());
        while (current() == TokenKind.AND) {
            advance();
            premise.add(expectAtom());
        }
        return premise;
    }

    //endregion

    //region SUPPORTO TOKEN

    private TokenKind current() {
        return position < tokens.size() ? tokens.get(position).kind() : null;
    }

    private void advance() {
        position++;
    }

    private void expect(TokenKind expected) throws SyntaxException {
        if (current() != expected) {
            throw error("atteso " + expected);
        }
        advance();
    }

    private String expectAtom() throws SyntaxException {
        if (current() != TokenKind.ATOM) {
            throw error("atteso un atomo nella premessa");
        }
        String atom = tokens.get(position).symbol();
        advance();
        return atom;
    }

    private SyntaxException error(String detail) {
        return new SyntaxException("Formula Horn non valida alla posizione " + position + ": " + detail);
    }

    //endregion
}
