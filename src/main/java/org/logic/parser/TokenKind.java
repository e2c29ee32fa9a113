package org.logic.parser;

import org.logic.antlr.PropositionalFormulaLexer;

/**
 * Categorie di token dell'alfabeto delle formule, allineate ai tipi del lexer ANTLR.
 */
public enum TokenKind {
    ATOM(PropositionalFormulaLexer.ATOM),
    NOT(PropositionalFormulaLexer.NOT),
    AND(PropositionalFormulaLexer.AND),
    OR(PropositionalFormulaLexer.OR),
    IMPLIES(PropositionalFormulaLexer.IMPLIES),
    TOP(PropositionalFormulaLexer.TOP),
    BOTTOM(PropositionalFormulaLexer.BOTTOM),
    LPAR(PropositionalFormulaLexer.LPAR),
    RPAR(PropositionalFormulaLexer.RPAR);

    private final int antlrType;

    TokenKind(int antlrType) {
        this.antlrType = antlrType;
    }

    /**
     * Operatori binari: quelli contati dalla modalità STRICT.
     */
    public boolean isBinaryOperator() {
        return this == AND || this == OR || this == IMPLIES;
    }

    /**
     * Converte un tipo di token ANTLR nella categoria corrispondente.
     *
     * @throws IllegalArgumentException se il tipo non appartiene all'alfabeto
     */
    public static TokenKind fromAntlrType(int antlrType) {
        for (TokenKind kind : values()) {
            if (kind.antlrType == antlrType) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Tipo di token ANTLR sconosciuto: " + antlrType);
    }
}
