package org.logic.parser;

/**
 * Token a singolo carattere prodotto dal {@link Tokenizer}.
 *
 * @param kind categoria del token
 * @param symbol testo del token (un solo carattere)
 * @param position indice del carattere nel testo originale
 */
public record Token(TokenKind kind, String symbol, int position) {

    public Token {
        if (kind == null || symbol == null || symbol.length() != 1) {
            throw new IllegalArgumentException("Token malformato: " + kind + " '" + symbol + "'");
        }
    }

    @Override
    public String toString() {
        return symbol;
    }
}
