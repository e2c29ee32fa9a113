package org.logic.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.logic.antlr.PropositionalFormulaLexer;
import org.logic.error.LexicalException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * TOKENIZER - Scansione del testo di una formula in token validati
 *
 * Utilizza il lexer ANTLR generato dalla grammatica PropositionalFormula: gli spazi
 * vengono scartati, ogni altro carattere deve appartenere all'alfabeto
 * (lettere minuscole, ¬ ∧ ∨ → ⊤ ⊥ ( )).
 *
 * COMPORTAMENTO:
 * • Scansione da sinistra a destra, un token per carattere
 * • Primo carattere non ammesso → LexicalException, nessuna lista parziale
 * • Testo vuoto → lista vuota (formula vacuamente vuota, usata dal parser Horn)
 */
public final class Tokenizer {

    private static final Logger LOGGER = Logger.getLogger(Tokenizer.class.getName());

    private Tokenizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Scompone il testo nella sequenza di token dell'alfabeto.
     *
     * @param text testo della formula (non null)
     * @return lista immutabile di token, vuota per testo vuoto
     * @throws LexicalException se il testo contiene un carattere non ammesso
     */
    public static List<Token> tokenize(String text) throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        for (org.antlr.v4.runtime.Token antlrToken : lex(text)) {
            tokens.add(new Token(TokenKind.fromAntlrType(antlrToken.getType()),
                    antlrToken.getText(), antlrToken.getStartIndex()));
        }
        return List.copyOf(tokens);
    }

    /**
     * Esegue il lexer ANTLR e restituisce i token grezzi (EOF escluso), pronti per
     * alimentare il parser senza una seconda scansione.
     */
    static List<org.antlr.v4.runtime.Token> lex(String text) throws LexicalException {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }

        PropositionalFormulaLexer lexer = new PropositionalFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        try {
            List<? extends org.antlr.v4.runtime.Token> tokens = lexer.getAllTokens();
            LOGGER.finest("Token riconosciuti: " + tokens.size());
            return new ArrayList<>(tokens);
        } catch (ParseCancellationException e) {
            LOGGER.fine("Carattere non ammesso in '" + text + "': " + e.getMessage());
            throw new LexicalException("Carattere non ammesso, " + e.getMessage(), e);
        }
    }
}
