package org.logic.parser;

import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.logic.antlr.PropositionalFormulaParser;
import org.logic.antlr.PropositionalFormulaParser.FormulaContext;
import org.logic.error.LexicalException;
import org.logic.error.LogicException;
import org.logic.error.SyntaxException;
import org.logic.formula.Formula;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER DELLE FORMULE - Pipeline completa testo → AST
 *
 * Coordina tokenizzazione, parsing ANTLR a discesa ricorsiva e costruzione dell'albero
 * {@link Formula}. Il parser è tutto-o-niente: una formula produce un albero completo
 * oppure un errore classificato, mai un albero parziale.
 *
 * PIPELINE:
 * 1. Lexing con {@link Tokenizer} (carattere non ammesso → LexicalException)
 * 2. Parsing con BailErrorStrategy: il primo errore interrompe l'analisi
 * 3. Costruzione dell'AST con {@link FormulaTreeBuilder}
 * 4. In modalità STRICT, verifica di un solo operatore binario per livello di parentesi
 *
 * ERRORI SINTATTICI RILEVATI:
 * • Formula vuota, operando mancante, alternativa vuota "()"
 * • Parentesi non bilanciate
 * • Token residui dopo una formula completa
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private final GrammarMode mode;

    /**
     * Parser con la grammatica a precedenze (modalità di riferimento).
     */
    public FormulaParser() {
        this(GrammarMode.PRECEDENCE);
    }

    public FormulaParser(GrammarMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Modalità grammaticale non può essere null");
        }
        this.mode = mode;
    }

    public GrammarMode getMode() {
        return mode;
    }

    //region PARSING

    /**
     * Analizza il testo di una formula e costruisce il suo albero sintattico.
     *
     * @param text testo della formula, spazi ignorati
     * @return albero completo della formula
     * @throws LexicalException se il testo contiene caratteri fuori dall'alfabeto
     * @throws SyntaxException se il testo non è una formula ben formata
     */
    public Formula parse(String text) throws LexicalException, SyntaxException {
        List<org.antlr.v4.runtime.Token> tokens = Tokenizer.lex(text);
        if (tokens.isEmpty()) {
            throw new SyntaxException("Formula vuota");
        }

        FormulaContext tree = buildParseTree(tokens, text);
        Formula formula = new FormulaTreeBuilder().visit(tree);

        if (mode == GrammarMode.STRICT) {
            verifySingleOperatorPerGroup(tokens, text);
        }

        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    /**
     * Verifica di ben formazione senza propagare l'errore.
     *
     * @return true se il testo è una formula ben formata nella modalità corrente
     */
    public boolean isWellFormed(String text) {
        try {
            parse(text);
            return true;
        } catch (LogicException e) {
            LOGGER.fine("Formula non ben formata '" + text + "': " + e.getMessage());
            return false;
        }
    }

    /**
     * Esegue il parser ANTLR sui token già prodotti dal lexer.
     */
    private FormulaContext buildParseTree(List<org.antlr.v4.runtime.Token> tokens, String text)
            throws SyntaxException {
        PropositionalFormulaParser parser =
                new PropositionalFormulaParser(new CommonTokenStream(new ListTokenSource(tokens)));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        parser.setErrorHandler(new BailErrorStrategy());

        try {
            return parser.formula();
        } catch (ParseCancellationException e) {
            String detail = e.getMessage() != null ? e.getMessage() : "struttura non riconosciuta";
            throw new SyntaxException("Formula non ben formata '" + text + "': " + detail, e);
        }
    }

    //endregion

    //region MODALITÀ STRICT

    /**
     * Conta gli operatori binari a ogni livello di parentesi: in modalità STRICT ne è
     * ammesso al più uno per livello. Le parentesi sono già bilanciate a questo punto.
     */
    private void verifySingleOperatorPerGroup(List<org.antlr.v4.runtime.Token> tokens, String text)
            throws SyntaxException {
        Deque<Integer> operatorsPerLevel = new ArrayDeque<>();
        operatorsPerLevel.push(0);

        for (org.antlr.v4.runtime.Token token : tokens) {
            TokenKind kind = TokenKind.fromAntlrType(token.getType());
            switch (kind) {
                case LPAR -> operatorsPerLevel.push(0);
                case RPAR -> operatorsPerLevel.pop();
                default -> {
                    if (kind.isBinaryOperator()) {
                        int count = operatorsPerLevel.pop() + 1;
                        if (count > 1) {
                            throw new SyntaxException("Modalità STRICT: più operatori binari allo stesso " +
                                    "livello di parentesi in '" + text + "'");
                        }
                        operatorsPerLevel.push(count);
                    }
                }
            }
        }
    }

    //endregion
}
