package org.logic.deduction;

import org.logic.error.LogicException;
import org.logic.error.ScopeException;
import org.logic.error.SemanticException;
import org.logic.error.SyntaxException;
import org.logic.formula.Formula;
import org.logic.parser.FormulaParser;
import org.logic.parser.GrammarMode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VALIDATORE DI DEDUZIONE NATURALE - Verifica meccanica di prove con scope annidati
 *
 * Elabora le righe in ordine, una alla volta, su un {@link ProofState}. Il primo errore
 * interrompe la validazione e ne riporta il numero di riga (fail-fast).
 *
 * FORMATO DELLE RIGHE:
 * • Riga di formula: "N  formula  Regola, ref, ref" (due o più spazi tra i campi)
 * • Marcatori: righe che contengono BeginScope o EndScope
 * • Righe vuote: ignorate
 *
 * PIPELINE PER RIGA DI FORMULA:
 * 1. Numero di riga strettamente crescente
 * 2. Parsing della formula e della giustificazione
 * 3. Lookup della regola e verifica della forma dei riferimenti
 * 4. Posizione di Assumption (subito dopo BeginScope, e solo lì)
 * 5. Risoluzione dei riferimenti con le regole di accessibilità
 * 6. Verifica strutturale della regola e registrazione della riga
 *
 * NUMERO DI RIGA RIPORTATO:
 * • Errori su una riga di formula: il suo numero
 * • Riga non riconosciuta che inizia con cifre: quelle cifre
 * • Marcatori sbilanciati, scope senza assunzione, scope aperti a fine prova:
 *   ultimo numero accettato + 1
 */
public class ProofValidator {

    private static final Logger LOGGER = Logger.getLogger(ProofValidator.class.getName());

    private static final String BEGIN_SCOPE = "BeginScope";
    private static final String END_SCOPE = "EndScope";

    private static final Pattern LINE_PATTERN = Pattern.compile("^\\s*(\\d+)\\s+(.+?)\\s{2,}(.+?)\\s*$");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+)");

    private final FormulaParser parser;

    public ProofValidator() {
        this(GrammarMode.PRECEDENCE);
    }

    public ProofValidator(GrammarMode mode) {
        this.parser = new FormulaParser(mode);
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Valida una prova fornita come testo unico, una riga di prova per riga di testo.
     */
    public DeductionResult validate(String proofText) {
        if (proofText == null) {
            throw new IllegalArgumentException("Testo della prova non può essere null");
        }
        return validate(Arrays.asList(proofText.split("\\R", -1)));
    }

    /**
     * METODO PRINCIPALE - Valida una prova riga per riga.
     *
     * @param proofLines righe della prova, marcatori inclusi
     * @return esito valido con le righe accettate, oppure la prima riga rifiutata e la causa
     */
    public DeductionResult validate(List<String> proofLines) {
        if (proofLines == null) {
            throw new IllegalArgumentException("Righe della prova non possono essere null");
        }

        ProofState state = new ProofState();

        for (String rawLine : proofLines) {
            String text = rawLine == null ? "" : rawLine.strip();
            if (text.isEmpty()) {
                continue;
            }

            int reportedLine = state.getLastLineNumber() + 1;
            try {
                if (text.contains(BEGIN_SCOPE)) {
                    state.beginScope();
                } else if (text.contains(END_SCOPE)) {
                    state.endScope();
                } else {
                    Matcher matcher = LINE_PATTERN.matcher(text);
                    reportedLine = lineNumberOf(text, reportedLine);
                    if (!matcher.matches()) {
                        throw new SyntaxException("Riga di prova non riconosciuta: '" + text + "'");
                    }
                    processLine(state, parseNumber(matcher.group(1)), matcher.group(2).trim(),
                            matcher.group(3).trim());
                }
            } catch (LogicException e) {
                return reject(state, reportedLine, e);
            }
        }

        // Fine input: nessuno scope deve restare aperto
        if (state.depth() > 0) {
            return reject(state, state.getLastLineNumber() + 1,
                    new ScopeException("Prova terminata con " + state.depth() + " scope aperti"));
        }

        LOGGER.info("Prova valida: " + state.getLines().size() + " righe");
        return DeductionResult.valid(state.getLines());
    }

    //endregion

    //region ELABORAZIONE DI UNA RIGA

    private void processLine(ProofState state, int number, String formulaText, String justificationText)
            throws LogicException {
        if (number <= state.getLastLineNumber()) {
            throw new SyntaxException("Numero di riga " + number + " non successivo a " + state.getLastLineNumber());
        }

        Formula formula = parser.parse(formulaText);
        Justification justification = Justification.parse(justificationText);
        RuleDefinition definition = RuleTable.lookup(justification.ruleName());

        if (!definition.getShape().matches(justification.references())) {
            throw new SemanticException("Regola " + definition.getName() + " con riferimenti non conformi a " +
                    definition.getShape() + ": " + justification.references());
        }

        boolean isAssumption = RuleTable.ASSUMPTION.equals(definition.getName());
        if (isAssumption != state.isAssumptionRequired()) {
            throw new ScopeException(isAssumption
                    ? "Assumption ammessa solo subito dopo BeginScope"
                    : "BeginScope deve essere seguito da un'Assumption");
        }

        List<Formula> lines = new ArrayList<>();
        List<Subproof> subproofs = new ArrayList<>();
        for (Reference reference : justification.references()) {
            if (reference.range()) {
                subproofs.add(state.resolveRange(reference));
            } else {
                lines.add(state.resolveLine(reference.start()).formula());
            }
        }

        definition.check(new RuleInput(formula, lines, subproofs, state.depth()));

        state.accept(new ProofLine(number, formula, definition.getName(), justification.references(),
                state.depth(), isAssumption, state.currentFrameId()));
    }

    /**
     * Numero di riga da riportare: le cifre iniziali se presenti, altrimenti il valore dato.
     */
    private int lineNumberOf(String text, int fallback) {
        Matcher matcher = LEADING_NUMBER.matcher(text);
        if (!matcher.find()) {
            return fallback;
        }
        int number = parseNumber(matcher.group(1));
        return number > 0 ? number : fallback;
    }

    /**
     * @return il numero rappresentato dalle cifre, -1 se fuori dall'intervallo di int
     */
    private int parseNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            LOGGER.fine("Numero di riga fuori intervallo: " + digits);
            return -1;
        }
    }

    private DeductionResult reject(ProofState state, int line, LogicException cause) {
        LOGGER.warning("Deduzione non valida alla riga " + line + " (" + cause.getKind() + "): " + cause.getMessage());
        return DeductionResult.invalidAt(line, cause, state.getLines());
    }

    //endregion
}
