package org.logic;

import org.logic.cnf.CNFConverter;
import org.logic.deduction.ProofValidator;
import org.logic.deduction.RuleApplier;
import org.logic.error.LogicException;
import org.logic.formula.Formula;
import org.logic.horn.HornSATSolver;
import org.logic.parser.FormulaParser;
import org.logic.parser.GrammarMode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * WORKBENCH LOGICO - Facciata testo → testo delle operazioni del banco
 *
 * Ogni operazione riceve il testo di un elemento e restituisce la stringa di output
 * definitiva; nessuna eccezione controllata esce da questa classe.
 *
 * OPERAZIONI E OUTPUT:
 * • checkWff: "Valid Formula" / "Invalid Formula"
 * • toCnf: clausole formattate, "Invalid Formula" se il testo non è una formula
 * • solveHorn: "Satisfiable [atomi]" / "Unsatisfiable" / "Invalid Horn Formula"
 * • applyRule: formula derivata in forma canonica / "Rule Cannot Be Applied"
 * • validateProof: "Valid Deduction" / "Invalid Deduction at Line N"
 *
 * SUDDIVISIONE DEI FILE IN ELEMENTI (process):
 * • WFF, CNF, HORN: una formula per riga non vuota
 * • RULE: casi separati da righe vuote
 * • PROOF: l'intero file è una sola prova
 */
public class Workbench {

    private static final Logger LOGGER = Logger.getLogger(Workbench.class.getName());

    static final String VALID_FORMULA = "Valid Formula";
    static final String INVALID_FORMULA = "Invalid Formula";

    private final FormulaParser parser;
    private final CNFConverter converter = new CNFConverter();
    private final HornSATSolver hornSolver = new HornSATSolver();
    private final RuleApplier ruleApplier;
    private final ProofValidator proofValidator;

    public Workbench() {
        this(GrammarMode.PRECEDENCE);
    }

    public Workbench(GrammarMode mode) {
        this.parser = new FormulaParser(mode);
        this.ruleApplier = new RuleApplier(mode);
        this.proofValidator = new ProofValidator(mode);
    }

    //region OPERAZIONI SU SINGOLI ELEMENTI

    public String checkWff(String text) {
        return parser.isWellFormed(text) ? VALID_FORMULA : INVALID_FORMULA;
    }

    public String toCnf(String text) {
        Formula formula;
        try {
            formula = parser.parse(text);
        } catch (LogicException e) {
            LOGGER.warning("Conversione CNF rifiutata per '" + text + "': " + e.getMessage());
            return INVALID_FORMULA;
        }
        return converter.convert(formula).format();
    }

    public String solveHorn(String text) {
        return hornSolver.solve(text).render();
    }

    public String applyRule(List<String> caseLines) {
        return ruleApplier.apply(caseLines).render();
    }

    public String validateProof(List<String> proofLines) {
        return proofValidator.validate(proofLines).render();
    }

    //endregion

    //region ELABORAZIONE DI UN FILE

    /**
     * Elabora il contenuto di un file di input nella modalità indicata.
     *
     * @param mode operazione da eseguire
     * @param content contenuto completo del file
     * @return una riga di output per ogni elemento, nell'ordine del file
     */
    public List<String> process(WorkbenchConfiguration.Mode mode, String content) {
        if (mode == null || content == null) {
            throw new IllegalArgumentException("Modalità e contenuto non possono essere null");
        }

        List<String> results = new ArrayList<>();
        switch (mode) {
            case WFF -> nonBlankLines(content).forEach(line -> results.add(checkWff(line)));
            case CNF -> nonBlankLines(content).forEach(line -> results.add(toCnf(line)));
            case HORN -> nonBlankLines(content).forEach(line -> results.add(solveHorn(line)));
            case RULE -> {
                for (String block : content.strip().split("\\R\\s*\\R")) {
                    if (!block.isBlank()) {
                        results.add(applyRule(lines(block)));
                    }
                }
            }
            case PROOF -> results.add(validateProof(lines(content)));
        }

        LOGGER.info("Elaborati " + results.size() + " elementi in modalità " + mode);
        return results;
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\\R", -1));
    }

    private static List<String> nonBlankLines(String text) {
        return lines(text).stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    //endregion
}
