package org.logic.deduction;

import org.logic.error.LogicException;
import org.logic.error.SemanticException;
import org.logic.error.SyntaxException;
import org.logic.formula.Formula;
import org.logic.parser.FormulaParser;
import org.logic.parser.GrammarMode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * APPLICATORE DI REGOLE SINGOLE - Derivazione di una formula da premesse numerate
 *
 * Applica una sola regola produttiva della {@link RuleTable} a un insieme di formule
 * già derivate, senza scope. Regole ammesse: ∧i, ∧e1, ∧e2, →e, ¬e, ¬¬e, ¬¬i, MT.
 *
 * FORMATO TESTUALE:
 * <pre>
 * 1    p → q
 * 2    p
 * →e, 1, 2
 * </pre>
 * Le righe di formula iniziano con il numero; la prima riga che non lo fa è
 * l'invocazione della regola e chiude il caso.
 */
public class RuleApplier {

    private static final Logger LOGGER = Logger.getLogger(RuleApplier.class.getName());

    private static final Pattern FORMULA_LINE = Pattern.compile("^\\s*(\\d+)\\s+(.+)$");

    private final FormulaParser parser;

    public RuleApplier() {
        this(GrammarMode.PRECEDENCE);
    }

    public RuleApplier(GrammarMode mode) {
        this.parser = new FormulaParser(mode);
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Applica una regola a formule numerate.
     *
     * @param formulas formule disponibili per numero di riga
     * @param ruleName nome della regola
     * @param references numeri di riga delle premesse, in ordine
     * @return formula derivata oppure rifiuto classificato
     */
    public RuleApplication apply(Map<Integer, Formula> formulas, String ruleName, List<Integer> references) {
        if (formulas == null || ruleName == null || references == null) {
            throw new IllegalArgumentException("Formule, regola e riferimenti non possono essere null");
        }

        try {
            Formula result = derive(formulas, ruleName.trim(), references);
            LOGGER.fine("Regola " + ruleName + " applicata: " + result);
            return RuleApplication.applied(result);
        } catch (LogicException e) {
            LOGGER.warning("Regola " + ruleName + " non applicabile: " + e.getMessage());
            return RuleApplication.rejected(e);
        }
    }

    /**
     * Applica il caso descritto in forma testuale.
     *
     * @param caseLines righe di formula seguite dalla riga di invocazione
     */
    public RuleApplication apply(List<String> caseLines) {
        if (caseLines == null) {
            throw new IllegalArgumentException("Righe del caso non possono essere null");
        }

        Map<Integer, Formula> formulas = new LinkedHashMap<>();
        try {
            for (String rawLine : caseLines) {
                String text = rawLine == null ? "" : rawLine.strip();
                if (text.isEmpty()) {
                    continue;
                }

                Matcher matcher = FORMULA_LINE.matcher(text);
                if (!matcher.matches()) {
                    return invoke(formulas, text);
                }
                formulas.put(parseNumber(matcher.group(1)), parser.parse(matcher.group(2).trim()));
            }
            throw new SyntaxException("Invocazione della regola mancante");
        } catch (LogicException e) {
            LOGGER.warning("Caso non applicabile: " + e.getMessage());
            return RuleApplication.rejected(e);
        }
    }

    public RuleApplication apply(String caseText) {
        if (caseText == null) {
            throw new IllegalArgumentException("Testo del caso non può essere null");
        }
        return apply(Arrays.asList(caseText.split("\\R", -1)));
    }

    //endregion

    //region DERIVAZIONE

    private RuleApplication invoke(Map<Integer, Formula> formulas, String invocation) throws SyntaxException {
        String[] parts = invocation.split(",", -1);
        List<Integer> references = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            references.add(parseNumber(parts[i].trim()));
        }
        return apply(formulas, parts[0].trim(), references);
    }

    private Formula derive(Map<Integer, Formula> formulas, String ruleName, List<Integer> references)
            throws SemanticException {
        RuleDefinition definition = RuleTable.find(ruleName)
                .filter(RuleDefinition::isDerivable)
                .orElseThrow(() -> new SemanticException("Regola non applicabile in forma produttiva: '" +
                        ruleName + "'"));

        List<Formula> premises = new ArrayList<>();
        for (Integer reference : references) {
            Formula premise = formulas.get(reference);
            if (premise == null) {
                throw new SemanticException("Riferimento a formula inesistente: " + reference);
            }
            premises.add(premise);
        }

        return definition.derive(premises);
    }

    private int parseNumber(String digits) throws SyntaxException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new SyntaxException("Numero di riga non valido: '" + digits + "'", e);
        }
    }

    //endregion
}
