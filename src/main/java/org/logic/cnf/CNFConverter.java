package org.logic.cnf;

import org.logic.formula.Formula;
import org.logic.support.CNFFormula;
import org.logic.support.Literal;

import java.util.logging.Logger;

/**
 * CONVERTITORE CNF - Riscrittura ricorsiva di una formula in Forma Normale Congiuntiva
 *
 * Trasforma un albero {@link Formula} in un insieme di clausole logicamente equivalente,
 * applicando dall'alto verso il basso tre gruppi di regole.
 *
 * PIPELINE TRASFORMAZIONE:
 * 1. Eliminazione implicazioni: A → B diventa ¬A ∨ B
 * 2. Negazioni verso le foglie (De Morgan e doppia negazione):
 *    • ¬¬A → A
 *    • ¬(A ∧ B) → ¬A ∨ ¬B
 *    • ¬(A ∨ B) → ¬A ∧ ¬B
 *    • ¬(A → B) → A ∧ ¬B
 * 3. Combinazione e distribuzione:
 *    • congiunzione: concatenazione delle clausole degli operandi
 *    • disgiunzione: prodotto cartesiano delle clausole degli operandi
 *
 * CASI BASE:
 * • Letterale: una clausola con il solo letterale
 * • ⊤ (e ¬⊥): nessuna clausola
 * • ⊥ (e ¬⊤): una clausola vuota
 *
 * La distribuzione può crescere esponenzialmente con la dimensione della formula:
 * è un comportamento accettato e documentato, non un difetto.
 */
public class CNFConverter {

    private static final Logger LOGGER = Logger.getLogger(CNFConverter.class.getName());

    //region INTERFACCIA PUBBLICA

    /**
     * METODO PRINCIPALE - Converte la formula in CNF.
     *
     * @param formula formula di partenza (non null)
     * @return formula a clausole logicamente equivalente
     */
    public CNFFormula convert(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da convertire non può essere null");
        }

        LOGGER.fine("Inizio conversione CNF per: " + formula);
        CNFFormula result = toCNF(formula);
        LOGGER.fine("Conversione CNF completata: " + result.getClausesCount() + " clausole");
        return result;
    }

    //endregion

    //region RISCRITTURA RICORSIVA

    private CNFFormula toCNF(Formula node) {
        if (node.isLiteral()) {
            return CNFFormula.ofLiteral(Literal.fromFormula(node));
        }

        return switch (node.getType()) {
            case TOP -> CNFFormula.empty();
            case BOTTOM -> CNFFormula.contradiction();

            // Eliminazione implicazione: A → B ~ ¬A ∨ B
            case IMPLIES -> toCNF(Formula.or(Formula.not(node.getLeft()), node.getRight()));

            case NOT -> pushNegation(node.getOperand());

            case AND -> toCNF(node.getLeft()).concatenate(toCNF(node.getRight()));

            case OR -> toCNF(node.getLeft()).distribute(toCNF(node.getRight()));

            // Un atomo nudo è già gestito come letterale
            case ATOM -> throw new IllegalStateException("Atomo non riconosciuto come letterale: " + node);
        };
    }

    /**
     * Applica le regole di negazione al sottoalbero negato e prosegue la conversione.
     * La negazione di un atomo è un letterale, già gestito dal chiamante.
     */
    private CNFFormula pushNegation(Formula negated) {
        return switch (negated.getType()) {
            // ¬¬A → A
            case NOT -> toCNF(negated.getOperand());

            // ¬(A ∧ B) → ¬A ∨ ¬B
            case AND -> toCNF(Formula.or(
                    Formula.not(negated.getLeft()), Formula.not(negated.getRight())));

            // ¬(A ∨ B) → ¬A ∧ ¬B
            case OR -> toCNF(Formula.and(
                    Formula.not(negated.getLeft()), Formula.not(negated.getRight())));

            // ¬(A → B) → A ∧ ¬B
            case IMPLIES -> toCNF(Formula.and(negated.getLeft(), Formula.not(negated.getRight())));

            // ¬⊤ ~ ⊥, ¬⊥ ~ ⊤
            case TOP -> CNFFormula.contradiction();
            case BOTTOM -> CNFFormula.empty();

            case ATOM -> CNFFormula.ofLiteral(Literal.negative(negated.getName()));
        };
    }

    //endregion
}
