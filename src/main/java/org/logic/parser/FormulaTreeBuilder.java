package org.logic.parser;

import org.logic.antlr.PropositionalFormulaBaseVisitor;
import org.logic.antlr.PropositionalFormulaParser.AtomFactorContext;
import org.logic.antlr.PropositionalFormulaParser.BinaryOperatorContext;
import org.logic.antlr.PropositionalFormulaParser.BottomFactorContext;
import org.logic.antlr.PropositionalFormulaParser.FormulaContext;
import org.logic.antlr.PropositionalFormulaParser.ImplicationContext;
import org.logic.antlr.PropositionalFormulaParser.NegationFactorContext;
import org.logic.antlr.PropositionalFormulaParser.ParenthesizedFactorContext;
import org.logic.antlr.PropositionalFormulaParser.TermContext;
import org.logic.antlr.PropositionalFormulaParser.TopFactorContext;
import org.logic.formula.Formula;

import java.util.logging.Logger;

/**
 * COSTRUTTORE AST - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Visitor sull'albero di parsing della grammatica PropositionalFormula. Ogni metodo
 * visit gestisce un costrutto grammaticale e restituisce il sottoalbero corrispondente;
 * la costruzione procede bottom-up, dalle foglie alla radice.
 *
 * PRECEDENZE RISPETTATE (dalla più larga alla più stretta):
 * - Implicazione (→): associativa a destra, A → B → C ~ A → (B → C)
 * - Congiunzione e disgiunzione (∧, ∨): stesso livello, associative a sinistra
 * - Negazione (¬): unaria, lega il fattore immediatamente successivo
 * - Atomi, costanti e parentesi
 *
 * A differenza di una conversione CNF, il visitor non trasforma nulla: l'albero
 * prodotto rispecchia esattamente la struttura del testo.
 */
final class FormulaTreeBuilder extends PropositionalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.implication());
        LOGGER.finest("Albero costruito: " + formula);
        return formula;
    }

    //endregion

    //region IMPLICAZIONI (PRECEDENZA PIÙ BASSA)

    /**
     * Gestisce l'implicazione con associatività a destra: il conseguente è a sua volta
     * un'implicazione, visitata ricorsivamente.
     */
    @Override
    public Formula visitImplication(ImplicationContext ctx) {
        Formula antecedent = visit(ctx.term());

        // Caso base: nessun operatore → presente
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }

        Formula consequent = visit(ctx.implication());
        return Formula.implies(antecedent, consequent);
    }

    //endregion

    //region CONGIUNZIONI E DISGIUNZIONI

    /**
     * Gestisce catene di ∧ e ∨ allo stesso livello di precedenza, piegandole da sinistra:
     * p ∧ q ∨ r ~ (p ∧ q) ∨ r.
     */
    @Override
    public Formula visitTerm(TermContext ctx) {
        Formula accumulated = visit(ctx.factor(0));

        for (int i = 1; i < ctx.factor().size(); i++) {
            BinaryOperatorContext operator = ctx.binaryOperator(i - 1);
            Formula next = visit(ctx.factor(i));
            accumulated = operator.AND() != null
                    ? Formula.and(accumulated, next)
                    : Formula.or(accumulated, next);
        }

        return accumulated;
    }

    //endregion

    //region NEGAZIONI, ATOMI E PARENTESI

    @Override
    public Formula visitNegationFactor(NegationFactorContext ctx) {
        return Formula.not(visit(ctx.factor()));
    }

    @Override
    public Formula visitParenthesizedFactor(ParenthesizedFactorContext ctx) {
        // Le parentesi rientrano al livello dell'implicazione e spariscono dall'albero
        return visit(ctx.implication());
    }

    @Override
    public Formula visitAtomFactor(AtomFactorContext ctx) {
        return Formula.atom(ctx.ATOM().getText());
    }

    @Override
    public Formula visitTopFactor(TopFactorContext ctx) {
        return Formula.top();
    }

    @Override
    public Formula visitBottomFactor(BottomFactorContext ctx) {
        return Formula.bottom();
    }

    //endregion
}
