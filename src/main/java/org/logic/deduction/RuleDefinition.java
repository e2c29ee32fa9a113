package org.logic.deduction;

import org.logic.error.LogicException;
import org.logic.error.SemanticException;
import org.logic.formula.Formula;

import java.util.List;

/**
 * DEFINIZIONE DI REGOLA - Voce della tabella delle regole
 *
 * Associa a un nome la forma dei riferimenti e la verifica. Le regole con una
 * {@link Derivation} sono definite una sola volta in forma produttiva: la verifica
 * deriva la formula attesa e la confronta strutturalmente con quella corrente, e la
 * stessa derivazione è usata dall'applicatore di regole singole.
 */
public final class RuleDefinition {

    private final String name;
    private final ReferenceShape shape;
    private final InferenceRule rule;
    private final Derivation derivation;

    private RuleDefinition(String name, ReferenceShape shape, InferenceRule rule, Derivation derivation) {
        if (name == null || shape == null || rule == null) {
            throw new IllegalArgumentException("Nome, forma e verifica della regola sono obbligatori");
        }
        this.name = name;
        this.shape = shape;
        this.rule = rule;
        this.derivation = derivation;
    }

    //region COSTRUZIONE

    /**
     * Regola di sola verifica, senza forma produttiva.
     */
    public static RuleDefinition checked(String name, ReferenceShape shape, InferenceRule rule) {
        return new RuleDefinition(name, shape, rule, null);
    }

    /**
     * Regola produttiva su righe singole: la verifica è derivazione più confronto.
     */
    public static RuleDefinition derived(String name, ReferenceShape shape, Derivation derivation) {
        if (shape.lineCount() != shape.arity()) {
            throw new IllegalArgumentException("Regola produttiva " + name + " con riferimenti a intervallo");
        }
        InferenceRule rule = input -> {
            Formula expected = derivation.derive(input.lines());
            if (!expected.equals(input.current())) {
                throw new SemanticException(name + ": atteso " + expected + ", trovato " + input.current());
            }
        };
        return new RuleDefinition(name, shape, rule, derivation);
    }

    //endregion

    //region ACCESSORS

    public String getName() {
        return name;
    }

    public ReferenceShape getShape() {
        return shape;
    }

    public boolean isDerivable() {
        return derivation != null;
    }

    //endregion

    //region APPLICAZIONE

    public void check(RuleInput input) throws LogicException {
        rule.check(input);
    }

    /**
     * Calcola la formula derivata dalle premesse.
     *
     * @throws SemanticException se la regola non è produttiva, l'arità non corrisponde
     *                           o le premesse non hanno la forma richiesta
     */
    public Formula derive(List<Formula> premises) throws SemanticException {
        if (derivation == null) {
            throw new SemanticException("Regola " + name + " non applicabile in forma produttiva");
        }
        if (premises.size() != shape.arity()) {
            throw new SemanticException("Regola " + name + " richiede " + shape.arity() +
                    " riferimenti, forniti " + premises.size());
        }
        return derivation.derive(premises);
    }

    //endregion

    @Override
    public String toString() {
        return name + " " + shape;
    }
}
