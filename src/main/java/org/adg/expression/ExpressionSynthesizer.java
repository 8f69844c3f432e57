package org.adg.expression;

import lombok.extern.slf4j.Slf4j;
import org.adg.canonical.CanonicalForm;
import org.adg.core.InternalConsistencyException;

import java.util.Objects;

/**
 * Attaches expressions to canonical diagrams using one formalism's rules.
 */
@Slf4j
public final class ExpressionSynthesizer {
    private final ExpressionRules rules;

    public ExpressionSynthesizer(ExpressionRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public ExpressionRules rules() {
        return rules;
    }

    /**
     * Synthesizes the expression of one diagram.
     *
     * @throws InternalConsistencyException when the rules cannot produce a term for the diagram.
     */
    public Expression synthesize(CanonicalForm form) {
        Objects.requireNonNull(form, "form");
        Expression expression = rules.synthesize(form);
        if (expression == null || expression.getTerms().isEmpty() || expression.timeIntegrated().isEmpty()) {
            throw new InternalConsistencyException(
                    InternalConsistencyException.REASON_NO_TIME_ORDERING,
                    form.getKey().toString(),
                    rules.id() + " rules produced no expression term"
            );
        }
        log.debug("Expression for {}: {} term(s), {} integrated", form.getKey(),
                expression.getTerms().size(), expression.timeIntegrated().size());
        return expression;
    }
}
