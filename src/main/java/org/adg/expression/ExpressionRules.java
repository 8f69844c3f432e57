package org.adg.expression;

import org.adg.canonical.CanonicalForm;

/**
 * Formalism-specific translation of a canonical diagram into its expression.
 */
public interface ExpressionRules {

    String id();

    /**
     * Builds the expression of a canonical, already validated diagram.
     */
    Expression synthesize(CanonicalForm form);
}
