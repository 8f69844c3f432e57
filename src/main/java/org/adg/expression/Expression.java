package org.adg.expression;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Algebraic expression of one diagram.
 * <p>
 * For time-independent formalisms {@link #getTerms()} and {@link #timeIntegrated()} coincide.
 * For time-dependent ones every term belongs to one time ordering and carries its
 * gap exponents; {@link #timeIntegrated()} is the integrated form.
 * </p>
 */
@Value
@Builder
public class Expression {
    @Singular
    List<ExpressionTerm> terms;

    @Singular("timeIntegratedTerm")
    List<ExpressionTerm> timeIntegratedTerms;

    /**
     * True when the integrated form was derived in closed form from the time structure
     * rather than by merging per-ordering terms.
     */
    boolean closedForm;

    public List<ExpressionTerm> timeIntegrated() {
        return timeIntegratedTerms;
    }

    /**
     * Integrated contribution of every time ordering, unmerged.
     */
    public List<ExpressionTerm> orderingIntegrated() {
        return terms.stream().map(ExpressionTerm::integrated).collect(Collectors.toList());
    }

    public boolean isTimeDependent() {
        return terms.stream().anyMatch(ExpressionTerm::isTimeDependent);
    }

    public String render() {
        return timeIntegratedTerms.stream().map(ExpressionTerm::render).collect(Collectors.joining(" "));
    }
}
