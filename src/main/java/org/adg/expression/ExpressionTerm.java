package org.adg.expression;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One additive term: {@code sign * multiplicity / symmetryFactor * Π numerators / Π denominators},
 * optionally multiplied by a time-dependent factor {@code exp(-Σ_k (τ_{k+1} - τ_k) Δ_k)}.
 */
@Value
@Builder(toBuilder = true)
public class ExpressionTerm {
    /**
     * +1 or -1.
     */
    int sign;

    /**
     * Number of identical contributions merged into this term.
     */
    @Builder.Default
    long multiplicity = 1;

    long symmetryFactor;

    @Singular
    List<MatrixElement> numerators;

    /**
     * Energy denominators, multiplied together.
     */
    @Singular
    List<EnergySum> denominators;

    /**
     * Time ordering this term belongs to; null for time-independent terms and merged terms.
     */
    TimeOrdering timeOrdering;

    /**
     * {@code Δ_k} per gap between consecutive time slots; empty for time-independent terms.
     */
    @Singular
    List<EnergySum> gapExponents;

    public boolean isTimeDependent() {
        return !gapExponents.isEmpty();
    }

    /**
     * Limit of the time-dependent factor integrated over all intermediate times: every
     * gap exponent becomes an energy denominator.
     */
    public ExpressionTerm integrated() {
        if (!isTimeDependent()) {
            return this;
        }
        return toBuilder()
                .clearGapExponents()
                .denominators(gapExponents)
                .build();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(sign < 0 ? "- " : "+ ");
        long gcd = gcd(multiplicity, symmetryFactor);
        long numerator = multiplicity / gcd;
        long denominator = symmetryFactor / gcd;
        if (denominator != 1) {
            sb.append('(').append(numerator).append('/').append(denominator).append(") ");
        } else if (numerator != 1) {
            sb.append(numerator).append(' ');
        }
        for (MatrixElement element : numerators) {
            sb.append(element.render());
        }
        if (!denominators.isEmpty()) {
            sb.append(" / ");
            for (EnergySum sum : denominators) {
                sb.append('(').append(sum.render()).append(')');
            }
        }
        if (isTimeDependent()) {
            sb.append(" exp[-(");
            for (int k = 0; k < gapExponents.size(); k++) {
                if (k > 0) {
                    sb.append(" + ");
                }
                sb.append("(t").append(k + 1).append(" - t").append(k).append(")(")
                        .append(gapExponents.get(k).render()).append(')');
            }
            sb.append(")]");
        }
        return sb.toString();
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a == 0 ? 1 : a;
    }

    @Override
    public String toString() {
        return render();
    }
}
