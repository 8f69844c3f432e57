package org.adg.theory;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Immutable generation request: formalism, perturbative order and allowed vertex body-ranks.
 */
@Value
@Builder(toBuilder = true)
public class TheoryConfig {
    public static final int DEFAULT_MAX_OBSERVABLE_BODY_RANK = 2;

    /**
     * Formalism whose diagrams are generated.
     */
    Formalism formalism;

    /**
     * Id of a registered strategy; when non-blank it selects the rules instead of {@link #formalism}.
     */
    String formalismId;

    /**
     * Perturbative order; equals the number of vertices of every generated diagram.
     */
    int order;

    /**
     * Body-ranks allowed on interaction vertices (1 = one-body, 2 = two-body, 3 = three-body).
     */
    @Singular
    Set<Integer> bodyRanks;

    /**
     * Largest body-rank of the observable vertex. Only read for BMBPT.
     */
    @Builder.Default
    int maxObservableBodyRank = DEFAULT_MAX_OBSERVABLE_BODY_RANK;

    /**
     * Worker threads for post-enumeration stages; 1 runs everything on the caller thread.
     */
    @Builder.Default
    int parallelism = 1;

    /**
     * Two-body MBPT at the given order.
     */
    public static TheoryConfig mbpt(int order) {
        return TheoryConfig.builder()
                .formalism(Formalism.MBPT)
                .order(order)
                .bodyRank(2)
                .build();
    }

    /**
     * Two-body theory with a strategy looked up by id, for formalisms registered at runtime.
     */
    public static TheoryConfig custom(String formalismId, int order) {
        return TheoryConfig.builder()
                .formalismId(formalismId)
                .order(order)
                .bodyRank(2)
                .build();
    }

    /**
     * Two-body BMBPT norm kernel at the given order.
     */
    public static TheoryConfig bmbptNorm(int order) {
        return TheoryConfig.builder()
                .formalism(Formalism.BMBPT_NORM)
                .order(order)
                .bodyRank(2)
                .build();
    }

    /**
     * Two-body BMBPT at the given order with a two-body observable.
     */
    public static TheoryConfig bmbpt(int order) {
        return TheoryConfig.builder()
                .formalism(Formalism.BMBPT)
                .order(order)
                .bodyRank(2)
                .build();
    }
}
