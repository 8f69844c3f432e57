package org.adg.theory;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Validated, immutable view of a {@link TheoryConfig} with its formalism strategy attached.
 */
@Value
@Builder
public class ResolvedTheoryContext {
    /**
     * Locked formalism strategy id.
     */
    String formalismId;

    int order;

    /**
     * Allowed interaction body-ranks, ascending.
     */
    List<Integer> bodyRanks;

    int maxObservableBodyRank;

    int parallelism;

    /**
     * Bound formalism strategy.
     */
    FormalismRules rules;
}
