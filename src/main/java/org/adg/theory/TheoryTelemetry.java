package org.adg.theory;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable snapshot of the bound theory configuration.
 */
@Value
@Builder
public class TheoryTelemetry {
    String formalismId;
    int order;
    List<Integer> bodyRanks;
    /**
     * 0 when the formalism has no observable vertex.
     */
    int maxObservableBodyRank;
    int parallelism;
}
