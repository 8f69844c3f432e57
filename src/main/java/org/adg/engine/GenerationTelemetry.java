package org.adg.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.adg.theory.TheoryTelemetry;

import java.util.Map;

/**
 * Immutable per-run counters.
 */
@Value
@Builder
public class GenerationTelemetry {
    /**
     * Bound configuration the run executed.
     */
    TheoryTelemetry theory;

    /**
     * Saturated candidates produced by the enumerator.
     */
    long candidateCount;

    /**
     * Candidates discarded because an isomorphic one was already kept.
     */
    long duplicateCount;

    long uniqueCount;

    /**
     * Unique diagrams dropped by validity rules, total and per rule id.
     */
    long rejectedCount;

    @Singular("rejection")
    Map<String, Long> rejectionsByRule;

    long acceptedCount;

    long elapsedNanos;
}
