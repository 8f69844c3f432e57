package org.adg.theory;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates a {@link TheoryConfig} once and locks it into an immutable execution context.
 * Every configuration failure surfaces here, before any enumeration starts.
 */
public final class TheoryRuntimeBinder {
    public static final int MIN_ORDER = 1;
    public static final int MAX_ORDER = 8;
    public static final int MAX_PARALLELISM = 256;

    /**
     * Binds one theory config against a registry.
     *
     * @throws ConfigurationException when the config is incomplete or unsupported.
     */
    public Binding bind(TheoryConfig config, FormalismRulesRegistry registry) {
        if (config == null) {
            throw new ConfigurationException(
                    ConfigurationException.REASON_CONFIG_REQUIRED,
                    "theory config must be provided"
            );
        }
        FormalismRulesRegistry nonNullRegistry = Objects.requireNonNull(registry, "registry");

        String formalismId = formalismId(config);
        if (formalismId == null) {
            throw new ConfigurationException(
                    ConfigurationException.REASON_FORMALISM_REQUIRED,
                    "formalism or formalism id must be provided"
            );
        }
        FormalismRules rules = nonNullRegistry.rules(formalismId);
        if (rules == null) {
            throw new ConfigurationException(
                    ConfigurationException.REASON_UNKNOWN_FORMALISM,
                    "no rules registered for formalism " + formalismId
            );
        }

        if (config.getOrder() < MIN_ORDER || config.getOrder() > MAX_ORDER) {
            throw new ConfigurationException(
                    ConfigurationException.REASON_ORDER_OUT_OF_RANGE,
                    "order must be in [" + MIN_ORDER + ", " + MAX_ORDER + "], got " + config.getOrder()
            );
        }

        List<Integer> bodyRanks = normalizeBodyRanks(config.getBodyRanks(), rules);

        int maxObservableBodyRank = 0;
        if (rules.usesObservable()) {
            maxObservableBodyRank = config.getMaxObservableBodyRank();
            if (maxObservableBodyRank < 1 || maxObservableBodyRank > rules.maxSupportedObservableBodyRank()) {
                throw new ConfigurationException(
                        ConfigurationException.REASON_OBSERVABLE_RANK_UNSUPPORTED,
                        "observable body-rank must be in [1, " + rules.maxSupportedObservableBodyRank()
                                + "] for " + rules.id() + ", got " + maxObservableBodyRank
                );
            }
        }

        if (config.getParallelism() < 1 || config.getParallelism() > MAX_PARALLELISM) {
            throw new ConfigurationException(
                    ConfigurationException.REASON_PARALLELISM_OUT_OF_RANGE,
                    "parallelism must be in [1, " + MAX_PARALLELISM + "], got " + config.getParallelism()
            );
        }

        ResolvedTheoryContext context = ResolvedTheoryContext.builder()
                .formalismId(rules.id())
                .order(config.getOrder())
                .bodyRanks(bodyRanks)
                .maxObservableBodyRank(maxObservableBodyRank)
                .parallelism(config.getParallelism())
                .rules(rules)
                .build();
        TheoryTelemetry telemetry = TheoryTelemetry.builder()
                .formalismId(rules.id())
                .order(config.getOrder())
                .bodyRanks(bodyRanks)
                .maxObservableBodyRank(maxObservableBodyRank)
                .parallelism(config.getParallelism())
                .build();

        return Binding.builder()
                .resolvedTheoryContext(context)
                .theoryTelemetry(telemetry)
                .build();
    }

    private static String formalismId(TheoryConfig config) {
        String explicit = config.getFormalismId();
        if (explicit != null && !explicit.trim().isEmpty()) {
            return explicit.trim();
        }
        return config.getFormalism() == null ? null : config.getFormalism().id();
    }

    private static List<Integer> normalizeBodyRanks(Set<Integer> requested, FormalismRules rules) {
        if (requested == null || requested.isEmpty()) {
            throw new ConfigurationException(
                    ConfigurationException.REASON_BODY_RANKS_REQUIRED,
                    "at least one interaction body-rank must be provided"
            );
        }
        List<Integer> ranks = new ArrayList<>(requested.size());
        for (Integer rank : requested) {
            if (rank == null || !rules.supportedBodyRanks().contains(rank)) {
                throw new ConfigurationException(
                        ConfigurationException.REASON_BODY_RANK_UNSUPPORTED,
                        "body-rank " + rank + " is not supported by " + rules.id()
                                + ", supported: " + rules.supportedBodyRanks()
                );
            }
            ranks.add(rank);
        }
        ranks.sort(null);
        return List.copyOf(ranks);
    }

    /**
     * Immutable theory binding output.
     */
    @Value
    @Builder
    public static class Binding {
        /**
         * Locked context consumed by every pipeline stage.
         */
        ResolvedTheoryContext resolvedTheoryContext;

        /**
         * Startup telemetry for the bound configuration.
         */
        TheoryTelemetry theoryTelemetry;
    }
}
