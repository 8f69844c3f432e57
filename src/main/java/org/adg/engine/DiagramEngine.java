package org.adg.engine;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.adg.canonical.CanonicalForm;
import org.adg.canonical.CanonicalKey;
import org.adg.canonical.Canonicalizer;
import org.adg.canonical.DeduplicationTable;
import org.adg.canonical.VertexColoring;
import org.adg.classify.Classification;
import org.adg.classify.DiagramClassifier;
import org.adg.core.InternalConsistencyException;
import org.adg.enumeration.DiagramEnumerator;
import org.adg.expression.Expression;
import org.adg.expression.ExpressionSynthesizer;
import org.adg.graph.Diagram;
import org.adg.theory.ConfigurationException;
import org.adg.theory.FormalismRules;
import org.adg.theory.FormalismRulesRegistry;
import org.adg.theory.ResolvedTheoryContext;
import org.adg.theory.TheoryConfig;
import org.adg.theory.TheoryRuntimeBinder;
import org.adg.validity.ValidityFilter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Diagram generation entry point.
 *
 * <p>Execution flow for one {@link TheoryConfig}:</p>
 * <ul>
 * <li>Bind and validate the configuration; configuration failures surface before any work.</li>
 * <li>Enumerate saturated candidates lazily and canonicalize them in batches into one
 * {@link DeduplicationTable}.</li>
 * <li>Drop unique diagrams violating the formalism's validity rules.</li>
 * <li>Classify every survivor and synthesize its expression.</li>
 * <li>Return diagrams ordered by canonical key, with run telemetry.</li>
 * </ul>
 *
 * <p>Post-enumeration stages run on a fixed pool of {@code parallelism} workers; with
 * parallelism 1 everything runs on the caller thread. Output is identical either way.</p>
 */
@Slf4j
public final class DiagramEngine {
    static final int CANONICALIZATION_BATCH_SIZE = 256;

    private final FormalismRulesRegistry registry;
    private final TheoryRuntimeBinder binder;

    /**
     * Creates an engine.
     *
     * @param registry formalism strategies; defaults to the built-in registry.
     * @param binder configuration binder; defaults to a fresh binder.
     */
    @Builder
    public DiagramEngine(FormalismRulesRegistry registry, TheoryRuntimeBinder binder) {
        this.registry = registry == null ? FormalismRulesRegistry.defaultRegistry() : registry;
        this.binder = binder == null ? new TheoryRuntimeBinder() : binder;
    }

    public DiagramEngine() {
        this(null, null);
    }

    /**
     * Generates every valid, non-redundant diagram of a theory at the configured order.
     *
     * @throws ConfigurationException when the configuration is invalid.
     * @throws InternalConsistencyException when a valid diagram cannot be expanded.
     */
    public GenerationResult generate(TheoryConfig config) {
        long startNanos = System.nanoTime();
        TheoryRuntimeBinder.Binding binding = binder.bind(config, registry);
        ResolvedTheoryContext context = binding.getResolvedTheoryContext();
        FormalismRules rules = context.getRules();
        log.debug("Bound {} order {} body-ranks {} parallelism {}",
                context.getFormalismId(), context.getOrder(), context.getBodyRanks(), context.getParallelism());

        ExecutorService executor = context.getParallelism() > 1
                ? Executors.newFixedThreadPool(context.getParallelism())
                : null;
        try {
            VertexColoring coloring = rules.vertexColoring();
            DeduplicationTable table = new DeduplicationTable();
            long candidates = 0;
            Iterator<Diagram> candidateIterator = new DiagramEnumerator(context).enumerate();
            List<Diagram> batch = new ArrayList<>(CANONICALIZATION_BATCH_SIZE);
            while (candidateIterator.hasNext()) {
                batch.add(candidateIterator.next());
                if (batch.size() == CANONICALIZATION_BATCH_SIZE || !candidateIterator.hasNext()) {
                    candidates += batch.size();
                    mapAll(executor, batch, candidate -> table.offer(Canonicalizer.canonicalize(candidate, coloring)),
                            candidate -> "candidate " + candidate);
                    batch.clear();
                }
            }
            log.debug("{} candidates, {} unique after canonicalization", candidates, table.size());

            ValidityFilter filter = new ValidityFilter(rules.validityRules());
            List<CanonicalForm> accepted = new ArrayList<>();
            for (CanonicalForm form : table.sortedForms()) {
                if (filter.accepts(form.getDiagram())) {
                    accepted.add(form);
                }
            }
            Map<String, Long> rejections = filter.rejectionCounts();
            log.debug("{} diagrams accepted, rejections by rule {}", accepted.size(), rejections);

            Set<CanonicalKey> acceptedKeys = new HashSet<>();
            for (CanonicalForm form : accepted) {
                acceptedKeys.add(form.getKey());
            }
            DiagramClassifier classifier = new DiagramClassifier(rules);
            ExpressionSynthesizer synthesizer = new ExpressionSynthesizer(rules.expressionRules());
            List<Annotated> annotated = mapAll(executor, accepted,
                    form -> new Annotated(classifier.classify(form, acceptedKeys), synthesizer.synthesize(form)),
                    form -> form.getKey().toString());

            List<GeneratedDiagram> diagrams = new ArrayList<>(accepted.size());
            for (int i = 0; i < accepted.size(); i++) {
                CanonicalForm form = accepted.get(i);
                diagrams.add(GeneratedDiagram.builder()
                        .index(i + 1)
                        .key(form.getKey())
                        .diagram(form.getDiagram())
                        .automorphismCount(form.getAutomorphismCount())
                        .symmetryFactor(form.getSymmetryFactor())
                        .classification(annotated.get(i).classification())
                        .expression(annotated.get(i).expression())
                        .build());
            }

            long elapsed = System.nanoTime() - startNanos;
            GenerationTelemetry telemetry = GenerationTelemetry.builder()
                    .theory(binding.getTheoryTelemetry())
                    .candidateCount(candidates)
                    .duplicateCount(table.duplicateCount())
                    .uniqueCount(table.size())
                    .rejectedCount(filter.rejectedCount())
                    .rejectionsByRule(rejections)
                    .acceptedCount(diagrams.size())
                    .elapsedNanos(elapsed)
                    .build();
            log.info("Generated {} {} diagrams at order {} ({} candidates, {} duplicates, {} rejected) in {} ms",
                    diagrams.size(), context.getFormalismId(), context.getOrder(), candidates,
                    table.duplicateCount(), filter.rejectedCount(), elapsed / 1_000_000L);
            return new GenerationResult(diagrams, telemetry);
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    /**
     * Applies {@code task} to every item, on the executor when present, preserving input order.
     */
    private static <T, R> List<R> mapAll(
            ExecutorService executor,
            List<T> items,
            Function<T, R> task,
            Function<T, String> describe
    ) {
        List<R> results = new ArrayList<>(items.size());
        if (executor == null) {
            for (T item : items) {
                results.add(task.apply(item));
            }
            return results;
        }
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(executor.submit(() -> task.apply(item)));
        }
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new InternalConsistencyException(
                        InternalConsistencyException.REASON_WORKER_FAILURE,
                        describe.apply(items.get(i)),
                        "interrupted while waiting for worker",
                        ex
                );
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new InternalConsistencyException(
                        InternalConsistencyException.REASON_WORKER_FAILURE,
                        describe.apply(items.get(i)),
                        "worker failed",
                        cause
                );
            }
        }
        return results;
    }

    private record Annotated(Classification classification, Expression expression) {
    }
}
