package org.adg.validity;

import lombok.extern.slf4j.Slf4j;
import org.adg.graph.Diagram;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Applies an ordered rule list and counts rejections per rule. Safe for concurrent use.
 */
@Slf4j
public final class ValidityFilter {
    private final List<ValidityRule> rules;
    private final ConcurrentHashMap<String, LongAdder> rejections = new ConcurrentHashMap<>();

    public ValidityFilter(List<? extends ValidityRule> rules) {
        Objects.requireNonNull(rules, "rules");
        for (ValidityRule rule : rules) {
            Objects.requireNonNull(rule, "rule");
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Returns the id of the first rule the diagram violates, or null when it is valid.
     */
    public String firstViolation(Diagram diagram) {
        Objects.requireNonNull(diagram, "diagram");
        for (ValidityRule rule : rules) {
            if (!rule.accepts(diagram)) {
                return rule.id();
            }
        }
        return null;
    }

    /**
     * Returns true for valid diagrams; rejected diagrams are tallied under the violated rule.
     */
    public boolean accepts(Diagram diagram) {
        String violation = firstViolation(diagram);
        if (violation == null) {
            return true;
        }
        rejections.computeIfAbsent(violation, id -> new LongAdder()).increment();
        if (log.isTraceEnabled()) {
            log.trace("Rejected by {}:\n{}", violation, diagram.toAdjacencyString());
        }
        return false;
    }

    public List<ValidityRule> rules() {
        return rules;
    }

    /**
     * Snapshot of rejection counts in rule order; rules without rejections are omitted.
     */
    public Map<String, Long> rejectionCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ValidityRule rule : rules) {
            LongAdder adder = rejections.get(rule.id());
            if (adder != null) {
                counts.put(rule.id(), adder.sum());
            }
        }
        return counts;
    }

    public long rejectedCount() {
        long total = 0;
        for (LongAdder adder : rejections.values()) {
            total += adder.sum();
        }
        return total;
    }
}
