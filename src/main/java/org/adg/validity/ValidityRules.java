package org.adg.validity;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.UtilityClass;
import org.adg.graph.Diagram;
import org.adg.graph.TimeFlow;
import org.adg.graph.VertexKind;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Built-in validity rules.
 */
@UtilityClass
public class ValidityRules {
    public static final String RULE_CONNECTED = "CONNECTED";
    public static final String RULE_NO_SELF_LOOP = "NO_SELF_LOOP";
    public static final String RULE_ACYCLIC_TIME_FLOW = "ACYCLIC_TIME_FLOW";
    public static final String RULE_OBSERVABLE_LAST = "OBSERVABLE_LAST";

    /**
     * Every vertex reachable from vertex 0 ignoring line direction.
     */
    public static final ValidityRule CONNECTED = named(RULE_CONNECTED, ValidityRules::isConnected);

    /**
     * No line starts and ends on the same vertex.
     */
    public static final ValidityRule NO_SELF_LOOP = named(RULE_NO_SELF_LOOP, diagram -> {
        for (int v = 0; v < diagram.vertexCount(); v++) {
            if (diagram.selfLoops(v) > 0) {
                return false;
            }
        }
        return true;
    });

    /**
     * Lines admit a consistent time ordering.
     */
    public static final ValidityRule ACYCLIC_TIME_FLOW = named(RULE_ACYCLIC_TIME_FLOW, TimeFlow::isAcyclic);

    /**
     * The observable vertex emits no line and can therefore close every time ordering.
     */
    public static final ValidityRule OBSERVABLE_LAST = named(RULE_OBSERVABLE_LAST, diagram -> {
        for (int v = 0; v < diagram.vertexCount(); v++) {
            if (diagram.kind(v) == VertexKind.OBSERVABLE && diagram.outDegree(v) > 0) {
                return false;
            }
        }
        return true;
    });

    public List<ValidityRule> mbptRules() {
        return List.of(CONNECTED, NO_SELF_LOOP);
    }

    public List<ValidityRule> bmbptRules() {
        return List.of(CONNECTED, NO_SELF_LOOP, ACYCLIC_TIME_FLOW, OBSERVABLE_LAST);
    }

    public List<ValidityRule> bmbptNormRules() {
        return List.of(CONNECTED, NO_SELF_LOOP, ACYCLIC_TIME_FLOW);
    }

    /**
     * Wraps a predicate as a named rule.
     */
    public ValidityRule named(String id, Predicate<Diagram> predicate) {
        return new NamedRule(Objects.requireNonNull(id, "id"), Objects.requireNonNull(predicate, "predicate"));
    }

    private boolean isConnected(Diagram diagram) {
        int n = diagram.vertexCount();
        if (n == 0) {
            return true;
        }
        boolean[] seen = new boolean[n];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(0);
        seen[0] = true;
        int reached = 1;
        while (!queue.isEmpty()) {
            int v = queue.dequeueInt();
            IntList neighbours = diagram.neighbors(v);
            for (int i = 0; i < neighbours.size(); i++) {
                int u = neighbours.getInt(i);
                if (!seen[u]) {
                    seen[u] = true;
                    reached++;
                    queue.enqueue(u);
                }
            }
        }
        return reached == n;
    }

    private record NamedRule(String id, Predicate<Diagram> predicate) implements ValidityRule {
        @Override
        public boolean accepts(Diagram diagram) {
            return predicate.test(diagram);
        }
    }
}
