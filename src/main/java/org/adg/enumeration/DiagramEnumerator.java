package org.adg.enumeration;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.extern.slf4j.Slf4j;
import org.adg.graph.Diagram;
import org.adg.graph.DiagramBuilder;
import org.adg.graph.VertexKind;
import org.adg.theory.FormalismRules;
import org.adg.theory.ResolvedTheoryContext;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Backtracking generator of saturated candidate diagrams.
 * <p>
 * Vertices are placed in index order. Placing a vertex fixes its body-rank and the number
 * of lines it sends to every vertex; partial degrees never exceed the capacity of their
 * vertex. Only candidates whose every vertex is exactly saturated are yielded. Candidates
 * are not deduplicated and not checked against global validity rules.
 * </p>
 */
@Slf4j
public final class DiagramEnumerator {
    private final ResolvedTheoryContext context;
    private final FormalismRules rules;
    private final int vertexCount;
    private final int[] maxRankAt;

    public DiagramEnumerator(ResolvedTheoryContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.rules = Objects.requireNonNull(context.getRules(), "context.rules");
        this.vertexCount = context.getOrder();
        this.maxRankAt = new int[vertexCount];
        for (int p = 0; p < vertexCount; p++) {
            IntList options = rules.bodyRankOptions(context, p);
            int max = 0;
            for (int i = 0; i < options.size(); i++) {
                max = Math.max(max, options.getInt(i));
            }
            maxRankAt[p] = max;
        }
    }

    /**
     * Returns a fresh lazy iterator over all candidates. Each call restarts the search;
     * a single iterator cannot be rewound.
     */
    public Iterator<Diagram> enumerate() {
        return new CandidateIterator();
    }

    public Stream<Diagram> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(enumerate(), Spliterator.ORDERED | Spliterator.NONNULL),
                false
        );
    }

    private final class CandidateIterator implements Iterator<Diagram> {
        private final Deque<SearchState> stack = new ArrayDeque<>();
        private Diagram next;
        private long yielded;
        private boolean exhausted;

        private CandidateIterator() {
            DiagramBuilder root = Diagram.builder(vertexCount, rules.lineRoleResolver())
                    .balanced(rules.balancedVertices());
            for (int p = 0; p < vertexCount; p++) {
                root.vertex(p, rules.vertexKind(p), 0);
            }
            if (vertexCount > 0) {
                stack.push(new SearchState(root, 0));
            }
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Diagram next() {
            if (!hasNext()) {
                throw new NoSuchElementException("candidate enumeration exhausted");
            }
            Diagram result = next;
            next = null;
            return result;
        }

        private Diagram advance() {
            while (!stack.isEmpty()) {
                SearchState state = stack.pop();
                if (state.isComplete()) {
                    if (saturated(state.partial)) {
                        yielded++;
                        return state.partial.build();
                    }
                    continue;
                }
                List<SearchState> children = expand(state);
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
            if (!exhausted) {
                exhausted = true;
                log.debug("Enumeration of {} order {} exhausted after {} candidates",
                        context.getFormalismId(), vertexCount, yielded);
            }
            return null;
        }
    }

    private List<SearchState> expand(SearchState state) {
        int p = state.position;
        List<SearchState> children = new ArrayList<>();
        IntList rankOptions = rules.bodyRankOptions(context, p);
        VertexKind kind = rules.vertexKind(p);
        for (int r = 0; r < rankOptions.size(); r++) {
            int rank = rankOptions.getInt(r);
            DiagramBuilder ranked = state.partial.copy().vertex(p, kind, rank);
            int capacity = 2 * rank - ranked.inDegree(p);
            if (capacity < 0 || (rules.balancedVertices() && ranked.inDegree(p) > rank)) {
                continue;
            }
            int minOut = rules.minOutLines(kind, rank);
            int maxOut = Math.min(rules.maxOutLines(kind, rank), capacity);
            for (int total = minOut; total <= maxOut; total++) {
                distribute(ranked, p, 0, total, new int[vertexCount], children);
            }
        }
        return children;
    }

    /**
     * Spreads {@code remaining} outgoing lines of vertex {@code p} over targets {@code >= target}.
     */
    private void distribute(DiagramBuilder ranked, int p, int target, int remaining, int[] counts, List<SearchState> sink) {
        if (target == vertexCount) {
            if (remaining == 0) {
                DiagramBuilder child = ranked.copy();
                for (int t = 0; t < vertexCount; t++) {
                    if (counts[t] > 0) {
                        child.addLines(p, t, counts[t]);
                    }
                }
                sink.add(new SearchState(child, p + 1));
            }
            return;
        }
        int limit = 0;
        if (remaining > 0 && rules.allowsLines(ranked, p, target)) {
            limit = Math.min(remaining, inCapacity(ranked, p, target));
        }
        for (int count = 0; count <= limit; count++) {
            counts[target] = count;
            distribute(ranked, p, target + 1, remaining - count, counts, sink);
        }
        counts[target] = 0;
    }

    /**
     * Free incoming slots of {@code target} while vertex {@code p} is being placed.
     * Vertices not placed yet are bounded by the largest rank they may take.
     */
    private int inCapacity(DiagramBuilder partial, int p, int target) {
        int rank = target <= p ? partial.bodyRank(target) : maxRankAt[target];
        int in = partial.inDegree(target);
        if (rules.balancedVertices()) {
            return Math.max(0, rank - in);
        }
        int out = target <= p ? partial.outDegree(target) : 0;
        return Math.max(0, 2 * rank - in - out);
    }

    private boolean saturated(DiagramBuilder partial) {
        for (int v = 0; v < vertexCount; v++) {
            int in = partial.inDegree(v);
            int out = partial.outDegree(v);
            int rank = partial.bodyRank(v);
            if (in + out != 2 * rank) {
                return false;
            }
            if (rules.balancedVertices() && in != out) {
                return false;
            }
        }
        return true;
    }
}
