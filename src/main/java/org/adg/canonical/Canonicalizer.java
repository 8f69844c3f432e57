package org.adg.canonical;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntRBTreeMap;
import lombok.experimental.UtilityClass;
import org.adg.graph.Diagram;

import java.util.Arrays;
import java.util.Objects;

/**
 * Canonical relabeling of diagrams.
 * <p>
 * Vertices are first partitioned by colour refinement, starting from the formalism colour
 * plus in-degree, out-degree and self-loop count, and refined by sorted neighbour signatures
 * until the partition is stable. Classes are laid out by ascending colour; every permutation
 * inside still-ambiguous classes is then scored and the lexicographically smallest encoding
 * wins. Permutations reaching that minimum are exactly the colour-preserving automorphisms.
 * </p>
 */
@UtilityClass
public class Canonicalizer {

    /**
     * Canonicalizes a diagram.
     * <p>
     * When the input is already in canonical vertex order the returned form references
     * the same {@link Diagram} instance.
     * </p>
     */
    public CanonicalForm canonicalize(Diagram diagram, VertexColoring coloring) {
        Objects.requireNonNull(diagram, "diagram");
        Objects.requireNonNull(coloring, "coloring");
        int n = diagram.vertexCount();
        int[] colors = refinedColors(diagram, coloring);

        Integer[] sorted = new Integer[n];
        for (int v = 0; v < n; v++) {
            sorted[v] = v;
        }
        Arrays.sort(sorted, (a, b) -> colors[a] != colors[b] ? Integer.compare(colors[a], colors[b]) : Integer.compare(a, b));
        int[] slotColors = new int[n];
        for (int p = 0; p < n; p++) {
            slotColors[p] = colors[sorted[p]];
        }

        Search search = new Search(diagram, colors, slotColors);
        search.run(0);

        int[] identity = new int[n];
        for (int v = 0; v < n; v++) {
            identity[v] = v;
        }
        int[] identityCode = encode(diagram, colors, identity);
        Diagram canonical = Arrays.equals(identityCode, search.bestCode)
                ? diagram
                : diagram.relabel(search.bestOrder);

        long symmetryFactor = search.automorphisms;
        for (int from = 0; from < n; from++) {
            for (int to = 0; to < n; to++) {
                symmetryFactor *= factorial(diagram.lines(from, to));
            }
        }
        return new CanonicalForm(new CanonicalKey(search.bestCode), canonical, search.automorphisms, symmetryFactor);
    }

    /**
     * Convenience for key-only lookups.
     */
    public CanonicalKey key(Diagram diagram, VertexColoring coloring) {
        return canonicalize(diagram, coloring).getKey();
    }

    /**
     * Stable colour partition, colours rank-compressed to {@code 0..classes-1}.
     */
    int[] refinedColors(Diagram diagram, VertexColoring coloring) {
        int n = diagram.vertexCount();
        int[][] initial = new int[n][];
        for (int v = 0; v < n; v++) {
            initial[v] = new int[]{
                    coloring.color(diagram, v),
                    diagram.inDegree(v),
                    diagram.outDegree(v),
                    diagram.selfLoops(v)
            };
        }
        int[] colors = compress(initial);
        int classes = distinct(colors);
        while (true) {
            int[][] signatures = new int[n][];
            for (int v = 0; v < n; v++) {
                signatures[v] = neighbourSignature(diagram, colors, v);
            }
            int[] refined = compress(signatures);
            int refinedClasses = distinct(refined);
            colors = refined;
            if (refinedClasses == classes) {
                return colors;
            }
            classes = refinedClasses;
        }
    }

    private int[] neighbourSignature(Diagram diagram, int[] colors, int v) {
        IntList neighbours = diagram.neighbors(v);
        int[][] triples = new int[neighbours.size()][];
        for (int i = 0; i < neighbours.size(); i++) {
            int u = neighbours.getInt(i);
            triples[i] = new int[]{colors[u], diagram.lines(v, u), diagram.lines(u, v)};
        }
        Arrays.sort(triples, Arrays::compare);
        int[] signature = new int[1 + 3 * triples.length];
        signature[0] = colors[v];
        for (int i = 0; i < triples.length; i++) {
            System.arraycopy(triples[i], 0, signature, 1 + 3 * i, 3);
        }
        return signature;
    }

    private int[] compress(int[][] tuples) {
        int[][] ascending = tuples.clone();
        Arrays.sort(ascending, Arrays::compare);
        Object2IntRBTreeMap<int[]> ranks = new Object2IntRBTreeMap<>(Arrays::compare);
        for (int[] tuple : ascending) {
            if (!ranks.containsKey(tuple)) {
                ranks.put(tuple, ranks.size());
            }
        }
        int[] colors = new int[tuples.length];
        for (int v = 0; v < tuples.length; v++) {
            colors[v] = ranks.getInt(tuples[v]);
        }
        return colors;
    }

    private int distinct(int[] colors) {
        return (int) Arrays.stream(colors).distinct().count();
    }

    private int[] encode(Diagram diagram, int[] colors, int[] order) {
        int n = order.length;
        int[] code = new int[1 + 3 * n + n * n];
        code[0] = n;
        for (int p = 0; p < n; p++) {
            int v = order[p];
            code[1 + 3 * p] = colors[v];
            code[2 + 3 * p] = diagram.kind(v).ordinal();
            code[3 + 3 * p] = diagram.bodyRank(v);
        }
        int offset = 1 + 3 * n;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                code[offset + i * n + j] = diagram.lines(order[i], order[j]);
            }
        }
        return code;
    }

    private long factorial(int k) {
        long result = 1;
        for (int i = 2; i <= k; i++) {
            result *= i;
        }
        return result;
    }

    /**
     * Exhaustive assignment of vertices to canonical positions within colour classes.
     */
    private static final class Search {
        private final Diagram diagram;
        private final int[] colors;
        private final int[] slotColors;
        private final boolean[] used;
        private final int[] order;
        private int[] bestCode;
        private int[] bestOrder;
        private long automorphisms;

        private Search(Diagram diagram, int[] colors, int[] slotColors) {
            this.diagram = diagram;
            this.colors = colors;
            this.slotColors = slotColors;
            this.used = new boolean[colors.length];
            this.order = new int[colors.length];
        }

        private void run(int position) {
            int n = colors.length;
            if (position == n) {
                int[] code = encode(diagram, colors, order);
                int cmp = bestCode == null ? -1 : Arrays.compare(code, bestCode);
                if (cmp < 0) {
                    bestCode = code;
                    bestOrder = order.clone();
                    automorphisms = 1;
                } else if (cmp == 0) {
                    automorphisms++;
                }
                return;
            }
            for (int v = 0; v < n; v++) {
                if (!used[v] && colors[v] == slotColors[position]) {
                    used[v] = true;
                    order[position] = v;
                    run(position + 1);
                    used[v] = false;
                }
            }
        }
    }
}
