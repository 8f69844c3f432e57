package org.adg.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable directed multigraph of vertices and lines addressed by stable integer ids.
 * <p>
 * Lines are materialized row-major from the adjacency counts, so line {@code k}
 * is stable for a given adjacency matrix. Equality is structural: two diagrams
 * are equal when vertex kinds, body-ranks and adjacency counts coincide.
 * </p>
 */
public final class Diagram {
    private final VertexKind[] kinds;
    private final int[] bodyRanks;
    private final int[][] adjacency;
    private final LineRoleResolver roleResolver;
    private final boolean balanced;

    private final List<Vertex> vertices;
    private final List<Line> lines;
    private final int observableIndex;

    Diagram(VertexKind[] kinds, int[] bodyRanks, int[][] adjacency, LineRoleResolver roleResolver, boolean balanced) {
        this.kinds = kinds;
        this.bodyRanks = bodyRanks;
        this.adjacency = adjacency;
        this.roleResolver = roleResolver;
        this.balanced = balanced;

        int n = kinds.length;
        int observable = -1;
        for (int v = 0; v < n; v++) {
            if (kinds[v] == VertexKind.OBSERVABLE) {
                observable = v;
                break;
            }
        }
        this.observableIndex = observable;

        IntArrayList[] in = new IntArrayList[n];
        IntArrayList[] out = new IntArrayList[n];
        for (int v = 0; v < n; v++) {
            in[v] = new IntArrayList();
            out[v] = new IntArrayList();
        }
        ArrayList<Line> lineList = new ArrayList<>();
        for (int from = 0; from < n; from++) {
            for (int to = 0; to < n; to++) {
                for (int k = 0; k < adjacency[from][to]; k++) {
                    int index = lineList.size();
                    boolean external = kinds[from] == VertexKind.OBSERVABLE || kinds[to] == VertexKind.OBSERVABLE;
                    lineList.add(new Line(index, from, to, roleResolver.resolve(from, to), external));
                    out[from].add(index);
                    in[to].add(index);
                }
            }
        }
        ArrayList<Vertex> vertexList = new ArrayList<>(n);
        for (int v = 0; v < n; v++) {
            vertexList.add(new Vertex(v, kinds[v], bodyRanks[v],
                    IntLists.unmodifiable(in[v]), IntLists.unmodifiable(out[v])));
        }
        this.lines = Collections.unmodifiableList(lineList);
        this.vertices = Collections.unmodifiableList(vertexList);
    }

    /**
     * Creates a builder for a diagram with a fixed number of vertices.
     */
    public static DiagramBuilder builder(int vertexCount, LineRoleResolver roleResolver) {
        return new DiagramBuilder(vertexCount, roleResolver);
    }

    public int vertexCount() {
        return kinds.length;
    }

    public int lineCount() {
        return lines.size();
    }

    public Vertex vertex(int index) {
        return vertices.get(index);
    }

    public Line line(int index) {
        return lines.get(index);
    }

    public List<Vertex> vertices() {
        return vertices;
    }

    public List<Line> lines() {
        return lines;
    }

    public VertexKind kind(int vertex) {
        return kinds[vertex];
    }

    public int bodyRank(int vertex) {
        return bodyRanks[vertex];
    }

    /**
     * Number of lines running from {@code from} to {@code to}.
     */
    public int lines(int from, int to) {
        return adjacency[from][to];
    }

    public IntList inLines(int vertex) {
        return vertices.get(vertex).getInLines();
    }

    public IntList outLines(int vertex) {
        return vertices.get(vertex).getOutLines();
    }

    public int inDegree(int vertex) {
        return inLines(vertex).size();
    }

    public int outDegree(int vertex) {
        return outLines(vertex).size();
    }

    public int degree(int vertex) {
        return inDegree(vertex) + outDegree(vertex);
    }

    public int selfLoops(int vertex) {
        return adjacency[vertex][vertex];
    }

    /**
     * Distinct vertices joined to {@code vertex} by at least one line in either direction, ascending.
     */
    public IntList neighbors(int vertex) {
        IntArrayList result = new IntArrayList();
        for (int other = 0; other < kinds.length; other++) {
            if (other != vertex && (adjacency[vertex][other] > 0 || adjacency[other][vertex] > 0)) {
                result.add(other);
            }
        }
        return result;
    }

    /**
     * Index of the observable vertex, or -1 when the diagram has none.
     */
    public int observableIndex() {
        return observableIndex;
    }

    public boolean hasObservable() {
        return observableIndex >= 0;
    }

    public LineRoleResolver roleResolver() {
        return roleResolver;
    }

    public boolean balanced() {
        return balanced;
    }

    public int maxBodyRank() {
        int max = 0;
        for (int rank : bodyRanks) {
            max = Math.max(max, rank);
        }
        return max;
    }

    /**
     * Returns the diagram with vertices moved to new positions.
     *
     * @param order {@code order[newIndex]} is the old index of the vertex placed at {@code newIndex}.
     */
    public Diagram relabel(int[] order) {
        int n = kinds.length;
        if (order.length != n) {
            throw new InvalidTopologyException(
                    InvalidTopologyException.REASON_INVALID_RELABELING,
                    "relabeling has " + order.length + " entries for " + n + " vertices"
            );
        }
        boolean[] seen = new boolean[n];
        for (int old : order) {
            if (old < 0 || old >= n || seen[old]) {
                throw new InvalidTopologyException(
                        InvalidTopologyException.REASON_INVALID_RELABELING,
                        "relabeling is not a permutation: " + Arrays.toString(order)
                );
            }
            seen[old] = true;
        }
        DiagramBuilder builder = new DiagramBuilder(n, roleResolver).balanced(balanced);
        for (int v = 0; v < n; v++) {
            builder.vertex(v, kinds[order[v]], bodyRanks[order[v]]);
        }
        for (int from = 0; from < n; from++) {
            for (int to = 0; to < n; to++) {
                builder.addLines(from, to, adjacency[order[from]][order[to]]);
            }
        }
        return builder.build();
    }

    /**
     * Returns the diagram with the direction of every line flipped.
     */
    public Diagram reversed() {
        int n = kinds.length;
        DiagramBuilder builder = new DiagramBuilder(n, roleResolver).balanced(balanced);
        for (int v = 0; v < n; v++) {
            builder.vertex(v, kinds[v], bodyRanks[v]);
        }
        for (int from = 0; from < n; from++) {
            for (int to = 0; to < n; to++) {
                builder.addLines(to, from, adjacency[from][to]);
            }
        }
        return builder.build();
    }

    /**
     * Returns a copy of the adjacency counts, {@code [from][to]}.
     */
    public int[][] adjacencyMatrix() {
        int[][] copy = new int[adjacency.length][];
        for (int i = 0; i < adjacency.length; i++) {
            copy[i] = adjacency[i].clone();
        }
        return copy;
    }

    /**
     * Plain-text adjacency dump, one row per vertex, observable rows marked with {@code *}.
     */
    public String toAdjacencyString() {
        StringBuilder sb = new StringBuilder();
        for (int from = 0; from < adjacency.length; from++) {
            sb.append(kinds[from] == VertexKind.OBSERVABLE ? '*' : ' ');
            for (int to = 0; to < adjacency.length; to++) {
                sb.append(' ').append(adjacency[from][to]);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagram)) {
            return false;
        }
        Diagram other = (Diagram) o;
        return Arrays.equals(kinds, other.kinds)
                && Arrays.equals(bodyRanks, other.bodyRanks)
                && Arrays.deepEquals(adjacency, other.adjacency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(kinds), Arrays.hashCode(bodyRanks), Arrays.deepHashCode(adjacency));
    }

    @Override
    public String toString() {
        return "Diagram{vertices=" + kinds.length + ", lines=" + lines.size()
                + ", adjacency=" + Arrays.deepToString(adjacency) + "}";
    }
}
