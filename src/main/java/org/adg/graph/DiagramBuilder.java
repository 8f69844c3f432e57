package org.adg.graph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Mutable staging area for a {@link Diagram}.
 * <p>
 * The vertex count is fixed up front; vertex attributes and line multiplicities
 * may be filled in any order. Structural validation happens once in {@link #build()}.
 * Search code branches states through {@link #copy()}, which never aliases arrays.
 * </p>
 */
public final class DiagramBuilder {
    private final int vertexCount;
    private final LineRoleResolver roleResolver;
    private final VertexKind[] kinds;
    private final int[] bodyRanks;
    private final int[][] adjacency;
    private final int[] inDegrees;
    private final int[] outDegrees;
    private boolean balanced;

    public DiagramBuilder(int vertexCount, LineRoleResolver roleResolver) {
        if (vertexCount < 0) {
            throw new IllegalArgumentException("vertexCount must be >= 0");
        }
        this.vertexCount = vertexCount;
        this.roleResolver = Objects.requireNonNull(roleResolver, "roleResolver");
        this.kinds = new VertexKind[vertexCount];
        Arrays.fill(kinds, VertexKind.INTERACTION);
        this.bodyRanks = new int[vertexCount];
        this.adjacency = new int[vertexCount][vertexCount];
        this.inDegrees = new int[vertexCount];
        this.outDegrees = new int[vertexCount];
    }

    private DiagramBuilder(DiagramBuilder source) {
        this.vertexCount = source.vertexCount;
        this.roleResolver = source.roleResolver;
        this.kinds = source.kinds.clone();
        this.bodyRanks = source.bodyRanks.clone();
        this.adjacency = new int[vertexCount][];
        for (int i = 0; i < vertexCount; i++) {
            this.adjacency[i] = source.adjacency[i].clone();
        }
        this.inDegrees = source.inDegrees.clone();
        this.outDegrees = source.outDegrees.clone();
        this.balanced = source.balanced;
    }

    /**
     * Sets kind and body-rank of one vertex.
     */
    public DiagramBuilder vertex(int index, VertexKind kind, int bodyRank) {
        checkVertex(index);
        kinds[index] = Objects.requireNonNull(kind, "kind");
        bodyRanks[index] = bodyRank;
        return this;
    }

    /**
     * Adds {@code count} parallel lines from {@code from} to {@code to}.
     */
    public DiagramBuilder addLines(int from, int to, int count) {
        checkVertex(from);
        checkVertex(to);
        if (count < 0) {
            throw new InvalidTopologyException(
                    InvalidTopologyException.REASON_INVALID_LINE_COUNT,
                    "line count must be >= 0, got " + count + " for " + from + "->" + to
            );
        }
        adjacency[from][to] += count;
        outDegrees[from] += count;
        inDegrees[to] += count;
        return this;
    }

    public DiagramBuilder addLine(int from, int to) {
        return addLines(from, to, 1);
    }

    /**
     * Requires every vertex to have exactly body-rank incoming and body-rank outgoing lines.
     */
    public DiagramBuilder balanced(boolean balanced) {
        this.balanced = balanced;
        return this;
    }

    public int vertexCount() {
        return vertexCount;
    }

    public int lines(int from, int to) {
        return adjacency[from][to];
    }

    public int inDegree(int vertex) {
        return inDegrees[vertex];
    }

    public int outDegree(int vertex) {
        return outDegrees[vertex];
    }

    public int bodyRank(int vertex) {
        return bodyRanks[vertex];
    }

    public VertexKind kind(int vertex) {
        return kinds[vertex];
    }

    /**
     * Returns an independent deep copy of this builder.
     */
    public DiagramBuilder copy() {
        return new DiagramBuilder(this);
    }

    /**
     * Validates degrees against body-ranks and freezes the diagram.
     *
     * @throws InvalidTopologyException when a vertex is not saturated.
     */
    public Diagram build() {
        for (int v = 0; v < vertexCount; v++) {
            if (bodyRanks[v] < 1) {
                throw new InvalidTopologyException(
                        InvalidTopologyException.REASON_INVALID_BODY_RANK,
                        "vertex " + v + " has body-rank " + bodyRanks[v] + ", expected >= 1"
                );
            }
            int degree = inDegrees[v] + outDegrees[v];
            if (degree != 2 * bodyRanks[v]) {
                throw new InvalidTopologyException(
                        InvalidTopologyException.REASON_BODY_RANK_MISMATCH,
                        "vertex " + v + " has " + degree + " line ends, body-rank " + bodyRanks[v]
                                + " requires " + (2 * bodyRanks[v])
                );
            }
            if (balanced && inDegrees[v] != outDegrees[v]) {
                throw new InvalidTopologyException(
                        InvalidTopologyException.REASON_UNBALANCED_VERTEX,
                        "vertex " + v + " has " + inDegrees[v] + " incoming and "
                                + outDegrees[v] + " outgoing lines"
                );
            }
        }
        int[][] frozen = new int[vertexCount][];
        for (int i = 0; i < vertexCount; i++) {
            frozen[i] = adjacency[i].clone();
        }
        return new Diagram(kinds.clone(), bodyRanks.clone(), frozen, roleResolver, balanced);
    }

    private void checkVertex(int index) {
        if (index < 0 || index >= vertexCount) {
            throw new InvalidTopologyException(
                    InvalidTopologyException.REASON_VERTEX_OUT_OF_RANGE,
                    "vertex " + index + " out of range [0, " + vertexCount + ")"
            );
        }
    }
}
