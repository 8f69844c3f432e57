package org.adg.graph;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Value;

/**
 * Immutable vertex view inside a {@link Diagram}.
 */
@Value
public class Vertex {
    int index;
    VertexKind kind;
    int bodyRank;
    /** Indices of lines ending on this vertex, ascending. */
    IntList inLines;
    /** Indices of lines starting on this vertex, ascending. */
    IntList outLines;

    public int degree() {
        return inLines.size() + outLines.size();
    }
}
