package org.adg.canonical;

import org.adg.graph.Diagram;

/**
 * Formalism-specific initial vertex colour; vertices of different colour are never exchanged
 * by canonical relabeling.
 */
@FunctionalInterface
public interface VertexColoring {

    /**
     * Every vertex keeps its own time slot, so time orderings remain distinct diagrams.
     */
    VertexColoring TIME_POSITION = (diagram, vertex) -> vertex;

    /**
     * Vertices are told apart only by kind (observable vs. interaction).
     */
    VertexColoring VERTEX_KIND = (diagram, vertex) -> diagram.kind(vertex).ordinal();

    int color(Diagram diagram, int vertex);
}
