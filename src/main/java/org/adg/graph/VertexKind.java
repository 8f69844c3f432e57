package org.adg.graph;

/**
 * Role of a vertex inside a diagram.
 */
public enum VertexKind {
    /** Perturbation vertex (two- or three-body interaction, or one-body potential). */
    INTERACTION,
    /** Operator vertex carrying the observable; appears only in operator kernels. */
    OBSERVABLE
}
