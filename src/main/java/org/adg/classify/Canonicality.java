package org.adg.classify;

/**
 * Whether a diagram contains degree-2 vertices, i.e. one-body insertions.
 */
public enum Canonicality {
    /** No vertex of degree 2. */
    CANONICAL,
    /** Only the observable has degree 2. */
    OBSERVABLE_CANONICAL,
    /** At least one interaction vertex has degree 2. */
    NON_CANONICAL
}
