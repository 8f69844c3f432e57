package org.adg.graph;

/**
 * Propagator carried by a line.
 */
public enum LineRole {
    PARTICLE,
    HOLE,
    QUASIPARTICLE
}
