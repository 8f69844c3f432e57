package org.adg.graph;

/**
 * Assigns the propagator role of a line from its endpoints.
 */
@FunctionalInterface
public interface LineRoleResolver {

    /**
     * Vertices are time-ordered by index: lines running forward in time are
     * particles, lines running backward are holes.
     */
    LineRoleResolver TIME_POSITION = (from, to) -> from < to ? LineRole.PARTICLE : LineRole.HOLE;

    /**
     * Every line carries a quasi-particle propagator.
     */
    LineRoleResolver QUASIPARTICLE = (from, to) -> LineRole.QUASIPARTICLE;

    LineRole resolve(int from, int to);
}
