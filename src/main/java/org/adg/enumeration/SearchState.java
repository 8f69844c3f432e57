package org.adg.enumeration;

import org.adg.graph.DiagramBuilder;

/**
 * One frame of the enumeration search: a partial diagram whose rows
 * {@code [0, position)} are fixed.
 * <p>
 * Frames own their builder; children are branched with {@link DiagramBuilder#copy()}.
 * </p>
 */
final class SearchState {

    /** Partial diagram; every vertex below {@link #position} has its outgoing lines placed. */
    final DiagramBuilder partial;

    /** Next vertex to place. */
    final int position;

    SearchState(DiagramBuilder partial, int position) {
        this.partial = partial;
        this.position = position;
    }

    boolean isComplete() {
        return position == partial.vertexCount();
    }

    @Override
    public String toString() {
        return "SearchState{" +
                "position=" + position +
                ", vertices=" + partial.vertexCount() +
                '}';
    }
}
