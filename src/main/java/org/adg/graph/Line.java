package org.adg.graph;

import lombok.Value;

/**
 * Immutable directed line inside a {@link Diagram}.
 */
@Value
public class Line {
    int index;
    int from;
    int to;
    LineRole role;
    /** True when one endpoint is the observable vertex. */
    boolean external;

    public boolean isSelfLoop() {
        return from == to;
    }
}
