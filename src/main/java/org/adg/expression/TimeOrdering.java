package org.adg.expression;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Value;

/**
 * One admissible time ordering: canonical vertex indices from earliest to latest.
 */
@Value
public class TimeOrdering {
    IntList vertices;

    public TimeOrdering(int[] vertices) {
        this.vertices = IntLists.unmodifiable(new IntArrayList(vertices));
    }

    /**
     * Time slot of a vertex in this ordering.
     */
    public int position(int vertex) {
        return vertices.indexOf(vertex);
    }

    public int size() {
        return vertices.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < vertices.size(); i++) {
            if (i > 0) {
                sb.append(" < ");
            }
            sb.append('v').append(vertices.getInt(i));
        }
        return sb.toString();
    }
}
