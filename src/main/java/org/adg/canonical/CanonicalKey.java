package org.adg.canonical;

import java.util.Arrays;

/**
 * Value-equal, totally ordered encoding of a canonically relabelled diagram.
 * <p>
 * Layout: vertex count, then per canonical position its refined colour, kind ordinal and
 * body-rank, then the adjacency counts row-major.
 * </p>
 */
public final class CanonicalKey implements Comparable<CanonicalKey> {
    private final int[] code;
    private final int hash;

    CanonicalKey(int[] code) {
        this.code = code.clone();
        this.hash = Arrays.hashCode(this.code);
    }

    /**
     * Returns a copy of the raw encoding.
     */
    public int[] code() {
        return code.clone();
    }

    public int vertexCount() {
        return code.length == 0 ? 0 : code[0];
    }

    @Override
    public int compareTo(CanonicalKey other) {
        return Arrays.compare(code, other.code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CanonicalKey)) {
            return false;
        }
        return Arrays.equals(code, ((CanonicalKey) o).code);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        int n = vertexCount();
        StringBuilder sb = new StringBuilder("G").append(n).append('[');
        int adjacencyStart = 1 + 3 * n;
        for (int i = adjacencyStart; i < code.length; i++) {
            if (i > adjacencyStart) {
                sb.append((i - adjacencyStart) % n == 0 ? '|' : ' ');
            }
            sb.append(code[i]);
        }
        sb.append(']');
        for (int p = 0; p < n; p++) {
            if (code[1 + 3 * p + 1] != 0) {
                sb.append('*').append(p);
            }
        }
        return sb.toString();
    }
}
