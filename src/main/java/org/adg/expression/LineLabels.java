package org.adg.expression;

import lombok.experimental.UtilityClass;

/**
 * Conventional line labels.
 */
@UtilityClass
public class LineLabels {
    private static final String HOLE_LETTERS = "ijklmn";
    private static final String PARTICLE_LETTERS = "abcdefgh";

    /**
     * i, j, k, l, m, n, then i1, j1, ...
     */
    public String hole(int ordinal) {
        return letter(HOLE_LETTERS, ordinal);
    }

    /**
     * a, b, c, ..., h, then a1, b1, ...
     */
    public String particle(int ordinal) {
        return letter(PARTICLE_LETTERS, ordinal);
    }

    /**
     * k1, k2, ...
     */
    public String quasiparticle(int ordinal) {
        return "k" + (ordinal + 1);
    }

    private String letter(String alphabet, int ordinal) {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be >= 0");
        }
        char c = alphabet.charAt(ordinal % alphabet.length());
        int round = ordinal / alphabet.length();
        return round == 0 ? String.valueOf(c) : c + Integer.toString(round);
    }
}
