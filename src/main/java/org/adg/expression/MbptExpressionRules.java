package org.adg.expression;

import it.unimi.dsi.fastutil.ints.IntList;
import org.adg.canonical.CanonicalForm;
import org.adg.graph.Diagram;
import org.adg.graph.Line;
import org.adg.graph.LineRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Goldstone rules for time-ordered MBPT diagrams.
 * <p>
 * Vertex index is time position, so every line running upward is a particle and every
 * line running downward a hole. Each cut between consecutive vertices contributes one
 * energy denominator.
 * </p>
 */
public final class MbptExpressionRules implements ExpressionRules {
    public static final String ID = "MBPT";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Expression synthesize(CanonicalForm form) {
        Diagram diagram = Objects.requireNonNull(form, "form").getDiagram();
        String[] labels = labels(diagram);

        ExpressionTerm.ExpressionTermBuilder term = ExpressionTerm.builder()
                .sign(phase(holeCount(diagram), loopCount(diagram)))
                .symmetryFactor(form.getSymmetryFactor());
        for (int v = 0; v < diagram.vertexCount(); v++) {
            term.numerator(new MatrixElement(
                    operatorName(diagram.bodyRank(v)),
                    labelsOf(diagram.outLines(v), labels),
                    labelsOf(diagram.inLines(v), labels)
            ));
        }
        for (int gap = 0; gap < diagram.vertexCount() - 1; gap++) {
            term.denominator(cutDenominator(diagram, labels, gap));
        }
        ExpressionTerm built = term.build();
        return Expression.builder()
                .term(built)
                .timeIntegratedTerm(built)
                .build();
    }

    /**
     * {@code (-1)^(holes + loops)}.
     */
    public static int phase(int holes, int loops) {
        return ((holes + loops) & 1) == 0 ? 1 : -1;
    }

    static String operatorName(int bodyRank) {
        switch (bodyRank) {
            case 1:
                return "U";
            case 2:
                return "V";
            case 3:
                return "W";
            default:
                return "V" + bodyRank;
        }
    }

    /**
     * Holes labelled i, j, k... and particles a, b, c... in line-index order.
     */
    static String[] labels(Diagram diagram) {
        String[] labels = new String[diagram.lineCount()];
        int holes = 0;
        int particles = 0;
        for (Line line : diagram.lines()) {
            labels[line.getIndex()] = line.getRole() == LineRole.HOLE
                    ? LineLabels.hole(holes++)
                    : LineLabels.particle(particles++);
        }
        return labels;
    }

    static int holeCount(Diagram diagram) {
        int holes = 0;
        for (Line line : diagram.lines()) {
            if (line.getRole() == LineRole.HOLE) {
                holes++;
            }
        }
        return holes;
    }

    /**
     * Closed loops of the line permutation that continues the k-th incoming line of each vertex
     * into its k-th outgoing line.
     */
    static int loopCount(Diagram diagram) {
        int lineCount = diagram.lineCount();
        int[] next = new int[lineCount];
        for (int v = 0; v < diagram.vertexCount(); v++) {
            IntList in = diagram.inLines(v);
            IntList out = diagram.outLines(v);
            for (int k = 0; k < in.size(); k++) {
                next[in.getInt(k)] = out.getInt(k);
            }
        }
        boolean[] visited = new boolean[lineCount];
        int loops = 0;
        for (int start = 0; start < lineCount; start++) {
            if (visited[start]) {
                continue;
            }
            loops++;
            int line = start;
            while (!visited[line]) {
                visited[line] = true;
                line = next[line];
            }
        }
        return loops;
    }

    /**
     * Lines crossing the cut just above vertex {@code gap}: holes enter with +E, particles with -E.
     */
    static EnergySum cutDenominator(Diagram diagram, String[] labels, int gap) {
        EnergySum.EnergySumBuilder sum = EnergySum.builder();
        List<String> particles = new ArrayList<>();
        for (Line line : diagram.lines()) {
            int low = Math.min(line.getFrom(), line.getTo());
            int high = Math.max(line.getFrom(), line.getTo());
            if (low <= gap && gap < high) {
                if (line.getRole() == LineRole.HOLE) {
                    sum.add(labels[line.getIndex()]);
                } else {
                    particles.add(labels[line.getIndex()]);
                }
            }
        }
        return sum.subtracted(particles).build();
    }

    private static List<String> labelsOf(IntList lines, String[] labels) {
        List<String> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            result.add(labels[lines.getInt(i)]);
        }
        return result;
    }
}
