package org.adg.expression;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2LongLinkedOpenHashMap;
import org.adg.canonical.CanonicalForm;
import org.adg.core.InternalConsistencyException;
import org.adg.graph.Diagram;
import org.adg.graph.Line;
import org.adg.graph.TimeFlow;
import org.adg.graph.VertexKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rules for time-dependent Bogoliubov diagrams.
 * <p>
 * Every linear extension of the time flow that places the observable last gives one
 * time-dependent term. Integrating over the intermediate times turns each gap exponent
 * into an energy denominator. When the time structure is a tree the integrated sum
 * collapses to a single product over interaction vertices; otherwise integrated terms
 * with equal denominator multisets are merged.
 * </p>
 * <p>
 * Norm-kernel diagrams have no observable: every linear extension counts, and the closed
 * form skips the root of the in-tree, whose down-set absorbs every line.
 * </p>
 */
public final class BmbptExpressionRules implements ExpressionRules {
    public static final String ID = "BMBPT";
    public static final String OBSERVABLE_OPERATOR = "O";
    public static final String INTERACTION_OPERATOR = "H";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Expression synthesize(CanonicalForm form) {
        Objects.requireNonNull(form, "form");
        Diagram diagram = form.getDiagram();
        int observable = diagram.observableIndex();
        List<int[]> orderings = TimeFlow.linearExtensions(diagram, observable);
        if (orderings.isEmpty()) {
            throw new InternalConsistencyException(
                    InternalConsistencyException.REASON_NO_TIME_ORDERING,
                    form.getKey().toString(),
                    observable < 0
                            ? "diagram admits no time ordering"
                            : "diagram admits no time ordering with the observable last"
            );
        }

        String[] labels = labels(diagram);
        int sign = sign(diagram);
        List<MatrixElement> numerators = numerators(diagram, labels);

        Expression.ExpressionBuilder expression = Expression.builder();
        for (int[] ordering : orderings) {
            ExpressionTerm.ExpressionTermBuilder term = ExpressionTerm.builder()
                    .sign(sign)
                    .symmetryFactor(form.getSymmetryFactor())
                    .numerators(numerators)
                    .timeOrdering(new TimeOrdering(ordering));
            for (int gap = 0; gap < ordering.length - 1; gap++) {
                term.gapExponent(gapSum(diagram, labels, ordering, gap));
            }
            expression.term(term.build());
        }

        if (TimeFlow.isTree(diagram)) {
            ExpressionTerm.ExpressionTermBuilder closed = ExpressionTerm.builder()
                    .sign(sign)
                    .symmetryFactor(form.getSymmetryFactor())
                    .numerators(numerators);
            for (int v = 0; v < diagram.vertexCount(); v++) {
                if (diagram.kind(v) == VertexKind.OBSERVABLE || (observable < 0 && diagram.outDegree(v) == 0)) {
                    continue;
                }
                closed.denominator(leavingDownSet(diagram, labels, v));
            }
            return expression.timeIntegratedTerm(closed.build()).closedForm(true).build();
        }

        List<ExpressionTerm> perOrdering = new ArrayList<>();
        for (int[] ordering : orderings) {
            ExpressionTerm.ExpressionTermBuilder term = ExpressionTerm.builder()
                    .sign(sign)
                    .symmetryFactor(form.getSymmetryFactor())
                    .numerators(numerators);
            for (int gap = 0; gap < ordering.length - 1; gap++) {
                term.denominator(gapSum(diagram, labels, ordering, gap));
            }
            perOrdering.add(term.build());
        }
        return expression.timeIntegratedTerms(merge(perOrdering)).closedForm(false).build();
    }

    /**
     * {@code (-1)^(m + crossings)}: m interaction vertices, crossings between lines drawn as
     * arcs over the canonical vertex line. Lines sharing an endpoint never cross.
     */
    static int sign(Diagram diagram) {
        int interactions = 0;
        for (int v = 0; v < diagram.vertexCount(); v++) {
            if (diagram.kind(v) != VertexKind.OBSERVABLE) {
                interactions++;
            }
        }
        return ((interactions + crossings(diagram)) & 1) == 0 ? 1 : -1;
    }

    static int crossings(Diagram diagram) {
        List<Line> lines = diagram.lines();
        int count = 0;
        for (int i = 0; i < lines.size(); i++) {
            int a = Math.min(lines.get(i).getFrom(), lines.get(i).getTo());
            int b = Math.max(lines.get(i).getFrom(), lines.get(i).getTo());
            for (int j = i + 1; j < lines.size(); j++) {
                int c = Math.min(lines.get(j).getFrom(), lines.get(j).getTo());
                int d = Math.max(lines.get(j).getFrom(), lines.get(j).getTo());
                if ((a < c && c < b && b < d) || (c < a && a < d && d < b)) {
                    count++;
                }
            }
        }
        return count;
    }

    static String[] labels(Diagram diagram) {
        String[] labels = new String[diagram.lineCount()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = LineLabels.quasiparticle(i);
        }
        return labels;
    }

    /**
     * Sum of energies of lines that start at or before slot {@code gap} and end after it.
     */
    static EnergySum gapSum(Diagram diagram, String[] labels, int[] ordering, int gap) {
        int[] position = new int[ordering.length];
        for (int slot = 0; slot < ordering.length; slot++) {
            position[ordering[slot]] = slot;
        }
        EnergySum.EnergySumBuilder sum = EnergySum.builder();
        for (Line line : diagram.lines()) {
            if (position[line.getFrom()] <= gap && gap < position[line.getTo()]) {
                sum.add(labels[line.getIndex()]);
            }
        }
        return sum.build();
    }

    /**
     * Energy of the lines leaving the set formed by {@code vertex} and everything before it.
     */
    static EnergySum leavingDownSet(Diagram diagram, String[] labels, int vertex) {
        IntList downSet = TimeFlow.downSet(diagram, vertex);
        EnergySum.EnergySumBuilder sum = EnergySum.builder();
        for (Line line : diagram.lines()) {
            if (downSet.contains(line.getFrom()) && !downSet.contains(line.getTo())) {
                sum.add(labels[line.getIndex()]);
            }
        }
        return sum.build();
    }

    private static List<MatrixElement> numerators(Diagram diagram, String[] labels) {
        List<MatrixElement> numerators = new ArrayList<>();
        for (int v = 0; v < diagram.vertexCount(); v++) {
            String operator = diagram.kind(v) == VertexKind.OBSERVABLE ? OBSERVABLE_OPERATOR : INTERACTION_OPERATOR;
            numerators.add(new MatrixElement(operator, labelsOf(diagram.outLines(v), labels), labelsOf(diagram.inLines(v), labels)));
        }
        return numerators;
    }

    private static List<String> labelsOf(IntList lines, String[] labels) {
        List<String> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            result.add(labels[lines.getInt(i)]);
        }
        return result;
    }

    /**
     * Merges terms whose denominators form the same multiset, keeping first-seen order.
     */
    static List<ExpressionTerm> merge(List<ExpressionTerm> terms) {
        Object2LongLinkedOpenHashMap<List<String>> multiplicities = new Object2LongLinkedOpenHashMap<>();
        List<ExpressionTerm> representatives = new ArrayList<>();
        for (ExpressionTerm term : terms) {
            List<String> key = denominatorKey(term);
            if (!multiplicities.containsKey(key)) {
                representatives.add(term);
            }
            multiplicities.addTo(key, term.getMultiplicity());
        }
        List<ExpressionTerm> merged = new ArrayList<>(representatives.size());
        for (ExpressionTerm term : representatives) {
            merged.add(term.toBuilder().multiplicity(multiplicities.getLong(denominatorKey(term))).build());
        }
        return merged;
    }

    private static List<String> denominatorKey(ExpressionTerm term) {
        List<String> key = new ArrayList<>();
        for (EnergySum sum : term.getDenominators()) {
            key.add(sum.render());
        }
        key.sort(Comparator.naturalOrder());
        return key;
    }
}
