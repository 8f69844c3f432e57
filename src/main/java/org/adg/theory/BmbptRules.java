package org.adg.theory;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.adg.canonical.VertexColoring;
import org.adg.expression.BmbptExpressionRules;
import org.adg.expression.ExpressionRules;
import org.adg.graph.Diagram;
import org.adg.graph.DiagramBuilder;
import org.adg.graph.LineRoleResolver;
import org.adg.graph.VertexKind;
import org.adg.validity.ValidityRule;
import org.adg.validity.ValidityRules;

import java.util.List;
import java.util.Set;

/**
 * Time-dependent Bogoliubov MBPT operator kernels.
 * <p>
 * Position 0 holds the observable, which only absorbs lines. Interaction vertices split
 * their {@code 2 x body-rank} line ends freely between incoming and outgoing, and two
 * vertices are never joined in both directions.
 * </p>
 */
public final class BmbptRules implements FormalismRules {
    public static final int OBSERVABLE_POSITION = 0;

    private static final Set<Integer> SUPPORTED_BODY_RANKS = Set.of(1, 2, 3);
    private static final int MAX_OBSERVABLE_BODY_RANK = 3;
    private static final ExpressionRules EXPRESSION_RULES = new BmbptExpressionRules();

    @Override
    public String id() {
        return Formalism.BMBPT.id();
    }

    @Override
    public Set<Integer> supportedBodyRanks() {
        return SUPPORTED_BODY_RANKS;
    }

    @Override
    public boolean usesObservable() {
        return true;
    }

    @Override
    public boolean timeOrdered() {
        return true;
    }

    @Override
    public int maxSupportedObservableBodyRank() {
        return MAX_OBSERVABLE_BODY_RANK;
    }

    @Override
    public LineRoleResolver lineRoleResolver() {
        return LineRoleResolver.QUASIPARTICLE;
    }

    @Override
    public VertexColoring vertexColoring() {
        return VertexColoring.VERTEX_KIND;
    }

    @Override
    public boolean balancedVertices() {
        return false;
    }

    @Override
    public VertexKind vertexKind(int position) {
        return position == OBSERVABLE_POSITION ? VertexKind.OBSERVABLE : VertexKind.INTERACTION;
    }

    @Override
    public IntList bodyRankOptions(ResolvedTheoryContext context, int position) {
        if (position != OBSERVABLE_POSITION) {
            return new IntArrayList(context.getBodyRanks());
        }
        IntArrayList ranks = new IntArrayList();
        for (int rank = 1; rank <= context.getMaxObservableBodyRank(); rank++) {
            ranks.add(rank);
        }
        return ranks;
    }

    @Override
    public int minOutLines(VertexKind kind, int bodyRank) {
        return 0;
    }

    @Override
    public int maxOutLines(VertexKind kind, int bodyRank) {
        return kind == VertexKind.OBSERVABLE ? 0 : 2 * bodyRank;
    }

    @Override
    public boolean allowsLines(DiagramBuilder partial, int from, int to) {
        return from != to && partial.lines(to, from) == 0;
    }

    @Override
    public List<ValidityRule> validityRules() {
        return ValidityRules.bmbptRules();
    }

    @Override
    public ExpressionRules expressionRules() {
        return EXPRESSION_RULES;
    }

    /**
     * Number of quasi-particle pairs attached to the observable.
     */
    @Override
    public int excitationLevel(Diagram diagram) {
        int observable = diagram.observableIndex();
        return observable < 0 ? 0 : diagram.degree(observable) / 2;
    }
}
