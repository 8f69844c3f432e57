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
 * BMBPT norm kernel.
 * <p>
 * Same local rules as {@link BmbptRules} without the observable: every position holds an
 * interaction vertex, so all vertices share one colour and deduplication is plain isomorphism.
 * </p>
 */
public final class BmbptNormRules implements FormalismRules {
    private static final Set<Integer> SUPPORTED_BODY_RANKS = Set.of(1, 2, 3);
    private static final ExpressionRules EXPRESSION_RULES = new BmbptExpressionRules();

    @Override
    public String id() {
        return Formalism.BMBPT_NORM.id();
    }

    @Override
    public Set<Integer> supportedBodyRanks() {
        return SUPPORTED_BODY_RANKS;
    }

    @Override
    public boolean usesObservable() {
        return false;
    }

    @Override
    public boolean timeOrdered() {
        return true;
    }

    @Override
    public int maxSupportedObservableBodyRank() {
        return 0;
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
        return VertexKind.INTERACTION;
    }

    @Override
    public IntList bodyRankOptions(ResolvedTheoryContext context, int position) {
        return new IntArrayList(context.getBodyRanks());
    }

    @Override
    public int minOutLines(VertexKind kind, int bodyRank) {
        return 0;
    }

    @Override
    public int maxOutLines(VertexKind kind, int bodyRank) {
        return 2 * bodyRank;
    }

    @Override
    public boolean allowsLines(DiagramBuilder partial, int from, int to) {
        return from != to && partial.lines(to, from) == 0;
    }

    @Override
    public List<ValidityRule> validityRules() {
        return ValidityRules.bmbptNormRules();
    }

    @Override
    public ExpressionRules expressionRules() {
        return EXPRESSION_RULES;
    }

    /**
     * Norm diagrams have no external lines.
     */
    @Override
    public int excitationLevel(Diagram diagram) {
        return 0;
    }
}
