package org.adg.theory;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.adg.canonical.VertexColoring;
import org.adg.expression.ExpressionRules;
import org.adg.expression.MbptExpressionRules;
import org.adg.graph.Diagram;
import org.adg.graph.DiagramBuilder;
import org.adg.graph.Line;
import org.adg.graph.LineRole;
import org.adg.graph.LineRoleResolver;
import org.adg.graph.VertexKind;
import org.adg.validity.ValidityRule;
import org.adg.validity.ValidityRules;

import java.util.List;
import java.util.Set;

/**
 * Time-independent MBPT on a Hartree-Fock reference: time-ordered vertices with equal
 * numbers of incoming and outgoing lines.
 */
public final class MbptRules implements FormalismRules {
    private static final Set<Integer> SUPPORTED_BODY_RANKS = Set.of(1, 2, 3);
    private static final ExpressionRules EXPRESSION_RULES = new MbptExpressionRules();

    @Override
    public String id() {
        return Formalism.MBPT.id();
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
        return false;
    }

    @Override
    public int maxSupportedObservableBodyRank() {
        return 0;
    }

    @Override
    public LineRoleResolver lineRoleResolver() {
        return LineRoleResolver.TIME_POSITION;
    }

    @Override
    public VertexColoring vertexColoring() {
        return VertexColoring.TIME_POSITION;
    }

    @Override
    public boolean balancedVertices() {
        return true;
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
        return bodyRank;
    }

    @Override
    public int maxOutLines(VertexKind kind, int bodyRank) {
        return bodyRank;
    }

    @Override
    public boolean allowsLines(DiagramBuilder partial, int from, int to) {
        return from != to;
    }

    @Override
    public List<ValidityRule> validityRules() {
        return ValidityRules.mbptRules();
    }

    @Override
    public ExpressionRules expressionRules() {
        return EXPRESSION_RULES;
    }

    /**
     * Largest number of particle lines crossing a cut between consecutive vertices.
     */
    @Override
    public int excitationLevel(Diagram diagram) {
        int max = 0;
        for (int gap = 0; gap < diagram.vertexCount() - 1; gap++) {
            int particles = 0;
            for (Line line : diagram.lines()) {
                if (line.getRole() == LineRole.PARTICLE && line.getFrom() <= gap && gap < line.getTo()) {
                    particles++;
                }
            }
            max = Math.max(max, particles);
        }
        return max;
    }
}
