package org.adg.theory;

import it.unimi.dsi.fastutil.ints.IntList;
import org.adg.canonical.VertexColoring;
import org.adg.expression.ExpressionRules;
import org.adg.graph.Diagram;
import org.adg.graph.DiagramBuilder;
import org.adg.graph.LineRoleResolver;
import org.adg.graph.VertexKind;
import org.adg.validity.ValidityRule;

import java.util.List;
import java.util.Set;

/**
 * Strategy contract bundling everything that differs between formalisms.
 */
public interface FormalismRules {

    /**
     * Stable strategy identifier.
     */
    String id();

    /**
     * Interaction body-ranks this formalism can expand.
     */
    Set<Integer> supportedBodyRanks();

    /**
     * True when position 0 of every diagram is an observable vertex.
     */
    boolean usesObservable();

    /**
     * True when vertices carry imaginary times, so diagrams have a time-flow structure.
     */
    boolean timeOrdered();

    /**
     * Largest observable body-rank accepted; 0 when {@link #usesObservable()} is false.
     */
    int maxSupportedObservableBodyRank();

    LineRoleResolver lineRoleResolver();

    VertexColoring vertexColoring();

    /**
     * True when every vertex must have as many incoming as outgoing lines.
     */
    boolean balancedVertices();

    VertexKind vertexKind(int position);

    /**
     * Body-ranks the enumerator may try at a position, ascending.
     */
    IntList bodyRankOptions(ResolvedTheoryContext context, int position);

    int minOutLines(VertexKind kind, int bodyRank);

    int maxOutLines(VertexKind kind, int bodyRank);

    /**
     * Local attachment rule checked before lines {@code from -> to} are added to a partial diagram.
     */
    boolean allowsLines(DiagramBuilder partial, int from, int to);

    /**
     * Ordered rules a complete diagram must pass.
     */
    List<ValidityRule> validityRules();

    ExpressionRules expressionRules();

    int excitationLevel(Diagram diagram);
}
