package org.adg.testutil;

import org.adg.graph.Diagram;
import org.adg.graph.DiagramBuilder;
import org.adg.graph.LineRoleResolver;
import org.adg.graph.VertexKind;

/**
 * Hand-built diagrams with known properties.
 * <p>
 * BMBPT fixtures keep the observable at index 0, the position the enumerator uses.
 * </p>
 */
public final class DiagramFixtures {

    private DiagramFixtures() {
    }

    /**
     * Second-order MBPT: two particles up, two holes down.
     */
    public static Diagram mbptSecondOrder() {
        return Diagram.builder(2, LineRoleResolver.TIME_POSITION)
                .balanced(true)
                .vertex(0, VertexKind.INTERACTION, 2)
                .vertex(1, VertexKind.INTERACTION, 2)
                .addLines(0, 1, 2)
                .addLines(1, 0, 2)
                .build();
    }

    /**
     * Third-order particle-particle ladder.
     */
    public static Diagram mbptParticleLadder() {
        return mbptThirdOrder(new int[][]{{0, 2, 0}, {0, 0, 2}, {2, 0, 0}});
    }

    /**
     * Third-order hole-hole ladder.
     */
    public static Diagram mbptHoleLadder() {
        return mbptThirdOrder(new int[][]{{0, 0, 2}, {2, 0, 0}, {0, 2, 0}});
    }

    /**
     * Third-order ring: one line between every ordered pair of vertices.
     */
    public static Diagram mbptRing() {
        return mbptThirdOrder(new int[][]{{0, 1, 1}, {1, 0, 1}, {1, 1, 0}});
    }

    /**
     * Observable with four lines from a single two-body vertex.
     */
    public static Diagram bmbptSecondOrder() {
        return Diagram.builder(2, LineRoleResolver.QUASIPARTICLE)
                .vertex(0, VertexKind.OBSERVABLE, 2)
                .vertex(1, VertexKind.INTERACTION, 2)
                .addLines(1, 0, 4)
                .build();
    }

    /**
     * Two one-body vertices each sending two lines into the observable.
     */
    public static Diagram bmbptFork() {
        return Diagram.builder(3, LineRoleResolver.QUASIPARTICLE)
                .vertex(0, VertexKind.OBSERVABLE, 2)
                .vertex(1, VertexKind.INTERACTION, 1)
                .vertex(2, VertexKind.INTERACTION, 1)
                .addLines(1, 0, 2)
                .addLines(2, 0, 2)
                .build();
    }

    /**
     * Chain with a transitive shortcut: 1 -> 2 -> observable and 1 -> observable.
     */
    public static Diagram bmbptChain() {
        return Diagram.builder(3, LineRoleResolver.QUASIPARTICLE)
                .vertex(0, VertexKind.OBSERVABLE, 2)
                .vertex(1, VertexKind.INTERACTION, 2)
                .vertex(2, VertexKind.INTERACTION, 2)
                .addLines(1, 2, 2)
                .addLines(1, 0, 2)
                .addLines(2, 0, 2)
                .build();
    }

    /**
     * Vertex 1 branches into vertices 2 and 3, which both close on the observable.
     */
    public static Diagram bmbptBranching() {
        return Diagram.builder(4, LineRoleResolver.QUASIPARTICLE)
                .vertex(0, VertexKind.OBSERVABLE, 1)
                .vertex(1, VertexKind.INTERACTION, 1)
                .vertex(2, VertexKind.INTERACTION, 1)
                .vertex(3, VertexKind.INTERACTION, 1)
                .addLine(1, 2)
                .addLine(1, 3)
                .addLine(2, 0)
                .addLine(3, 0)
                .build();
    }

    /**
     * Three interaction vertices in a directed cycle, each also sending two lines into the observable.
     */
    public static Diagram bmbptCyclic() {
        return Diagram.builder(4, LineRoleResolver.QUASIPARTICLE)
                .vertex(0, VertexKind.OBSERVABLE, 3)
                .vertex(1, VertexKind.INTERACTION, 2)
                .vertex(2, VertexKind.INTERACTION, 2)
                .vertex(3, VertexKind.INTERACTION, 2)
                .addLine(1, 2)
                .addLine(2, 3)
                .addLine(3, 1)
                .addLines(1, 0, 2)
                .addLines(2, 0, 2)
                .addLines(3, 0, 2)
                .build();
    }

    private static Diagram mbptThirdOrder(int[][] adjacency) {
        DiagramBuilder builder = Diagram.builder(3, LineRoleResolver.TIME_POSITION).balanced(true);
        for (int v = 0; v < 3; v++) {
            builder.vertex(v, VertexKind.INTERACTION, 2);
        }
        for (int from = 0; from < 3; from++) {
            for (int to = 0; to < 3; to++) {
                builder.addLines(from, to, adjacency[from][to]);
            }
        }
        return builder.build();
    }
}
