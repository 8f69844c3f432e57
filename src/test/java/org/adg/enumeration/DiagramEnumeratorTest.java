package org.adg.enumeration;

import org.adg.graph.Diagram;
import org.adg.graph.VertexKind;
import org.adg.testutil.DiagramFixtures;
import org.adg.testutil.TheoryTestContexts;
import org.adg.theory.Formalism;
import org.adg.theory.TheoryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Diagram Enumerator Tests")
class DiagramEnumeratorTest {

    @Test
    @DisplayName("Second-order MBPT yields exactly the two-line exchange")
    void testMbptSecondOrder() {
        DiagramEnumerator enumerator = new DiagramEnumerator(TheoryTestContexts.mbpt(2));

        List<Diagram> candidates = enumerator.stream().collect(Collectors.toList());

        assertEquals(1, candidates.size());
        assertEquals(DiagramFixtures.mbptSecondOrder(), candidates.get(0));
    }

    @Test
    @DisplayName("First-order MBPT without self-loops yields nothing")
    void testMbptFirstOrderEmpty() {
        Iterator<Diagram> iterator = new DiagramEnumerator(TheoryTestContexts.mbpt(1)).enumerate();

        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    @DisplayName("Fourth-order MBPT candidate count is stable")
    void testMbptFourthOrderCount() {
        assertEquals(42L, new DiagramEnumerator(TheoryTestContexts.mbpt(4)).stream().count());
    }

    @Test
    @DisplayName("Every MBPT candidate is saturated and balanced")
    void testMbptCandidatesBalanced() {
        TheoryConfig config = TheoryConfig.builder()
                .formalism(Formalism.MBPT)
                .order(3)
                .bodyRank(1)
                .bodyRank(2)
                .build();

        new DiagramEnumerator(TheoryTestContexts.bind(config)).stream().forEach(diagram -> {
            assertTrue(diagram.balanced());
            for (int v = 0; v < diagram.vertexCount(); v++) {
                assertEquals(diagram.bodyRank(v), diagram.inDegree(v));
                assertEquals(diagram.bodyRank(v), diagram.outDegree(v));
                assertEquals(0, diagram.selfLoops(v));
            }
        });
    }

    @Test
    @DisplayName("BMBPT candidates respect local attachment rules")
    void testBmbptLocalRules() {
        List<Diagram> candidates = new DiagramEnumerator(TheoryTestContexts.bmbpt(3)).stream()
                .collect(Collectors.toList());

        assertFalse(candidates.isEmpty());
        for (Diagram diagram : candidates) {
            assertEquals(VertexKind.OBSERVABLE, diagram.kind(0));
            assertEquals(0, diagram.outDegree(0));
            int observableDegree = diagram.degree(0);
            assertTrue(observableDegree == 2 || observableDegree == 4);
            for (int a = 0; a < diagram.vertexCount(); a++) {
                assertEquals(0, diagram.selfLoops(a));
                if (a > 0) {
                    assertEquals(VertexKind.INTERACTION, diagram.kind(a));
                }
                assertEquals(2 * diagram.bodyRank(a), diagram.degree(a));
                for (int b = a + 1; b < diagram.vertexCount(); b++) {
                    assertTrue(diagram.lines(a, b) == 0 || diagram.lines(b, a) == 0);
                }
            }
        }
    }

    @Test
    @DisplayName("Norm-kernel candidates hold interaction vertices only")
    void testBmbptNormLocalRules() {
        List<Diagram> candidates = new DiagramEnumerator(TheoryTestContexts.bind(TheoryConfig.bmbptNorm(3))).stream()
                .collect(Collectors.toList());

        assertFalse(candidates.isEmpty());
        for (Diagram diagram : candidates) {
            assertEquals(-1, diagram.observableIndex());
            for (int a = 0; a < diagram.vertexCount(); a++) {
                assertEquals(VertexKind.INTERACTION, diagram.kind(a));
                assertEquals(4, diagram.degree(a));
                assertEquals(0, diagram.selfLoops(a));
                for (int b = a + 1; b < diagram.vertexCount(); b++) {
                    assertTrue(diagram.lines(a, b) == 0 || diagram.lines(b, a) == 0);
                }
            }
        }
    }

    @Test
    @DisplayName("Every call to enumerate restarts the search")
    void testRestartable() {
        DiagramEnumerator enumerator = new DiagramEnumerator(TheoryTestContexts.bmbpt(3));

        List<Diagram> first = enumerator.stream().collect(Collectors.toList());
        List<Diagram> second = enumerator.stream().collect(Collectors.toList());

        assertEquals(first, second);
    }

    @Test
    @DisplayName("hasNext is idempotent and next walks the same sequence")
    void testIteratorContract() {
        DiagramEnumerator enumerator = new DiagramEnumerator(TheoryTestContexts.mbpt(3));
        List<Diagram> expected = enumerator.stream().collect(Collectors.toList());

        Iterator<Diagram> iterator = enumerator.enumerate();
        for (Diagram diagram : expected) {
            assertTrue(iterator.hasNext());
            assertTrue(iterator.hasNext());
            assertEquals(diagram, iterator.next());
        }
        assertFalse(iterator.hasNext());
    }
}
