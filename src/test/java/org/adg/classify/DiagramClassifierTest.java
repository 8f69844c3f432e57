package org.adg.classify;

import org.adg.canonical.CanonicalForm;
import org.adg.canonical.CanonicalKey;
import org.adg.canonical.Canonicalizer;
import org.adg.canonical.VertexColoring;
import org.adg.engine.DiagramEngine;
import org.adg.engine.GeneratedDiagram;
import org.adg.engine.GenerationResult;
import org.adg.graph.Diagram;
import org.adg.graph.LineRoleResolver;
import org.adg.graph.VertexKind;
import org.adg.testutil.DiagramFixtures;
import org.adg.theory.BmbptRules;
import org.adg.theory.MbptRules;
import org.adg.theory.TheoryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Diagram Classifier Tests")
class DiagramClassifierTest {
    private final DiagramClassifier mbpt = new DiagramClassifier(new MbptRules());
    private final DiagramClassifier bmbpt = new DiagramClassifier(new BmbptRules());

    @Test
    @DisplayName("Particle and hole ladders are each other's conjugates")
    void testLadderConjugates() {
        CanonicalForm particle = mbptForm(DiagramFixtures.mbptParticleLadder());
        CanonicalForm hole = mbptForm(DiagramFixtures.mbptHoleLadder());
        Set<CanonicalKey> accepted = Set.of(particle.getKey(), hole.getKey());

        Classification particleClass = mbpt.classify(particle, accepted);
        Classification holeClass = mbpt.classify(hole, accepted);

        assertEquals(hole.getKey(), particleClass.getConjugateKey());
        assertEquals(particle.getKey(), holeClass.getConjugateKey());
        assertFalse(particleClass.isSelfConjugate());
        assertFalse(holeClass.isSelfConjugate());
        assertEquals(hole.getKey(), mbpt.conjugateKey(particle.getDiagram()));
    }

    @Test
    @DisplayName("Ring diagram is its own conjugate")
    void testRingSelfConjugate() {
        CanonicalForm ring = mbptForm(DiagramFixtures.mbptRing());

        Classification classification = mbpt.classify(ring, Set.of(ring.getKey()));

        assertTrue(classification.isSelfConjugate());
        assertEquals(ring.getKey(), classification.conjugate().orElseThrow());
    }

    @Test
    @DisplayName("Conjugate outside the accepted set is not recorded")
    void testConjugateMissingFromResult() {
        CanonicalForm particle = mbptForm(DiagramFixtures.mbptParticleLadder());

        Classification classification = mbpt.classify(particle, Set.of(particle.getKey()));

        assertNull(classification.getConjugateKey());
        assertTrue(classification.conjugate().isEmpty());
        assertFalse(classification.isSelfConjugate());
    }

    @Test
    @DisplayName("Conjugation is an involution over fourth-order MBPT")
    void testConjugationInvolution() {
        GenerationResult result = new DiagramEngine().generate(TheoryConfig.mbpt(4));

        int selfConjugate = 0;
        for (GeneratedDiagram diagram : result.getDiagrams()) {
            GeneratedDiagram partner = result.conjugateOf(diagram).orElseThrow();
            assertEquals(diagram.getKey(), result.conjugateOf(partner).orElseThrow().getKey());
            assertEquals(diagram.excitationLevel(), partner.excitationLevel());
            if (diagram.getClassification().isSelfConjugate()) {
                assertEquals(diagram.getKey(), partner.getKey());
                selfConjugate++;
            }
        }
        assertEquals(3, selfConjugate);
    }

    @Test
    @DisplayName("MBPT excitation level is the widest particle cut")
    void testMbptExcitationLevel() {
        Set<CanonicalKey> none = Set.of();

        assertEquals(2, mbpt.classify(mbptForm(DiagramFixtures.mbptSecondOrder()), none).getExcitationLevel());
        assertEquals(2, mbpt.classify(mbptForm(DiagramFixtures.mbptParticleLadder()), none).getExcitationLevel());
        assertEquals(2, mbpt.classify(mbptForm(DiagramFixtures.mbptHoleLadder()), none).getExcitationLevel());
        assertEquals(2, mbpt.classify(mbptForm(DiagramFixtures.mbptRing()), none).getExcitationLevel());
    }

    @Test
    @DisplayName("BMBPT excitation level counts observable line pairs")
    void testBmbptExcitationLevel() {
        Set<CanonicalKey> none = Set.of();

        assertEquals(2, bmbpt.classify(bmbptForm(DiagramFixtures.bmbptSecondOrder()), none).getExcitationLevel());
        assertEquals(2, bmbpt.classify(bmbptForm(DiagramFixtures.bmbptFork()), none).getExcitationLevel());
        assertEquals(1, bmbpt.classify(bmbptForm(DiagramFixtures.bmbptBranching()), none).getExcitationLevel());
    }

    @Test
    @DisplayName("Families reflect body-rank and degree-2 vertices")
    void testFamilies() {
        DiagramFamily ring = mbpt.family(DiagramFixtures.mbptRing());
        assertEquals(2, ring.getMaxBodyRank());
        assertEquals(Canonicality.CANONICAL, ring.getCanonicality());
        assertEquals("two-body canonical", ring.label());

        DiagramFamily fork = bmbpt.family(DiagramFixtures.bmbptFork());
        assertEquals(1, fork.getMaxBodyRank());
        assertEquals(Canonicality.NON_CANONICAL, fork.getCanonicality());
        assertEquals("one-body non-canonical", fork.label());

        DiagramFamily branching = bmbpt.family(DiagramFixtures.bmbptBranching());
        assertEquals(Canonicality.NON_CANONICAL, branching.getCanonicality());

        DiagramFamily secondOrder = bmbpt.family(DiagramFixtures.bmbptSecondOrder());
        assertEquals(Canonicality.CANONICAL, secondOrder.getCanonicality());
    }

    @Test
    @DisplayName("Observable-only degree-2 vertex gives the observable-canonical family")
    void testObservableCanonicalFamily() {
        Diagram diagram = Diagram.builder(3, LineRoleResolver.QUASIPARTICLE)
                .vertex(0, VertexKind.OBSERVABLE, 1)
                .vertex(1, VertexKind.INTERACTION, 2)
                .vertex(2, VertexKind.INTERACTION, 2)
                .addLines(1, 2, 3)
                .addLine(1, 0)
                .addLine(2, 0)
                .build();

        DiagramFamily family = bmbpt.family(diagram);

        assertEquals(Canonicality.OBSERVABLE_CANONICAL, family.getCanonicality());
        assertEquals("two-body observable-canonical", family.label());
    }

    @Test
    @DisplayName("Time structure is NONE for MBPT and TREE or NON_TREE for BMBPT")
    void testTimeStructure() {
        assertEquals(TimeStructure.NONE, mbpt.timeStructure(DiagramFixtures.mbptRing()));
        assertEquals(TimeStructure.TREE, bmbpt.timeStructure(DiagramFixtures.bmbptFork()));
        assertEquals(TimeStructure.TREE, bmbpt.timeStructure(DiagramFixtures.bmbptChain()));
        assertEquals(TimeStructure.NON_TREE, bmbpt.timeStructure(DiagramFixtures.bmbptBranching()));
    }

    @Test
    @DisplayName("BMBPT diagrams have no conjugate partner in the result")
    void testBmbptConjugateAbsent() {
        CanonicalForm form = bmbptForm(DiagramFixtures.bmbptSecondOrder());

        Classification classification = bmbpt.classify(form, Set.of(form.getKey()));

        assertTrue(classification.conjugate().isEmpty());
        assertFalse(classification.isSelfConjugate());
        assertEquals(TimeStructure.TREE, classification.getTimeStructure());
    }

    @Test
    @DisplayName("Norm-kernel diagrams are time-ordered and pair up under line reversal")
    void testNormKernelClassification() {
        GenerationResult result = new DiagramEngine().generate(TheoryConfig.bmbptNorm(4));

        assertEquals(10, result.size());
        for (GeneratedDiagram diagram : result.getDiagrams()) {
            Classification classification = diagram.getClassification();
            assertTrue(classification.getTimeStructure() != TimeStructure.NONE);
            assertEquals(0, diagram.excitationLevel());
            GeneratedDiagram partner = result.conjugateOf(diagram).orElseThrow();
            assertEquals(diagram.getKey(), partner.getClassification().getConjugateKey());
        }
    }

    private static CanonicalForm mbptForm(Diagram diagram) {
        return Canonicalizer.canonicalize(diagram, VertexColoring.TIME_POSITION);
    }

    private static CanonicalForm bmbptForm(Diagram diagram) {
        return Canonicalizer.canonicalize(diagram, VertexColoring.VERTEX_KIND);
    }
}
