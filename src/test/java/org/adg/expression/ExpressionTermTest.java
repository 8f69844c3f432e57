package org.adg.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Expression Term Tests")
class ExpressionTermTest {

    @Test
    @DisplayName("Energy sums render added labels before subtracted ones")
    void testEnergySumRender() {
        assertEquals("E_i + E_j - E_a", EnergySum.builder().add("i").add("j").subtract("a").build().render());
        assertEquals("-E_a - E_b", EnergySum.builder().subtracted(List.of("a", "b")).build().render());
        assertTrue(EnergySum.builder().build().isEmpty());
    }

    @Test
    @DisplayName("Prefactor is reduced by the common divisor of multiplicity and symmetry factor")
    void testPrefactorRender() {
        ExpressionTerm.ExpressionTermBuilder base = ExpressionTerm.builder()
                .numerator(new MatrixElement("U", List.of("a"), List.of("i")))
                .denominator(EnergySum.builder().add("i").subtract("a").build());

        assertEquals("+ (1/2) <a|U|i> / (E_i - E_a)", base.sign(1).symmetryFactor(2).build().render());
        assertEquals("- <a|U|i> / (E_i - E_a)", base.sign(-1).symmetryFactor(2).multiplicity(2).build().render());
        assertEquals("- 3 <a|U|i> / (E_i - E_a)", base.sign(-1).symmetryFactor(1).multiplicity(3).build().render());
        assertEquals("- (3/2) <a|U|i> / (E_i - E_a)", base.sign(-1).symmetryFactor(4).multiplicity(6).build().render());
    }

    @Test
    @DisplayName("Integration turns gap exponents into denominators")
    void testIntegrated() {
        ExpressionTerm timeDependent = ExpressionTerm.builder()
                .sign(-1)
                .symmetryFactor(2)
                .numerator(new MatrixElement("H", List.of("k1", "k2"), List.of()))
                .numerator(new MatrixElement("O", List.of(), List.of("k1", "k2")))
                .timeOrdering(new TimeOrdering(new int[]{0, 1}))
                .gapExponent(EnergySum.builder().add("k1").add("k2").build())
                .build();

        assertTrue(timeDependent.isTimeDependent());
        assertEquals("- (1/2) <k1 k2|H|><|O|k1 k2> exp[-((t1 - t0)(E_k1 + E_k2))]", timeDependent.render());

        ExpressionTerm integrated = timeDependent.integrated();
        assertFalse(integrated.isTimeDependent());
        assertEquals(1, integrated.getDenominators().size());
        assertEquals("- (1/2) <k1 k2|H|><|O|k1 k2> / (E_k1 + E_k2)", integrated.render());
        assertSame(integrated, integrated.integrated());
    }

    @Test
    @DisplayName("Line labels run through their alphabets and then take a round suffix")
    void testLineLabels() {
        assertEquals("i", LineLabels.hole(0));
        assertEquals("n", LineLabels.hole(5));
        assertEquals("i1", LineLabels.hole(6));
        assertEquals("a", LineLabels.particle(0));
        assertEquals("a1", LineLabels.particle(8));
        assertEquals("k1", LineLabels.quasiparticle(0));
        assertEquals("k12", LineLabels.quasiparticle(11));
        assertThrows(IllegalArgumentException.class, () -> LineLabels.hole(-1));
    }

    @Test
    @DisplayName("Matrix elements copy their label lists")
    void testMatrixElement() {
        MatrixElement element = new MatrixElement("V", List.of("a", "b"), List.of("i", "j"));

        assertEquals("<a b|V|i j>", element.render());
        assertEquals(element, new MatrixElement("V", List.of("a", "b"), List.of("i", "j")));
        assertThrows(UnsupportedOperationException.class, () -> element.getBra().add("c"));
    }
}
