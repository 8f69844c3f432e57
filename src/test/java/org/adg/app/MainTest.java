package org.adg.app;

import org.adg.theory.Formalism;
import org.adg.theory.TheoryConfig;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testParseDefaults() {
        TheoryConfig config = Main.parse(new String[0]);

        assertEquals(Formalism.MBPT, config.getFormalism());
        assertEquals(3, config.getOrder());
        assertEquals(Set.of(2), config.getBodyRanks());
    }

    @Test
    void testParseFormalismAndOrder() {
        TheoryConfig config = Main.parse(new String[]{" bmbpt ", "4"});

        assertEquals(Formalism.BMBPT, config.getFormalism());
        assertEquals(4, config.getOrder());
    }

    @Test
    void testParseNormKernel() {
        TheoryConfig config = Main.parse(new String[]{"bmbpt_norm", "3"});

        assertEquals(Formalism.BMBPT_NORM, config.getFormalism());
        assertEquals(Set.of(2), config.getBodyRanks());
    }

    @Test
    void testParseRejectsUnknownFormalism() {
        assertThrows(IllegalArgumentException.class, () -> Main.parse(new String[]{"CCSD"}));
        assertThrows(NumberFormatException.class, () -> Main.parse(new String[]{"MBPT", "three"}));
    }

    @Test
    void testMainRuns() {
        assertDoesNotThrow(() -> Main.main(new String[]{"BMBPT", "3"}));
        assertDoesNotThrow(() -> Main.main(new String[0]));
        assertDoesNotThrow(() -> Main.main(new String[]{"BMBPT_NORM", "3"}));
    }
}
