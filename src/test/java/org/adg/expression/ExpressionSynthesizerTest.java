package org.adg.expression;

import org.adg.canonical.CanonicalForm;
import org.adg.canonical.Canonicalizer;
import org.adg.canonical.VertexColoring;
import org.adg.core.InternalConsistencyException;
import org.adg.testutil.DiagramFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Expression Synthesizer Tests")
class ExpressionSynthesizerTest {

    @Test
    @DisplayName("Delegates to the formalism rules")
    void testDelegates() {
        MbptExpressionRules rules = new MbptExpressionRules();
        ExpressionSynthesizer synthesizer = new ExpressionSynthesizer(rules);
        CanonicalForm form = Canonicalizer.canonicalize(DiagramFixtures.mbptRing(), VertexColoring.TIME_POSITION);

        Expression expression = synthesizer.synthesize(form);

        assertSame(rules, synthesizer.rules());
        assertEquals(1, expression.getTerms().size());
        assertTrue(expression.render().startsWith("+ "));
    }

    @Test
    @DisplayName("Rules producing no term are reported with the diagram key")
    void testEmptyExpressionRejected() {
        ExpressionRules empty = new ExpressionRules() {
            @Override
            public String id() {
                return "EMPTY";
            }

            @Override
            public Expression synthesize(CanonicalForm form) {
                return Expression.builder().build();
            }
        };
        CanonicalForm form = Canonicalizer.canonicalize(DiagramFixtures.mbptRing(), VertexColoring.TIME_POSITION);

        InternalConsistencyException ex = assertThrows(
                InternalConsistencyException.class,
                () -> new ExpressionSynthesizer(empty).synthesize(form)
        );

        assertEquals(InternalConsistencyException.REASON_NO_TIME_ORDERING, ex.reasonCode());
        assertEquals(form.getKey().toString(), ex.canonicalKey());
        assertTrue(ex.getMessage().contains("EMPTY"));
    }
}
