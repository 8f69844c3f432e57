package org.adg.engine;

import lombok.Builder;
import lombok.Value;
import org.adg.canonical.CanonicalKey;
import org.adg.classify.Classification;
import org.adg.expression.Expression;
import org.adg.graph.Diagram;

/**
 * One valid, unique diagram with its annotations and expression.
 */
@Value
@Builder
public class GeneratedDiagram {
    /**
     * 1-based position in the ordered result.
     */
    int index;

    CanonicalKey key;

    /**
     * Diagram in canonical vertex order.
     */
    Diagram diagram;

    long automorphismCount;

    long symmetryFactor;

    Classification classification;

    Expression expression;

    public int excitationLevel() {
        return classification.getExcitationLevel();
    }
}
