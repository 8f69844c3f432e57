package org.adg.canonical;

import lombok.Value;
import org.adg.graph.Diagram;

/**
 * Result of canonicalizing one diagram.
 */
@Value
public class CanonicalForm {
    /**
     * Isomorphism-invariant key.
     */
    CanonicalKey key;

    /**
     * Diagram relabelled into canonical vertex order.
     */
    Diagram diagram;

    /**
     * Order of the colour-preserving vertex automorphism group.
     */
    long automorphismCount;

    /**
     * {@code automorphismCount} times the factorial of every parallel line bundle's multiplicity.
     */
    long symmetryFactor;
}
