package org.adg.classify;

import lombok.Builder;
import lombok.Value;
import org.adg.canonical.CanonicalKey;

import java.util.Optional;

/**
 * Topological annotations of one diagram.
 */
@Value
@Builder
public class Classification {
    int excitationLevel;
    DiagramFamily family;
    TimeStructure timeStructure;

    /**
     * Key of the conjugate diagram when it belongs to the same result set; null otherwise.
     */
    CanonicalKey conjugateKey;

    boolean selfConjugate;

    public Optional<CanonicalKey> conjugate() {
        return Optional.ofNullable(conjugateKey);
    }
}
