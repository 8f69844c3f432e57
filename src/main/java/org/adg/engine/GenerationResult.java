package org.adg.engine;

import lombok.Value;
import org.adg.canonical.CanonicalKey;

import java.util.List;
import java.util.Optional;

/**
 * Ordered output of one generation run: diagrams sorted by canonical key.
 */
@Value
public class GenerationResult {
    List<GeneratedDiagram> diagrams;
    GenerationTelemetry telemetry;

    public GenerationResult(List<GeneratedDiagram> diagrams, GenerationTelemetry telemetry) {
        this.diagrams = List.copyOf(diagrams);
        this.telemetry = telemetry;
    }

    public int size() {
        return diagrams.size();
    }

    public boolean isEmpty() {
        return diagrams.isEmpty();
    }

    public Optional<GeneratedDiagram> find(CanonicalKey key) {
        if (key == null) {
            return Optional.empty();
        }
        for (GeneratedDiagram diagram : diagrams) {
            if (diagram.getKey().equals(key)) {
                return Optional.of(diagram);
            }
        }
        return Optional.empty();
    }

    /**
     * Conjugate partner of a diagram within this result, if any.
     */
    public Optional<GeneratedDiagram> conjugateOf(GeneratedDiagram diagram) {
        return diagram.getClassification().conjugate().flatMap(this::find);
    }
}
