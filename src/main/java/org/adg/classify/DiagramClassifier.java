package org.adg.classify;

import org.adg.canonical.CanonicalForm;
import org.adg.canonical.CanonicalKey;
import org.adg.canonical.Canonicalizer;
import org.adg.graph.Diagram;
import org.adg.graph.TimeFlow;
import org.adg.graph.VertexKind;
import org.adg.theory.FormalismRules;

import java.util.Objects;
import java.util.Set;

/**
 * Annotates canonical diagrams with excitation level, family, time structure and conjugate partner.
 */
public final class DiagramClassifier {
    private final FormalismRules rules;

    public DiagramClassifier(FormalismRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    /**
     * Classifies one diagram against the final result set.
     *
     * @param acceptedKeys keys of every diagram kept by the run; the conjugate is only recorded when present here.
     */
    public Classification classify(CanonicalForm form, Set<CanonicalKey> acceptedKeys) {
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(acceptedKeys, "acceptedKeys");
        Diagram diagram = form.getDiagram();

        CanonicalKey conjugate = conjugateKey(diagram);
        boolean present = acceptedKeys.contains(conjugate);
        return Classification.builder()
                .excitationLevel(rules.excitationLevel(diagram))
                .family(family(diagram))
                .timeStructure(timeStructure(diagram))
                .conjugateKey(present ? conjugate : null)
                .selfConjugate(present && conjugate.equals(form.getKey()))
                .build();
    }

    /**
     * Key of the diagram obtained by reversing every line.
     */
    public CanonicalKey conjugateKey(Diagram diagram) {
        return Canonicalizer.key(diagram.reversed(), rules.vertexColoring());
    }

    public DiagramFamily family(Diagram diagram) {
        int maxRank = 0;
        boolean interactionDegreeTwo = false;
        boolean observableDegreeTwo = false;
        for (int v = 0; v < diagram.vertexCount(); v++) {
            boolean observable = diagram.kind(v) == VertexKind.OBSERVABLE;
            if (!observable) {
                maxRank = Math.max(maxRank, diagram.bodyRank(v));
            }
            if (diagram.degree(v) == 2) {
                if (observable) {
                    observableDegreeTwo = true;
                } else {
                    interactionDegreeTwo = true;
                }
            }
        }
        Canonicality canonicality;
        if (interactionDegreeTwo) {
            canonicality = Canonicality.NON_CANONICAL;
        } else if (observableDegreeTwo) {
            canonicality = Canonicality.OBSERVABLE_CANONICAL;
        } else {
            canonicality = Canonicality.CANONICAL;
        }
        return new DiagramFamily(maxRank, canonicality);
    }

    public TimeStructure timeStructure(Diagram diagram) {
        if (!rules.timeOrdered()) {
            return TimeStructure.NONE;
        }
        return TimeFlow.isTree(diagram) ? TimeStructure.TREE : TimeStructure.NON_TREE;
    }
}
