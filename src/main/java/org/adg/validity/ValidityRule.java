package org.adg.validity;

import org.adg.graph.Diagram;

/**
 * One formalism-specific acceptance criterion.
 */
public interface ValidityRule {

    /**
     * Stable rule identifier used in telemetry.
     */
    String id();

    /**
     * Returns true when the diagram satisfies the rule.
     */
    boolean accepts(Diagram diagram);
}
