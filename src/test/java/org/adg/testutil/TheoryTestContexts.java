package org.adg.testutil;

import org.adg.theory.FormalismRulesRegistry;
import org.adg.theory.ResolvedTheoryContext;
import org.adg.theory.TheoryConfig;
import org.adg.theory.TheoryRuntimeBinder;

/**
 * Bound theory contexts for tests that drive stages directly instead of through the engine.
 */
public final class TheoryTestContexts {

    private TheoryTestContexts() {
    }

    public static ResolvedTheoryContext bind(TheoryConfig config) {
        return new TheoryRuntimeBinder()
                .bind(config, FormalismRulesRegistry.defaultRegistry())
                .getResolvedTheoryContext();
    }

    public static ResolvedTheoryContext mbpt(int order) {
        return bind(TheoryConfig.mbpt(order));
    }

    public static ResolvedTheoryContext bmbpt(int order) {
        return bind(TheoryConfig.bmbpt(order));
    }
}
