package org.adg.theory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable lookup of formalism strategies by id.
 * <p>
 * {@link #register(FormalismRules)} never mutates; it returns a new registry in which the
 * strategy replaces any earlier one with the same id. Ids are trimmed on both registration
 * and lookup, so {@link TheoryConfig#getFormalismId()} can name any registered strategy.
 * </p>
 */
public final class FormalismRulesRegistry {
    private static final FormalismRulesRegistry EMPTY = new FormalismRulesRegistry(Map.of());
    private static final FormalismRulesRegistry DEFAULT = EMPTY
            .register(new MbptRules())
            .register(new BmbptRules())
            .register(new BmbptNormRules());

    private final Map<String, FormalismRules> rulesById;

    private FormalismRulesRegistry(Map<String, FormalismRules> rulesById) {
        this.rulesById = rulesById;
    }

    /**
     * Registry holding the MBPT, BMBPT and BMBPT norm-kernel strategies.
     */
    public static FormalismRulesRegistry defaultRegistry() {
        return DEFAULT;
    }

    public static FormalismRulesRegistry empty() {
        return EMPTY;
    }

    /**
     * Returns a registry that additionally resolves {@code rules.id()} to {@code rules}.
     *
     * @throws IllegalArgumentException when the strategy id is blank.
     */
    public FormalismRulesRegistry register(FormalismRules rules) {
        Objects.requireNonNull(rules, "rules");
        String id = Objects.requireNonNull(rules.id(), "rules.id").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("rules.id must be non-blank");
        }
        LinkedHashMap<String, FormalismRules> next = new LinkedHashMap<>(rulesById);
        next.put(id, rules);
        return new FormalismRulesRegistry(Collections.unmodifiableMap(next));
    }

    public FormalismRulesRegistry registerAll(Collection<? extends FormalismRules> rules) {
        FormalismRulesRegistry registry = this;
        for (FormalismRules entry : Objects.requireNonNull(rules, "rules")) {
            registry = registry.register(entry);
        }
        return registry;
    }

    /**
     * Returns the strategy for an id, or null when not registered.
     */
    public FormalismRules rules(String formalismId) {
        if (formalismId == null) {
            return null;
        }
        return rulesById.get(formalismId.trim());
    }

    /**
     * Registered ids in registration order.
     */
    public Set<String> formalismIds() {
        return rulesById.keySet();
    }
}
