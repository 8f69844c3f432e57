package org.adg.classify;

public enum TimeStructure {
    /** Formalism without explicit time orderings. */
    NONE,
    /** Every interaction vertex has at most one immediate interaction successor. */
    TREE,
    NON_TREE
}
