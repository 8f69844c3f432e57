package org.adg.theory;

/**
 * Many-body formalisms the generator knows how to expand.
 */
public enum Formalism {
    /** Time-independent many-body perturbation theory on a Hartree-Fock reference. */
    MBPT,
    /** Time-dependent Bogoliubov many-body perturbation theory with an observable vertex. */
    BMBPT,
    /** BMBPT norm kernel: interaction vertices only, no observable. */
    BMBPT_NORM;

    /**
     * Stable strategy id used for registry lookups.
     */
    public String id() {
        return name();
    }
}
