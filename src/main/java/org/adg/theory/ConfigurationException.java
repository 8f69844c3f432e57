package org.adg.theory;

import org.adg.core.ReasonCodedException;

/**
 * Raised at bind time when a {@link TheoryConfig} cannot be executed.
 */
public class ConfigurationException extends ReasonCodedException {
    public static final String REASON_CONFIG_REQUIRED = "ADG_CONFIG_REQUIRED";
    public static final String REASON_FORMALISM_REQUIRED = "ADG_FORMALISM_REQUIRED";
    public static final String REASON_ORDER_OUT_OF_RANGE = "ADG_ORDER_OUT_OF_RANGE";
    public static final String REASON_BODY_RANKS_REQUIRED = "ADG_BODY_RANKS_REQUIRED";
    public static final String REASON_BODY_RANK_UNSUPPORTED = "ADG_BODY_RANK_UNSUPPORTED";
    public static final String REASON_OBSERVABLE_RANK_UNSUPPORTED = "ADG_OBSERVABLE_RANK_UNSUPPORTED";
    public static final String REASON_UNKNOWN_FORMALISM = "ADG_UNKNOWN_FORMALISM";
    public static final String REASON_PARALLELISM_OUT_OF_RANGE = "ADG_PARALLELISM_OUT_OF_RANGE";

    public ConfigurationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
