package org.adg.graph;

import org.adg.core.ReasonCodedException;

/**
 * Raised when a diagram cannot be built from the supplied vertices and lines.
 */
public class InvalidTopologyException extends ReasonCodedException {
    public static final String REASON_VERTEX_OUT_OF_RANGE = "ADG_VERTEX_OUT_OF_RANGE";
    public static final String REASON_BODY_RANK_MISMATCH = "ADG_BODY_RANK_MISMATCH";
    public static final String REASON_INVALID_BODY_RANK = "ADG_INVALID_BODY_RANK";
    public static final String REASON_UNBALANCED_VERTEX = "ADG_UNBALANCED_VERTEX";
    public static final String REASON_INVALID_LINE_COUNT = "ADG_INVALID_LINE_COUNT";
    public static final String REASON_INVALID_RELABELING = "ADG_INVALID_RELABELING";

    public InvalidTopologyException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
