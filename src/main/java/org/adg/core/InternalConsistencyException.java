package org.adg.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised when a diagram that passed validation violates an assumption of a later stage.
 * Always carries the canonical key of the offending diagram.
 */
@Getter
@Accessors(fluent = true)
public class InternalConsistencyException extends ReasonCodedException {
    public static final String REASON_NO_TIME_ORDERING = "ADG_NO_TIME_ORDERING";
    public static final String REASON_WORKER_FAILURE = "ADG_WORKER_FAILURE";

    private final String canonicalKey;

    public InternalConsistencyException(String reasonCode, String canonicalKey, String message) {
        super(reasonCode, message + " (diagram " + canonicalKey + ")");
        this.canonicalKey = canonicalKey;
    }

    public InternalConsistencyException(String reasonCode, String canonicalKey, String message, Throwable cause) {
        super(reasonCode, message + " (diagram " + canonicalKey + ")", cause);
        this.canonicalKey = canonicalKey;
    }
}
