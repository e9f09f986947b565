package com.freightoptimization.tracking.exception;

/**
 * Duplicate sample under the (entityId, recordedAt, sourceLogId) uniqueness constraint.
 */
public class PositionConflictException extends TrackingException {

    public PositionConflictException(String message) {
        super(message);
    }

    public PositionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
