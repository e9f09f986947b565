package com.freightoptimization.tracking.exception;

import java.util.List;

/**
 * A sample, query argument or geofence definition violates the data model's ranges. Nothing is
 * persisted.
 */
public class PositionValidationException extends TrackingException {

    private final List<String> violations;

    public PositionValidationException(String message) {
        this(List.of(message));
    }

    public PositionValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
