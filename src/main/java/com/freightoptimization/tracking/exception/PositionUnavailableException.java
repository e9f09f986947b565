package com.freightoptimization.tracking.exception;

/**
 * No current position is known, so nothing can be estimated from it.
 */
public class PositionUnavailableException extends TrackingException {

    public PositionUnavailableException(String message) {
        super(message);
    }
}
