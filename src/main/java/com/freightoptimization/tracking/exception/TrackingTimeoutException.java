package com.freightoptimization.tracking.exception;

/**
 * A store or routing call exceeded its deadline.
 */
public class TrackingTimeoutException extends TrackingException {

    public TrackingTimeoutException(String message) {
        super(message);
    }

    public TrackingTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
