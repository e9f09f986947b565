package com.freightoptimization.tracking.exception;

/**
 * Root of the tracking error taxonomy. Unchecked, like the rest of the platform's service errors.
 */
public class TrackingException extends RuntimeException {

    public TrackingException(String message) {
        super(message);
    }

    public TrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
