package com.freightoptimization.tracking.exception;

/**
 * Transport-level failure on the push connection. Delivered to subscribers as an advisory error.
 */
public class TrackingConnectionException extends TrackingException {

    public TrackingConnectionException(String message) {
        super(message);
    }

    public TrackingConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
