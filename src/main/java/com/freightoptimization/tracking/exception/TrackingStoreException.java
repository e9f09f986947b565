package com.freightoptimization.tracking.exception;

/**
 * The position or geofence store could not serve a call: connection loss, a failed write, or a
 * saturated query pool.
 */
public class TrackingStoreException extends TrackingException {

    public TrackingStoreException(String message) {
        super(message);
    }

    public TrackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
