package com.freightoptimization.tracking.exception;

public class EntityNotFoundException extends TrackingException {

    public EntityNotFoundException(String message) {
        super(message);
    }
}
