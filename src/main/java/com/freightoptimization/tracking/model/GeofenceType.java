package com.freightoptimization.tracking.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Geofence shapes: a radius around a center, a closed polygon, or a buffer along a path.
 */
public enum GeofenceType {
    CIRCLE,
    POLYGON,
    CORRIDOR;

    @JsonCreator
    public static GeofenceType fromValue(String value) {
        if (value == null) {
            return null;
        }
        return GeofenceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
