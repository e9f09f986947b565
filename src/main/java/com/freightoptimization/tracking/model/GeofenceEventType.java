package com.freightoptimization.tracking.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum GeofenceEventType {
    ENTER,
    EXIT,
    DWELL;

    @JsonCreator
    public static GeofenceEventType fromValue(String value) {
        if (value == null) {
            return null;
        }
        return GeofenceEventType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
