package com.freightoptimization.tracking.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Kinds of tracked objects.
 */
public enum EntityType {
    DRIVER,
    VEHICLE,
    LOAD,
    SMART_HUB;

    /**
     * Accepts both the enum name and the lowercase form used by the mobile apps ("smart_hub").
     */
    @JsonCreator
    public static EntityType fromValue(String value) {
        if (value == null) {
            return null;
        }
        return EntityType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
