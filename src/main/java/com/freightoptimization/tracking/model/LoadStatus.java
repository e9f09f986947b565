package com.freightoptimization.tracking.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum LoadStatus {
    CREATED,
    PENDING,
    ASSIGNED,
    AT_PICKUP,
    LOADED,
    IN_TRANSIT,
    AT_DROPOFF,
    DELIVERED,
    COMPLETED,
    CANCELLED,
    DELAYED,
    EXCEPTION;

    private static final Set<LoadStatus> TRACKABLE = EnumSet.of(ASSIGNED, IN_TRANSIT, AT_PICKUP, LOADED);

    /** Loads in these states have a vehicle on the road worth locating. */
    public boolean isTrackable() {
        return TRACKABLE.contains(this);
    }

    @JsonCreator
    public static LoadStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return LoadStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
