package com.freightoptimization.tracking.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum PositionSource {
    MOBILE_APP,
    ELD,
    GPS_DEVICE,
    MANUAL,
    SYSTEM;

    @JsonCreator
    public static PositionSource fromValue(String value) {
        if (value == null) {
            return null;
        }
        return PositionSource.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
