package com.freightoptimization.tracking.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Modifiers applied on top of the base distance/speed estimate.
 */
@Value
@Builder
public class EtaOptions {
    boolean considerTraffic;
    boolean considerWeather;
    boolean considerDriverPatterns;
    boolean considerHOS;
    /** Trailing samples used for the recent average speed; null means the configured default. */
    Integer trailingSamples;

    public static EtaOptions defaults() {
        return EtaOptions.builder().build();
    }
}
