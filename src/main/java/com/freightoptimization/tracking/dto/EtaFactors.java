package com.freightoptimization.tracking.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Inputs that contributed to an ETA. Absent factors are null.
 */
@Value
@Builder
public class EtaFactors {
    Double currentSpeedKmh;
    Double recentAverageSpeedKmh;
    Double historicalSpeedKmh;
    Double routeDurationMinutes;
    Double weatherFactor;
    Double driverFactor;
    Double hosDelayMinutes;
}
