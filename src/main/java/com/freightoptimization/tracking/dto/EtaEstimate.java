package com.freightoptimization.tracking.dto;

import com.freightoptimization.tracking.model.EntityType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EtaEstimate {
    String entityId;
    EntityType entityType;
    double destinationLatitude;
    double destinationLongitude;
    Instant estimatedArrival;
    double remainingDistanceKm;
    long estimatedDurationMinutes;
    double effectiveSpeedKmh;
    double confidenceLevel;
    boolean routeAware;
    EtaFactors factors;
    Instant calculatedAt;
}
