package com.freightoptimization.tracking.dto;

import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.PositionSample;
import lombok.Value;

/**
 * An entity whose latest position lies within a search radius.
 */
@Value
public class NearbyEntity {
    String entityId;
    EntityType entityType;
    PositionSample position;
    double distanceKm;
}
