package com.freightoptimization.tracking.dto;

import com.freightoptimization.tracking.model.Geofence;
import lombok.Value;

@Value
public class NearbyGeofence {
    Geofence geofence;
    /** Distance to the geofence edge; 0 when the point is inside. */
    double distanceMeters;
}
