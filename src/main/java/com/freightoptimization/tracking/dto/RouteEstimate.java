package com.freightoptimization.tracking.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Road distance and drive time between two points, as reported by the routing service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteEstimate implements Serializable {
    private static final long serialVersionUID = 1L;

    private double distanceKm;
    private double durationMinutes;
}
