package com.freightoptimization.tracking.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Map-ready view of a load: the travelled (or planned straight-line) route plus its markers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteVisualization {
    private String loadId;
    private LineString route;
    private boolean actualTrajectory;
    private List<MapMarker> markers;
}
