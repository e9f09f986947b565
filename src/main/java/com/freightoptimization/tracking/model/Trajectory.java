package com.freightoptimization.tracking.model;

import com.freightoptimization.tracking.dto.LineString;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Simplified, time-ascending path of one entity over a window. Derived data, never persisted.
 */
@Value
@Builder
public class Trajectory {
    String entityId;
    EntityType entityType;
    Instant start;
    Instant end;
    double tolerance;
    int rawPointCount;
    double distanceKm;
    List<PositionSample> points;

    public static Trajectory empty(String entityId, EntityType entityType, Instant start, Instant end, double tolerance) {
        return Trajectory.builder()
                .entityId(entityId)
                .entityType(entityType)
                .start(start)
                .end(end)
                .tolerance(tolerance)
                .rawPointCount(0)
                .distanceKm(0.0)
                .points(List.of())
                .build();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    public PositionSample first() {
        return points.isEmpty() ? null : points.get(0);
    }

    public PositionSample last() {
        return points.isEmpty() ? null : points.get(points.size() - 1);
    }

    public LineString toLineString() {
        return LineString.fromSamples(points);
    }
}
