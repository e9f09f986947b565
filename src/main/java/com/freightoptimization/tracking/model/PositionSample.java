package com.freightoptimization.tracking.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;

/**
 * One observed position of a tracked entity. Coordinates are kept at 6-decimal precision; a
 * missing coordinate stays null so validation can reject it.
 */
@Value
public class PositionSample implements Serializable {
    private static final long serialVersionUID = 1L;

    String entityId;
    EntityType entityType;
    Double latitude;
    Double longitude;
    /** Degrees clockwise from north, [0, 360). */
    Double heading;
    /** km/h. */
    Double speed;
    /** Meters. */
    Double accuracy;
    PositionSource source;
    Instant recordedAt;
    Instant createdAt;
    /** Identifier of the upstream log line; part of the optional uniqueness constraint. */
    String sourceLogId;

    @Builder(toBuilder = true)
    @Jacksonized
    public PositionSample(String entityId, EntityType entityType, Double latitude, Double longitude,
                          Double heading, Double speed, Double accuracy, PositionSource source,
                          Instant recordedAt, Instant createdAt, String sourceLogId) {
        this.entityId = entityId;
        this.entityType = entityType;
        this.latitude = roundCoordinate(latitude);
        this.longitude = roundCoordinate(longitude);
        this.heading = heading;
        this.speed = speed;
        this.accuracy = accuracy;
        this.source = source;
        this.recordedAt = recordedAt;
        this.createdAt = createdAt;
        this.sourceLogId = sourceLogId;
    }

    public EntityKey key() {
        return EntityKey.of(entityType, entityId);
    }

    public GeoPoint toGeoPoint() {
        return new GeoPoint(latitude, longitude);
    }

    private static Double roundCoordinate(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return value;
        }
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }
}
