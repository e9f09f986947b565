package com.freightoptimization.tracking.model;

import com.freightoptimization.tracking.geo.GeoUtils;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A named area watched for one entity type, or for a single entity when {@code entityId} is set.
 *
 * <p>CIRCLE uses {@code centerLatitude}, {@code centerLongitude} and {@code radiusMeters}.
 * POLYGON uses at least three {@code coordinates}. CORRIDOR uses at least two {@code coordinates}
 * as the centerline and spans {@code corridorWidthMeters / 2} on each side of it.
 */
@Data
@NoArgsConstructor
@Document(collection = "geofences")
@CompoundIndexes({
    @CompoundIndex(name = "entity_type_active_idx", def = "{'entityType': 1, 'active': 1}")
})
public class Geofence implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    private String id;
    private String name;
    private String description;
    private GeofenceType geofenceType;
    private EntityType entityType;
    private String entityId;

    private Double centerLatitude;
    private Double centerLongitude;
    private Double radiusMeters;
    private List<GeoPoint> coordinates;
    private Double corridorWidthMeters;

    private Map<String, Object> metadata;
    private Boolean active;
    private Instant startDate;
    private Instant endDate;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Active flag set and {@code now} inside {@code [startDate, endDate]}, open bounds allowed.
     */
    public boolean isActiveAt(Instant now) {
        if (!Boolean.TRUE.equals(active)) {
            return false;
        }
        if (startDate != null && startDate.isAfter(now)) {
            return false;
        }
        return endDate == null || !endDate.isBefore(now);
    }

    public boolean appliesTo(EntityKey key) {
        return entityType == key.getEntityType() && (entityId == null || entityId.equals(key.getEntityId()));
    }

    public boolean contains(double latitude, double longitude) {
        return distanceKm(latitude, longitude) <= 0.0;
    }

    /**
     * Kilometers from the point to the geofence edge; 0 when the point is inside.
     */
    public double distanceKm(double latitude, double longitude) {
        switch (geofenceType) {
            case CIRCLE:
                double fromCenter = GeoUtils.haversineKm(latitude, longitude, centerLatitude, centerLongitude);
                return Math.max(0.0, fromCenter - radiusMeters / 1000.0);
            case POLYGON:
                if (GeoUtils.isPointInPolygon(latitude, longitude, coordinates)) {
                    return 0.0;
                }
                return GeoUtils.distanceToPolylineKm(latitude, longitude, closedRing());
            case CORRIDOR:
                double fromCenterline = GeoUtils.distanceToPolylineKm(latitude, longitude, coordinates);
                return Math.max(0.0, fromCenterline - corridorWidthMeters / 2000.0);
            default:
                throw new IllegalStateException("Unsupported geofence type " + geofenceType);
        }
    }

    private List<GeoPoint> closedRing() {
        GeoPoint first = coordinates.get(0);
        GeoPoint last = coordinates.get(coordinates.size() - 1);
        if (first.equals(last)) {
            return coordinates;
        }
        List<GeoPoint> ring = new ArrayList<>(coordinates);
        ring.add(first);
        return ring;
    }
}
