package com.freightoptimization.tracking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An entity crossing into, out of, or lingering inside a geofence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "geofence_events")
@CompoundIndexes({
    @CompoundIndex(name = "entity_geofence_time_idx", def = "{'entityId': 1, 'entityType': 1, 'geofenceId': 1, 'occurredAt': -1}"),
    @CompoundIndex(name = "geofence_time_idx", def = "{'geofenceId': 1, 'occurredAt': -1}")
})
public class GeofenceEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    private String id;
    private String geofenceId;
    private String entityId;
    private EntityType entityType;
    private GeofenceEventType eventType;
    private double latitude;
    private double longitude;
    private Instant occurredAt;
    private Instant createdAt;
    private Map<String, Object> metadata;

    public EntityKey entityKey() {
        return EntityKey.of(entityType, entityId);
    }
}
