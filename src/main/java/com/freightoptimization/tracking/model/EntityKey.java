package com.freightoptimization.tracking.model;

import lombok.Value;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity of a tracked entity. The wire form is {@code <ENTITY_TYPE>_<entityId>}, e.g. {@code VEHICLE_v1}.
 */
@Value
public class EntityKey implements Serializable {
    private static final long serialVersionUID = 1L;

    EntityType entityType;
    String entityId;

    public static EntityKey of(EntityType entityType, String entityId) {
        Objects.requireNonNull(entityType, "entityType");
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
        return new EntityKey(entityType, entityId);
    }

    public String toWireKey() {
        return entityType.name() + "_" + entityId;
    }

    /**
     * Parses a wire key. The longest matching type prefix wins so that {@code SMART_HUB_h1}
     * resolves to SMART_HUB rather than failing on the embedded underscore.
     */
    public static EntityKey parse(String wireKey) {
        if (wireKey == null) {
            throw new IllegalArgumentException("Wire key must not be null");
        }
        EntityType match = null;
        for (EntityType type : EntityType.values()) {
            String prefix = type.name() + "_";
            if (wireKey.startsWith(prefix) && wireKey.length() > prefix.length()
                    && (match == null || type.name().length() > match.name().length())) {
                match = type;
            }
        }
        if (match == null) {
            throw new IllegalArgumentException("Unrecognised entity key: " + wireKey);
        }
        return new EntityKey(match, wireKey.substring(match.name().length() + 1));
    }

    @Override
    public String toString() {
        return toWireKey();
    }
}
