package com.freightoptimization.tracking.cache;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.Trajectory;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Short-lived cache of computed trajectories, keyed by entity, window and tolerance.
 */
@Component
public class TrajectoryCache {

    private final TtlCache<Key, Trajectory> cache;

    public TrajectoryCache(TrackingProperties properties, Clock clock) {
        this.cache = new TtlCache<>(properties.getCache().getTrajectoryTtl(), clock);
    }

    public Optional<Trajectory> get(String entityId, EntityType entityType, Instant start, Instant end, double tolerance) {
        return cache.get(new Key(EntityKey.of(entityType, entityId), start, end, tolerance));
    }

    /**
     * Stores a trajectory under the window the caller asked for; a null bound means "default window"
     * and is part of the key as such.
     */
    public void put(Instant requestedStart, Instant requestedEnd, Trajectory trajectory) {
        Key key = new Key(EntityKey.of(trajectory.getEntityType(), trajectory.getEntityId()),
                requestedStart, requestedEnd, trajectory.getTolerance());
        cache.put(key, trajectory);
    }

    /** Drops every cached window for the entity. */
    public int invalidate(String entityId, EntityType entityType) {
        EntityKey entity = EntityKey.of(entityType, entityId);
        return cache.invalidateIf(key -> key.getEntity().equals(entity));
    }

    public int evictExpired() {
        return cache.evictExpired();
    }

    @Value
    static class Key {
        EntityKey entity;
        Instant start;
        Instant end;
        double tolerance;
    }
}
