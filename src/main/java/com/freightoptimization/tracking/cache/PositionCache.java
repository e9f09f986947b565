package com.freightoptimization.tracking.cache;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.PositionSample;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Most recent known position per entity, kept for {@code tracking.cache.position-ttl}.
 */
@Component
public class PositionCache {

    private final TtlCache<EntityKey, PositionSample> cache;

    public PositionCache(TrackingProperties properties, Clock clock) {
        this.cache = new TtlCache<>(properties.getCache().getPositionTtl(), clock);
    }

    public Optional<PositionSample> get(String entityId, EntityType entityType) {
        return cache.get(EntityKey.of(entityType, entityId));
    }

    public void put(String entityId, EntityType entityType, PositionSample position) {
        cache.put(EntityKey.of(entityType, entityId), position);
    }

    public void put(PositionSample position) {
        cache.put(position.key(), position);
    }

    public void invalidate(String entityId, EntityType entityType) {
        cache.invalidate(EntityKey.of(entityType, entityId));
    }

    public int evictExpired() {
        return cache.evictExpired();
    }

    public int size() {
        return cache.size();
    }
}
