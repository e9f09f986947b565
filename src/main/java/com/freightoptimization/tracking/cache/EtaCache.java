package com.freightoptimization.tracking.cache;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.dto.EtaEstimate;
import com.freightoptimization.tracking.dto.EtaOptions;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.EntityType;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Computed estimates keyed by entity, destination and options. Any newer position for the entity
 * makes its estimates stale, so ingestion and the live relay drop them.
 */
@Component
public class EtaCache {

    private final TtlCache<Key, EtaEstimate> cache;

    public EtaCache(TrackingProperties properties, Clock clock) {
        this.cache = new TtlCache<>(properties.getCache().getEtaTtl(), clock);
    }

    public Optional<EtaEstimate> get(String entityId, EntityType entityType, double destLat, double destLon,
                                     EtaOptions options) {
        return cache.get(new Key(EntityKey.of(entityType, entityId), destLat, destLon, options));
    }

    public void put(String entityId, EntityType entityType, double destLat, double destLon, EtaOptions options,
                    EtaEstimate estimate) {
        cache.put(new Key(EntityKey.of(entityType, entityId), destLat, destLon, options), estimate);
    }

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
        double destinationLatitude;
        double destinationLongitude;
        EtaOptions options;
    }
}
