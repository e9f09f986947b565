package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.cache.EtaCache;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.push.Subscription;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Relays live upstream updates for watched entities to their STOMP topics, so browser clients only
 * need the platform's WebSocket endpoint. Relayed positions also drop cached ETAs and feed geofence
 * detection, since they never pass through ingestion.
 */
@Slf4j
@Service
public class LivePositionRelay {

    private final TrackingService trackingService;
    private final PositionUpdatePublisher publisher;
    private final GeofenceService geofenceService;
    private final EtaCache etaCache;
    private final Map<EntityKey, Subscription> watched = new ConcurrentHashMap<>();

    public LivePositionRelay(TrackingService trackingService, PositionUpdatePublisher publisher,
                             GeofenceService geofenceService, EtaCache etaCache) {
        this.trackingService = trackingService;
        this.publisher = publisher;
        this.geofenceService = geofenceService;
        this.etaCache = etaCache;
    }

    /**
     * @return false when the entity was already being relayed
     */
    public boolean watch(String entityId, EntityType entityType) {
        EntityKey key = EntityKey.of(entityType, entityId);
        boolean[] added = {false};
        watched.computeIfAbsent(key, k -> {
            added[0] = true;
            return trackingService.subscribeToPositionUpdates(entityId, entityType, this::relay,
                    error -> log.warn("Live relay for {} degraded: {}", k, error.getMessage()));
        });
        if (added[0]) {
            log.info("Relaying live positions for {}", key);
        }
        return added[0];
    }

    /**
     * @return false when the entity was not being relayed
     */
    public boolean unwatch(String entityId, EntityType entityType) {
        EntityKey key = EntityKey.of(entityType, entityId);
        Subscription subscription = watched.remove(key);
        if (subscription == null) {
            return false;
        }
        subscription.unsubscribe();
        log.info("Stopped relaying live positions for {}", key);
        return true;
    }

    void relay(PositionSample sample) {
        etaCache.invalidate(sample.getEntityId(), sample.getEntityType());
        publisher.publishPosition(sample);
        try {
            geofenceService.processPositionUpdate(sample);
        } catch (RuntimeException e) {
            log.warn("Geofence detection failed for relayed {}: {}", sample.key(), e.getMessage());
        }
    }

    public Set<EntityKey> watchedKeys() {
        return Set.copyOf(watched.keySet());
    }

    @PreDestroy
    public void stopAll() {
        watched.values().forEach(Subscription::unsubscribe);
        watched.clear();
    }
}
