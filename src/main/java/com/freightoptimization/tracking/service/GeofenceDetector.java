package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.cache.TtlCache;
import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.Geofence;
import com.freightoptimization.tracking.model.GeofenceEvent;
import com.freightoptimization.tracking.model.GeofenceEventType;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.repository.GeofenceEventRepository;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns successive positions of an entity into ENTER, EXIT and DWELL events.
 *
 * <p>Per (entity, geofence) state is kept in memory for {@code tracking.geofence.state-ttl}. When it
 * is missing, the last stored event decides whether the entity was inside. A sample older than the
 * last one seen for the pair changes nothing.
 */
@Slf4j
@Component
public class GeofenceDetector {

    private final GeofenceEventRepository eventRepository;
    private final Duration dwellThreshold;
    private final Clock clock;
    private final TtlCache<StateKey, State> states;
    private final ReentrantLock lock = new ReentrantLock();

    public GeofenceDetector(GeofenceEventRepository eventRepository, TrackingProperties properties, Clock clock) {
        this.eventRepository = eventRepository;
        this.dwellThreshold = properties.getGeofence().getDwellThreshold();
        this.clock = clock;
        this.states = new TtlCache<>(properties.getGeofence().getStateTtl(), clock);
    }

    /**
     * Events caused by the sample, in geofence order. Geofences that do not apply to the sample's
     * entity, or are inactive at its timestamp, are skipped. The events are not persisted.
     */
    public List<GeofenceEvent> detect(PositionSample sample, List<Geofence> geofences) {
        EntityKey entity = sample.key();
        Instant at = sample.getRecordedAt();
        List<GeofenceEvent> events = new ArrayList<>();
        lock.lock();
        try {
            for (Geofence geofence : geofences) {
                if (!geofence.appliesTo(entity) || !geofence.isActiveAt(at)) {
                    continue;
                }
                StateKey key = new StateKey(entity, geofence.getId());
                State previous = states.get(key).orElseGet(() -> restore(entity, geofence.getId()));
                if (previous.getLastSeenAt() != null && at.isBefore(previous.getLastSeenAt())) {
                    log.debug("Skipping out-of-order sample for {} in geofence {}", entity, geofence.getId());
                    continue;
                }
                boolean inside = geofence.contains(sample.getLatitude(), sample.getLongitude());
                State next;
                if (inside && !previous.isInside()) {
                    events.add(event(GeofenceEventType.ENTER, geofence, sample, null));
                    next = new State(true, at, null, at);
                } else if (!inside && previous.isInside()) {
                    events.add(event(GeofenceEventType.EXIT, geofence, sample, previous.getSince()));
                    next = new State(false, at, null, at);
                } else if (inside && dwellDue(previous, at)) {
                    events.add(event(GeofenceEventType.DWELL, geofence, sample, previous.getSince()));
                    next = new State(true, previous.getSince(), at, at);
                } else {
                    next = new State(inside, previous.getSince(), previous.getLastDwellAt(), at);
                }
                states.put(key, next);
            }
        } finally {
            lock.unlock();
        }
        return events;
    }

    /** Drops remembered states for a deleted geofence. */
    public int forget(String geofenceId) {
        return states.invalidateIf(key -> key.getGeofenceId().equals(geofenceId));
    }

    public int evictExpired() {
        return states.evictExpired();
    }

    private boolean dwellDue(State state, Instant at) {
        Instant reference = state.getLastDwellAt() != null ? state.getLastDwellAt() : state.getSince();
        return reference != null && !at.isBefore(reference.plus(dwellThreshold));
    }

    private State restore(EntityKey entity, String geofenceId) {
        Optional<GeofenceEvent> last = eventRepository.findFirstByEntityIdAndEntityTypeAndGeofenceIdOrderByOccurredAtDesc(
                entity.getEntityId(), entity.getEntityType(), geofenceId);
        if (last.isEmpty()) {
            return new State(false, null, null, null);
        }
        GeofenceEvent event = last.get();
        switch (event.getEventType()) {
            case ENTER:
                return new State(true, event.getOccurredAt(), null, event.getOccurredAt());
            case DWELL:
                // the original entry time is not on the event; dwell timing restarts from here
                return new State(true, event.getOccurredAt(), event.getOccurredAt(), event.getOccurredAt());
            default:
                return new State(false, event.getOccurredAt(), null, event.getOccurredAt());
        }
    }

    private GeofenceEvent event(GeofenceEventType type, Geofence geofence, PositionSample sample, Instant since) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (geofence.getName() != null) {
            metadata.put("geofenceName", geofence.getName());
        }
        if (since != null && type != GeofenceEventType.ENTER) {
            metadata.put("durationSeconds", Duration.between(since, sample.getRecordedAt()).getSeconds());
        }
        return GeofenceEvent.builder()
                .geofenceId(geofence.getId())
                .entityId(sample.getEntityId())
                .entityType(sample.getEntityType())
                .eventType(type)
                .latitude(sample.getLatitude())
                .longitude(sample.getLongitude())
                .occurredAt(sample.getRecordedAt())
                .createdAt(clock.instant())
                .metadata(metadata)
                .build();
    }

    @Value
    static class StateKey {
        EntityKey entity;
        String geofenceId;
    }

    @Value
    static class State {
        boolean inside;
        Instant since;
        Instant lastDwellAt;
        Instant lastSeenAt;
    }
}
