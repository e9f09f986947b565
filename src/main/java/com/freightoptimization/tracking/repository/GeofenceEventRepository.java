package com.freightoptimization.tracking.repository;

import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.GeofenceEvent;
import com.freightoptimization.tracking.model.GeofenceEventType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Range;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface GeofenceEventRepository extends MongoRepository<GeofenceEvent, String> {

    List<GeofenceEvent> findByEntityIdAndEntityTypeAndOccurredAtBetweenOrderByOccurredAtAsc(
            String entityId, EntityType entityType, Range<Instant> window, Pageable pageable);

    List<GeofenceEvent> findByEntityIdAndEntityTypeAndEventTypeAndOccurredAtBetweenOrderByOccurredAtAsc(
            String entityId, EntityType entityType, GeofenceEventType eventType, Range<Instant> window,
            Pageable pageable);

    List<GeofenceEvent> findByGeofenceIdAndOccurredAtBetweenOrderByOccurredAtAsc(
            String geofenceId, Range<Instant> window, Pageable pageable);

    Optional<GeofenceEvent> findFirstByEntityIdAndEntityTypeAndGeofenceIdOrderByOccurredAtDesc(
            String entityId, EntityType entityType, String geofenceId);
}
