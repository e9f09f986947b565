package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.dto.NearbyGeofence;
import com.freightoptimization.tracking.exception.EntityNotFoundException;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.geo.GeoUtils;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.GeoPoint;
import com.freightoptimization.tracking.model.Geofence;
import com.freightoptimization.tracking.model.GeofenceEvent;
import com.freightoptimization.tracking.model.GeofenceEventType;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.repository.GeofenceEventRepository;
import com.freightoptimization.tracking.repository.GeofenceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Range;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Geofence definitions, their event log, and detection on incoming positions.
 */
@Slf4j
@Service
public class GeofenceService {

    private final GeofenceRepository geofenceRepository;
    private final GeofenceEventRepository eventRepository;
    private final GeofenceDetector detector;
    private final PositionUpdatePublisher publisher;
    private final TrackingProperties.Geofence settings;
    private final Clock clock;

    public GeofenceService(GeofenceRepository geofenceRepository, GeofenceEventRepository eventRepository,
                           GeofenceDetector detector, PositionUpdatePublisher publisher,
                           TrackingProperties properties, Clock clock) {
        this.geofenceRepository = geofenceRepository;
        this.eventRepository = eventRepository;
        this.detector = detector;
        this.publisher = publisher;
        this.settings = properties.getGeofence();
        this.clock = clock;
    }

    public Geofence createGeofence(Geofence geofence) {
        validate(geofence);
        Instant now = clock.instant();
        geofence.setId(UUID.randomUUID().toString());
        if (geofence.getActive() == null) {
            geofence.setActive(true);
        }
        geofence.setCreatedAt(now);
        geofence.setUpdatedAt(now);
        Geofence saved = geofenceRepository.save(geofence);
        log.info("Created {} geofence {} ({}) for {}", saved.getGeofenceType(), saved.getId(), saved.getName(),
                saved.getEntityType());
        return saved;
    }

    @Cacheable(value = "geofences", key = "#id")
    public Geofence getGeofence(String id) {
        return geofenceRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Geofence not found with id: " + id));
    }

    /**
     * Applies the non-null fields of {@code changes}; identity and creation time are kept.
     */
    @CacheEvict(value = "geofences", key = "#id")
    public Geofence updateGeofence(String id, Geofence changes) {
        Geofence geofence = geofenceRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Geofence not found with id: " + id));
        if (changes.getName() != null) {
            geofence.setName(changes.getName());
        }
        if (changes.getDescription() != null) {
            geofence.setDescription(changes.getDescription());
        }
        if (changes.getGeofenceType() != null) {
            geofence.setGeofenceType(changes.getGeofenceType());
        }
        if (changes.getEntityType() != null) {
            geofence.setEntityType(changes.getEntityType());
        }
        if (changes.getEntityId() != null) {
            geofence.setEntityId(changes.getEntityId());
        }
        if (changes.getCenterLatitude() != null) {
            geofence.setCenterLatitude(changes.getCenterLatitude());
        }
        if (changes.getCenterLongitude() != null) {
            geofence.setCenterLongitude(changes.getCenterLongitude());
        }
        if (changes.getRadiusMeters() != null) {
            geofence.setRadiusMeters(changes.getRadiusMeters());
        }
        if (changes.getCoordinates() != null) {
            geofence.setCoordinates(changes.getCoordinates());
        }
        if (changes.getCorridorWidthMeters() != null) {
            geofence.setCorridorWidthMeters(changes.getCorridorWidthMeters());
        }
        if (changes.getMetadata() != null) {
            geofence.setMetadata(changes.getMetadata());
        }
        if (changes.getActive() != null) {
            geofence.setActive(changes.getActive());
        }
        if (changes.getStartDate() != null) {
            geofence.setStartDate(changes.getStartDate());
        }
        if (changes.getEndDate() != null) {
            geofence.setEndDate(changes.getEndDate());
        }
        validate(geofence);
        geofence.setUpdatedAt(clock.instant());
        log.info("Updated geofence {}", id);
        return geofenceRepository.save(geofence);
    }

    @CacheEvict(value = "geofences", key = "#id")
    public void deleteGeofence(String id) {
        if (!geofenceRepository.existsById(id)) {
            throw new EntityNotFoundException("Geofence not found with id: " + id);
        }
        geofenceRepository.deleteById(id);
        int states = detector.forget(id);
        log.info("Deleted geofence {} and {} tracked states", id, states);
    }

    /**
     * @param entityId restricts to geofences scoped to that entity; null lists every geofence of the type
     */
    public List<Geofence> listGeofences(EntityType entityType, String entityId, boolean activeOnly) {
        List<Geofence> geofences;
        if (entityId != null) {
            geofences = geofenceRepository.findByEntityTypeAndEntityId(entityType, entityId);
        } else if (activeOnly) {
            geofences = geofenceRepository.findByEntityTypeAndActiveTrue(entityType);
        } else {
            geofences = geofenceRepository.findByEntityType(entityType);
        }
        if (!activeOnly) {
            return geofences;
        }
        Instant now = clock.instant();
        return geofences.stream().filter(g -> g.isActiveAt(now)).collect(Collectors.toList());
    }

    /**
     * Geofences currently active whose edge lies within {@code radiusMeters} of the point, nearest
     * first. A null radius uses {@code tracking.geofence.default-search-radius-meters}; a null type
     * searches all types.
     */
    public List<NearbyGeofence> findNearbyGeofences(double latitude, double longitude, Double radiusMeters,
                                                    EntityType entityType) {
        if (!GeoUtils.isValidLatitude(latitude) || !GeoUtils.isValidLongitude(longitude)) {
            throw new PositionValidationException("Invalid search point " + latitude + "," + longitude);
        }
        double radius = radiusMeters != null ? radiusMeters : settings.getDefaultSearchRadiusMeters();
        if (!(radius > 0)) {
            throw new PositionValidationException("radiusMeters must be > 0");
        }
        List<Geofence> candidates = entityType != null
                ? geofenceRepository.findByEntityTypeAndActiveTrue(entityType)
                : geofenceRepository.findAll();
        Instant now = clock.instant();
        return candidates.stream()
                .filter(g -> g.isActiveAt(now))
                .map(g -> new NearbyGeofence(g, g.distanceKm(latitude, longitude) * 1000.0))
                .filter(n -> n.getDistanceMeters() <= radius)
                .sorted(Comparator.comparingDouble(NearbyGeofence::getDistanceMeters))
                .collect(Collectors.toList());
    }

    /**
     * Events of one entity in {@code [start, end]}, oldest first.
     *
     * @param eventType null returns every type
     */
    public List<GeofenceEvent> getEntityEvents(String entityId, EntityType entityType, Instant start, Instant end,
                                               GeofenceEventType eventType, int limit) {
        Range<Instant> window = window(start, end);
        PageRequest page = page(limit);
        if (eventType != null) {
            return eventRepository.findByEntityIdAndEntityTypeAndEventTypeAndOccurredAtBetweenOrderByOccurredAtAsc(
                    entityId, entityType, eventType, window, page);
        }
        return eventRepository.findByEntityIdAndEntityTypeAndOccurredAtBetweenOrderByOccurredAtAsc(
                entityId, entityType, window, page);
    }

    public List<GeofenceEvent> getGeofenceEvents(String geofenceId, Instant start, Instant end, int limit) {
        return eventRepository.findByGeofenceIdAndOccurredAtBetweenOrderByOccurredAtAsc(
                geofenceId, window(start, end), page(limit));
    }

    /**
     * Stores an event reported by a caller rather than detected here, e.g. a manual gate check.
     */
    public GeofenceEvent recordEvent(String geofenceId, GeofenceEvent event) {
        if (!geofenceRepository.existsById(geofenceId)) {
            throw new EntityNotFoundException("Geofence not found with id: " + geofenceId);
        }
        List<String> violations = new ArrayList<>();
        if (event.getEntityId() == null || event.getEntityId().isBlank()) {
            violations.add("entityId is required");
        }
        if (event.getEntityType() == null) {
            violations.add("entityType is required");
        }
        if (event.getEventType() == null) {
            violations.add("eventType is required");
        }
        if (!GeoUtils.isValidLatitude(event.getLatitude())) {
            violations.add("latitude must be within [-90, 90]");
        }
        if (!GeoUtils.isValidLongitude(event.getLongitude())) {
            violations.add("longitude must be within [-180, 180]");
        }
        if (!violations.isEmpty()) {
            throw new PositionValidationException(violations);
        }
        Instant now = clock.instant();
        event.setId(null);
        event.setGeofenceId(geofenceId);
        if (event.getOccurredAt() == null) {
            event.setOccurredAt(now);
        }
        event.setCreatedAt(now);
        GeofenceEvent saved = eventRepository.save(event);
        publisher.publishGeofenceEvent(saved);
        return saved;
    }

    /**
     * Runs detection for a new latest position against the active geofences of its entity type,
     * then stores and broadcasts whatever it produced.
     */
    public List<GeofenceEvent> processPositionUpdate(PositionSample sample) {
        if (!settings.isEnabled()) {
            return List.of();
        }
        List<Geofence> geofences = geofenceRepository.findByEntityTypeAndActiveTrue(sample.getEntityType());
        if (geofences.isEmpty()) {
            return List.of();
        }
        List<GeofenceEvent> events = detector.detect(sample, geofences);
        if (events.isEmpty()) {
            return events;
        }
        List<GeofenceEvent> saved = eventRepository.saveAll(events);
        for (GeofenceEvent event : saved) {
            publisher.publishGeofenceEvent(event);
            log.info("Geofence {} {} for {}", event.getEventType(), event.getGeofenceId(), event.entityKey());
        }
        return saved;
    }

    private static Range<Instant> window(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new PositionValidationException("start and end are required");
        }
        if (end.isBefore(start)) {
            throw new PositionValidationException("end must not be before start");
        }
        return Range.closed(start, end);
    }

    private static PageRequest page(int limit) {
        if (limit <= 0) {
            throw new PositionValidationException("limit must be > 0");
        }
        return PageRequest.of(0, limit);
    }

    static void validate(Geofence geofence) {
        List<String> violations = new ArrayList<>();
        if (geofence.getName() == null || geofence.getName().isBlank()) {
            violations.add("name is required");
        }
        if (geofence.getEntityType() == null) {
            violations.add("entityType is required");
        }
        if (geofence.getStartDate() != null && geofence.getEndDate() != null
                && geofence.getEndDate().isBefore(geofence.getStartDate())) {
            violations.add("endDate must not be before startDate");
        }
        if (geofence.getGeofenceType() == null) {
            violations.add("geofenceType is required");
        } else {
            switch (geofence.getGeofenceType()) {
                case CIRCLE:
                    if (geofence.getCenterLatitude() == null || !GeoUtils.isValidLatitude(geofence.getCenterLatitude())
                            || geofence.getCenterLongitude() == null
                            || !GeoUtils.isValidLongitude(geofence.getCenterLongitude())) {
                        violations.add("CIRCLE requires a valid centerLatitude and centerLongitude");
                    }
                    if (geofence.getRadiusMeters() == null || !(geofence.getRadiusMeters() > 0)) {
                        violations.add("CIRCLE requires radiusMeters > 0");
                    }
                    break;
                case POLYGON:
                    checkCoordinates(geofence.getCoordinates(), 3, "POLYGON", violations);
                    break;
                case CORRIDOR:
                    checkCoordinates(geofence.getCoordinates(), 2, "CORRIDOR", violations);
                    if (geofence.getCorridorWidthMeters() == null || !(geofence.getCorridorWidthMeters() > 0)) {
                        violations.add("CORRIDOR requires corridorWidthMeters > 0");
                    }
                    break;
                default:
                    violations.add("Unsupported geofenceType " + geofence.getGeofenceType());
            }
        }
        if (!violations.isEmpty()) {
            throw new PositionValidationException(violations);
        }
    }

    private static void checkCoordinates(List<GeoPoint> coordinates, int minimum, String type, List<String> violations) {
        if (coordinates == null || coordinates.size() < minimum) {
            violations.add(type + " requires at least " + minimum + " coordinates");
            return;
        }
        for (GeoPoint point : coordinates) {
            if (point == null || !GeoUtils.isValidLatitude(point.getLatitude())
                    || !GeoUtils.isValidLongitude(point.getLongitude())) {
                violations.add(type + " coordinates must be valid latitude/longitude pairs");
                return;
            }
        }
    }
}
