package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.cache.EtaCache;
import com.freightoptimization.tracking.cache.PositionCache;
import com.freightoptimization.tracking.cache.TrajectoryCache;
import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.dto.EtaBatchResult;
import com.freightoptimization.tracking.dto.EtaEstimate;
import com.freightoptimization.tracking.dto.EtaOptions;
import com.freightoptimization.tracking.dto.LineString;
import com.freightoptimization.tracking.dto.LoadStatusUpdate;
import com.freightoptimization.tracking.dto.LoadTrackingResult;
import com.freightoptimization.tracking.dto.MapMarker;
import com.freightoptimization.tracking.dto.NearbyEntity;
import com.freightoptimization.tracking.dto.RouteVisualization;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.exception.TrackingConnectionException;
import com.freightoptimization.tracking.exception.TrackingException;
import com.freightoptimization.tracking.geo.GeoUtils;
import com.freightoptimization.tracking.load.LoadService;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.GeoPoint;
import com.freightoptimization.tracking.model.LoadAssignment;
import com.freightoptimization.tracking.model.LoadLocation;
import com.freightoptimization.tracking.model.LoadWithAssignments;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.model.Trajectory;
import com.freightoptimization.tracking.push.Subscription;
import com.freightoptimization.tracking.push.SubscriptionHub;
import com.freightoptimization.tracking.repository.PositionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Entity- and load-centric tracking queries composed from the store, caches, engines and hub.
 *
 * <p>Store reads run under a deadline. Load-level compositions tolerate partial failure: a part
 * that cannot be computed is left null and logged.
 */
@Slf4j
@Service
public class TrackingService {

    static final Duration DEFAULT_TRAJECTORY_WINDOW = Duration.ofHours(24);

    private final PositionStore positionStore;
    private final PositionCache positionCache;
    private final TrajectoryCache trajectoryCache;
    private final EtaCache etaCache;
    private final TrajectoryEngine trajectoryEngine;
    private final EtaEngine etaEngine;
    private final SubscriptionHub subscriptionHub;
    private final LoadService loadService;
    private final QueryDeadlineExecutor deadlineExecutor;
    private final int maxBatchSize;
    private final Clock clock;

    public TrackingService(PositionStore positionStore, PositionCache positionCache, TrajectoryCache trajectoryCache,
                           EtaCache etaCache, TrajectoryEngine trajectoryEngine, EtaEngine etaEngine,
                           SubscriptionHub subscriptionHub, LoadService loadService,
                           QueryDeadlineExecutor deadlineExecutor, TrackingProperties properties, Clock clock) {
        this.positionStore = positionStore;
        this.positionCache = positionCache;
        this.trajectoryCache = trajectoryCache;
        this.etaCache = etaCache;
        this.trajectoryEngine = trajectoryEngine;
        this.etaEngine = etaEngine;
        this.subscriptionHub = subscriptionHub;
        this.loadService = loadService;
        this.deadlineExecutor = deadlineExecutor;
        this.maxBatchSize = properties.getEta().getMaxBatchSize();
        this.clock = clock;
    }

    public Optional<PositionSample> getCurrentPosition(String entityId, EntityType entityType, boolean bypassCache) {
        if (!bypassCache) {
            Optional<PositionSample> cached = positionCache.get(entityId, entityType);
            if (cached.isPresent()) {
                log.debug("Position cache hit for {}_{}", entityType, entityId);
                return cached;
            }
        }
        Optional<PositionSample> latest = deadlineExecutor.call("Latest position for " + entityType + "_" + entityId,
                () -> positionStore.latest(entityId, entityType));
        latest.ifPresent(positionCache::put);
        return latest;
    }

    public List<PositionSample> getPositionHistory(String entityId, EntityType entityType, Instant start, Instant end,
                                                   int limit, int offset) {
        return getPositionHistory(entityId, entityType, start, end, limit, offset, null);
    }

    /**
     * @param timeout deadline for the store read; null means the configured default
     */
    public List<PositionSample> getPositionHistory(String entityId, EntityType entityType, Instant start, Instant end,
                                                   int limit, int offset, Duration timeout) {
        if (start == null || end == null) {
            throw new PositionValidationException("start and end are required");
        }
        if (limit < 0 || offset < 0) {
            throw new PositionValidationException("limit and offset must be >= 0");
        }
        return deadlineExecutor.call("History for " + entityType + "_" + entityId, timeout,
                () -> positionStore.queryRange(entityId, entityType, start, end, limit, offset));
    }

    /**
     * Null bounds select the last 24 hours; a null tolerance selects
     * {@link TrajectoryEngine#DEFAULT_TOLERANCE}.
     */
    public Trajectory getTrajectory(String entityId, EntityType entityType, Instant start, Instant end,
                                    Double tolerance, boolean bypassCache) {
        double effectiveTolerance = tolerance != null ? tolerance : TrajectoryEngine.DEFAULT_TOLERANCE;
        if (!bypassCache) {
            Optional<Trajectory> cached = trajectoryCache.get(entityId, entityType, start, end, effectiveTolerance);
            if (cached.isPresent()) {
                log.debug("Trajectory cache hit for {}_{}", entityType, entityId);
                return cached.get();
            }
        }
        Instant resolvedEnd = end != null ? end : clock.instant();
        Instant resolvedStart = start != null ? start : resolvedEnd.minus(DEFAULT_TRAJECTORY_WINDOW);
        Trajectory trajectory = deadlineExecutor.call("Trajectory for " + entityType + "_" + entityId,
                () -> trajectoryEngine.buildTrajectory(entityId, entityType, resolvedStart, resolvedEnd, effectiveTolerance));
        trajectoryCache.put(start, end, trajectory);
        return trajectory;
    }

    public EtaEstimate getEta(String entityId, EntityType entityType, double destLat, double destLon, EtaOptions options) {
        EtaOptions effective = options != null ? options : EtaOptions.defaults();
        Optional<EtaEstimate> cached = etaCache.get(entityId, entityType, destLat, destLon, effective);
        if (cached.isPresent()) {
            log.debug("ETA cache hit for {}_{}", entityType, entityId);
            return cached.get();
        }
        EtaEstimate estimate = deadlineExecutor.call("ETA for " + entityType + "_" + entityId,
                () -> etaEngine.estimate(entityId, entityType, destLat, destLon, effective));
        etaCache.put(entityId, entityType, destLat, destLon, effective, estimate);
        return estimate;
    }

    /**
     * Estimates for several entities of one type heading to the same destination, in request
     * order. An entity that cannot be estimated gets an error entry instead of failing the batch.
     */
    public List<EtaBatchResult> getEtaForEntities(List<String> entityIds, EntityType entityType,
                                                  double destLat, double destLon, EtaOptions options) {
        checkBatchSize(entityIds, "entityIds");
        List<EtaBatchResult> results = new ArrayList<>(entityIds.size());
        for (String entityId : entityIds) {
            try {
                results.add(EtaBatchResult.success(entityId, null,
                        getEta(entityId, entityType, destLat, destLon, options)));
            } catch (TrackingException | IllegalArgumentException e) {
                log.warn("ETA for {}_{} failed in batch: {}", entityType, entityId, e.getMessage());
                results.add(EtaBatchResult.failure(entityId, null, e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Estimates from one entity to each destination, in request order, with per-destination errors.
     */
    public List<EtaBatchResult> getEtaToDestinations(String entityId, EntityType entityType,
                                                     List<GeoPoint> destinations, EtaOptions options) {
        checkBatchSize(destinations, "destinations");
        List<EtaBatchResult> results = new ArrayList<>(destinations.size());
        for (int i = 0; i < destinations.size(); i++) {
            GeoPoint destination = destinations.get(i);
            try {
                if (destination == null) {
                    throw new PositionValidationException("destination " + i + " is missing");
                }
                results.add(EtaBatchResult.success(entityId, i, getEta(entityId, entityType,
                        destination.getLatitude(), destination.getLongitude(), options)));
            } catch (TrackingException | IllegalArgumentException e) {
                log.warn("ETA for {}_{} to destination {} failed: {}", entityType, entityId, i, e.getMessage());
                results.add(EtaBatchResult.failure(entityId, i, e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Entities whose latest position lies within {@code radiusKm} of the point, nearest first.
     *
     * @param entityType restricts the search to one type; null searches all types
     */
    public List<NearbyEntity> getNearbyEntities(double latitude, double longitude, double radiusKm,
                                                EntityType entityType, int limit) {
        if (!GeoUtils.isValidLatitude(latitude) || !GeoUtils.isValidLongitude(longitude)) {
            throw new PositionValidationException("Invalid search point " + latitude + "," + longitude);
        }
        if (!(radiusKm > 0)) {
            throw new PositionValidationException("radiusKm must be > 0");
        }
        if (limit <= 0) {
            throw new PositionValidationException("limit must be > 0");
        }
        List<PositionSample> found = deadlineExecutor.call("Nearby entities around " + latitude + "," + longitude,
                () -> positionStore.findNearby(latitude, longitude, radiusKm, entityType, limit));
        List<NearbyEntity> nearby = new ArrayList<>(found.size());
        for (PositionSample sample : found) {
            double distance = GeoUtils.haversineKm(latitude, longitude, sample.getLatitude(), sample.getLongitude());
            nearby.add(new NearbyEntity(sample.getEntityId(), sample.getEntityType(), sample, distance));
        }
        return nearby;
    }

    public double getRemainingDistance(String entityId, EntityType entityType, double destLat, double destLon,
                                       EtaOptions options) {
        return deadlineExecutor.call("Remaining distance for " + entityType + "_" + entityId,
                () -> etaEngine.remainingDistance(entityId, entityType, destLat, destLon, options));
    }

    /**
     * Position, ETA to the delivery stop and trajectory of the vehicle on the load's active
     * assignment. Loads outside ASSIGNED, AT_PICKUP, LOADED and IN_TRANSIT, or without an active
     * assignment, yield an empty result.
     *
     * @throws com.freightoptimization.tracking.exception.EntityNotFoundException for an unknown load
     */
    public LoadTrackingResult getLoadTracking(String loadId) {
        log.debug("Fetching comprehensive load tracking for {}", loadId);
        LoadWithAssignments load = loadService.getLoadWithAssignments(loadId);
        LoadTrackingResult result = new LoadTrackingResult();
        result.setLoadId(loadId);
        result.setLoadStatus(load.getStatus());
        if (load.getStatus() == null || !load.getStatus().isTrackable()) {
            return result;
        }
        Optional<String> vehicleId = load.findActiveAssignment().map(LoadAssignment::getVehicleId);
        if (vehicleId.isEmpty()) {
            return result;
        }
        String vehicle = vehicleId.get();
        result.setVehicleId(vehicle);

        result.setPosition(safe("position of " + vehicle,
                () -> getCurrentPosition(vehicle, EntityType.VEHICLE, false).orElse(null)));

        Optional<LoadLocation> delivery = load.findLocation(LoadLocation.LocationType.DELIVERY)
                .filter(LoadLocation::hasCoordinates);
        if (result.getPosition() != null && delivery.isPresent()) {
            EtaOptions options = EtaOptions.builder()
                    .considerTraffic(true)
                    .considerWeather(true)
                    .considerHOS(true)
                    .build();
            result.setEta(safe("ETA of " + vehicle, () -> getEta(vehicle, EntityType.VEHICLE,
                    delivery.get().getLatitude(), delivery.get().getLongitude(), options)));
        }

        result.setRoute(safe("trajectory of " + vehicle,
                () -> getTrajectory(vehicle, EntityType.VEHICLE, null, null, null, false)));
        return result;
    }

    public Subscription subscribeToPositionUpdates(String entityId, EntityType entityType,
                                                   Consumer<PositionSample> onUpdate,
                                                   Consumer<TrackingConnectionException> onError) {
        return subscriptionHub.subscribe(entityId, entityType, onUpdate, onError);
    }

    /**
     * Follows the vehicle on the load's active assignment (if any) and the load's status changes
     * under one handle.
     */
    public Subscription subscribeToLoadUpdates(String loadId, Consumer<PositionSample> onPosition,
                                               Consumer<LoadStatusUpdate> onStatus,
                                               Consumer<TrackingConnectionException> onError) {
        LoadWithAssignments load = loadService.getLoadWithAssignments(loadId);
        List<Subscription> parts = new ArrayList<>();
        load.findActiveAssignment()
                .map(LoadAssignment::getVehicleId)
                .ifPresent(vehicleId -> parts.add(
                        subscriptionHub.subscribe(vehicleId, EntityType.VEHICLE, onPosition, onError)));
        parts.add(subscriptionHub.subscribeLoadStatus(loadId, onStatus, onError));
        return Subscription.combine(parts.toArray(new Subscription[0]));
    }

    /**
     * Route line and map markers for a load. The route is the assigned vehicle's trajectory, or a
     * straight pickup-to-delivery line when there is none.
     *
     * @throws PositionValidationException when the load has no pickup or delivery coordinates
     */
    public RouteVisualization getRouteVisualization(String loadId, boolean includeStops, Double tolerance) {
        LoadWithAssignments load = loadService.getLoadWithAssignments(loadId);
        LoadLocation origin = load.findLocation(LoadLocation.LocationType.PICKUP)
                .filter(LoadLocation::hasCoordinates).orElse(null);
        LoadLocation destination = load.findLocation(LoadLocation.LocationType.DELIVERY)
                .filter(LoadLocation::hasCoordinates).orElse(null);
        if (origin == null || destination == null) {
            throw new PositionValidationException("Load " + loadId + " is missing origin or destination location");
        }

        List<MapMarker> markers = new ArrayList<>();
        LineString route = null;
        Optional<String> vehicleId = load.findActiveAssignment().map(LoadAssignment::getVehicleId);
        if (vehicleId.isPresent()) {
            String vehicle = vehicleId.get();
            PositionSample current = safe("position of " + vehicle,
                    () -> getCurrentPosition(vehicle, EntityType.VEHICLE, false).orElse(null));
            if (current != null) {
                markers.add(positionMarker(current));
            }
            Trajectory trajectory = safe("trajectory of " + vehicle,
                    () -> getTrajectory(vehicle, EntityType.VEHICLE, null, null, tolerance, false));
            if (trajectory != null && !trajectory.isEmpty()) {
                route = trajectory.toLineString();
            }
        }

        boolean actualTrajectory = route != null;
        if (!actualTrajectory) {
            route = LineString.straightLine(origin.getLatitude(), origin.getLongitude(),
                    destination.getLatitude(), destination.getLongitude());
        }

        markers.add(locationMarker("origin_" + loadId, origin, "pickup", null));
        markers.add(locationMarker("destination_" + loadId, destination, "delivery", null));
        if (includeStops) {
            List<LoadLocation> stops = load.findStops();
            for (int i = 0; i < stops.size(); i++) {
                LoadLocation stop = stops.get(i);
                if (stop.hasCoordinates()) {
                    markers.add(locationMarker("stop_" + i + "_" + loadId, stop, "stop", i + 1));
                }
            }
        }
        return new RouteVisualization(loadId, route, actualTrajectory, markers);
    }

    public void clearPositionCache(String entityId, EntityType entityType) {
        positionCache.invalidate(entityId, entityType);
    }

    public int clearTrajectoryCache(String entityId, EntityType entityType) {
        return trajectoryCache.invalidate(entityId, entityType);
    }

    public int clearEtaCache(String entityId, EntityType entityType) {
        return etaCache.invalidate(entityId, entityType);
    }

    private void checkBatchSize(List<?> items, String name) {
        if (items == null || items.isEmpty()) {
            throw new PositionValidationException(name + " must not be empty");
        }
        if (items.size() > maxBatchSize) {
            throw new PositionValidationException(name + " exceeds the batch limit of " + maxBatchSize);
        }
    }

    private static MapMarker positionMarker(PositionSample sample) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("recordedAt", sample.getRecordedAt());
        metadata.put("speed", sample.getSpeed());
        metadata.put("heading", sample.getHeading());
        metadata.put("source", sample.getSource());
        return new MapMarker(sample.key().toWireKey(), sample.getEntityType(),
                sample.getLatitude(), sample.getLongitude(), metadata);
    }

    private static MapMarker locationMarker(String markerId, LoadLocation location, String locationType,
                                            Integer stopNumber) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("locationType", locationType);
        metadata.put("facilityName", location.getFacilityName());
        if (stopNumber != null) {
            metadata.put("stopNumber", stopNumber);
        }
        return new MapMarker(markerId, EntityType.LOAD, location.getLatitude(), location.getLongitude(), metadata);
    }

    private <T> T safe(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (TrackingException e) {
            log.warn("Could not resolve {}: {}", what, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Unexpected failure resolving {}", what, e);
            return null;
        }
    }
}
