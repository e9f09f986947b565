package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.cache.PositionCache;
import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.dto.EtaEstimate;
import com.freightoptimization.tracking.dto.EtaFactors;
import com.freightoptimization.tracking.dto.EtaOptions;
import com.freightoptimization.tracking.dto.RouteEstimate;
import com.freightoptimization.tracking.exception.PositionUnavailableException;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.exception.TrackingException;
import com.freightoptimization.tracking.geo.GeoUtils;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.GeoPoint;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.repository.PositionStore;
import com.freightoptimization.tracking.routing.RoutingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Arrival-time and remaining-distance estimates from an entity's latest known position.
 */
@Slf4j
@Service
public class EtaEngine {

    static final double CURRENT_SPEED_WEIGHT = 0.3;
    static final double RECENT_SPEED_WEIGHT = 0.4;
    static final double MIN_DRIVER_FACTOR = 0.8;
    static final double MAX_DRIVER_FACTOR = 1.25;
    static final double MIN_CONFIDENCE = 0.5;
    static final double MAX_CONFIDENCE = 0.95;

    // Hours-of-service: a 30 min break per 8 h of driving, a 10 h reset per 11 h.
    static final long HOS_BREAK_AFTER_MINUTES = 8 * 60;
    static final long HOS_BREAK_MINUTES = 30;
    static final long HOS_RESET_AFTER_MINUTES = 11 * 60;
    static final long HOS_RESET_MINUTES = 10 * 60;

    private final PositionStore positionStore;
    private final PositionCache positionCache;
    private final RoutingService routingService;
    private final TrackingProperties.Eta settings;
    private final Clock clock;

    public EtaEngine(PositionStore positionStore, PositionCache positionCache, Optional<RoutingService> routingService,
                     TrackingProperties properties, Clock clock) {
        this.positionStore = positionStore;
        this.positionCache = positionCache;
        this.routingService = routingService.orElse(null);
        this.settings = properties.getEta();
        this.clock = clock;
    }

    public EtaEstimate estimate(String entityId, EntityType entityType, double destLat, double destLon, EtaOptions options) {
        validateDestination(destLat, destLon);
        EtaOptions opts = options != null ? options : EtaOptions.defaults();
        PositionSample position = resolvePosition(entityId, entityType);

        RouteEstimate route = opts.isConsiderTraffic() ? route(position, destLat, destLon) : null;
        double distanceKm = route != null
                ? route.getDistanceKm()
                : GeoUtils.haversineKm(position.getLatitude(), position.getLongitude(), destLat, destLon);

        Double currentSpeed = positive(position.getSpeed());
        int trailing = opts.getTrailingSamples() != null ? opts.getTrailingSamples() : settings.getTrailingSamples();
        Double recentSpeed = recentAverageSpeed(entityId, entityType, trailing);
        double effectiveSpeed = Math.max(blend(currentSpeed, recentSpeed), settings.getMinSpeedKmh());

        double durationMinutes = route != null && route.getDurationMinutes() > 0
                ? route.getDurationMinutes()
                : distanceKm / effectiveSpeed * 60.0;

        EtaFactors.EtaFactorsBuilder factors = EtaFactors.builder()
                .currentSpeedKmh(currentSpeed)
                .recentAverageSpeedKmh(recentSpeed)
                .routeDurationMinutes(route != null ? route.getDurationMinutes() : null);

        if (opts.isConsiderWeather()) {
            durationMinutes *= settings.getWeatherFactor();
            factors.weatherFactor(settings.getWeatherFactor());
        }

        boolean driverPatternsApplied = false;
        if (opts.isConsiderDriverPatterns()) {
            Double historicalSpeed = historicalAverageSpeed(entityId, entityType);
            factors.historicalSpeedKmh(historicalSpeed);
            if (historicalSpeed != null) {
                double driverFactor = clamp(effectiveSpeed / historicalSpeed, MIN_DRIVER_FACTOR, MAX_DRIVER_FACTOR);
                durationMinutes *= driverFactor;
                factors.driverFactor(driverFactor);
                driverPatternsApplied = true;
            }
        }

        if (opts.isConsiderHOS()) {
            long hosDelay = hoursOfServiceDelayMinutes(durationMinutes);
            durationMinutes += hosDelay;
            factors.hosDelayMinutes((double) hosDelay);
        }

        long roundedMinutes = Math.round(durationMinutes);
        Instant now = clock.instant();
        double confidence = confidence(currentSpeed != null, recentSpeed != null, route != null,
                driverPatternsApplied, distanceKm);

        return EtaEstimate.builder()
                .entityId(entityId)
                .entityType(entityType)
                .destinationLatitude(destLat)
                .destinationLongitude(destLon)
                .estimatedArrival(now.plus(Duration.ofMinutes(roundedMinutes)))
                .remainingDistanceKm(distanceKm)
                .estimatedDurationMinutes(roundedMinutes)
                .effectiveSpeedKmh(effectiveSpeed)
                .confidenceLevel(confidence)
                .routeAware(route != null)
                .factors(factors.build())
                .calculatedAt(now)
                .build();
    }

    public double remainingDistance(String entityId, EntityType entityType, double destLat, double destLon, EtaOptions options) {
        validateDestination(destLat, destLon);
        PositionSample position = resolvePosition(entityId, entityType);
        if (options != null && options.isConsiderTraffic()) {
            RouteEstimate route = route(position, destLat, destLon);
            if (route != null) {
                return route.getDistanceKm();
            }
        }
        return GeoUtils.haversineKm(position.getLatitude(), position.getLongitude(), destLat, destLon);
    }

    PositionSample resolvePosition(String entityId, EntityType entityType) {
        Optional<PositionSample> cached = positionCache.get(entityId, entityType);
        if (cached.isPresent()) {
            return cached.get();
        }
        return positionStore.latest(entityId, entityType)
                .orElseThrow(() -> new PositionUnavailableException(
                        "No current position for " + entityType + "_" + entityId));
    }

    private RouteEstimate route(PositionSample position, double destLat, double destLon) {
        if (routingService == null) {
            return null;
        }
        try {
            return routingService.routeDistance(position.toGeoPoint(), new GeoPoint(destLat, destLon));
        } catch (TrackingException e) {
            log.warn("Routing failed for {}, falling back to great-circle distance: {}", position.key(), e.getMessage());
            return null;
        }
    }

    /**
     * Mean reported speed of the trailing samples, or path length over elapsed time when none
     * reports a speed.
     */
    private Double recentAverageSpeed(String entityId, EntityType entityType, int count) {
        List<PositionSample> recent = positionStore.recent(entityId, entityType, count);
        List<Double> reported = new ArrayList<>();
        for (PositionSample sample : recent) {
            if (sample.getSpeed() != null) {
                reported.add(sample.getSpeed());
            }
        }
        if (!reported.isEmpty()) {
            return positive(reported.stream().mapToDouble(Double::doubleValue).average().orElse(0));
        }
        if (recent.size() < 2) {
            return null;
        }
        Duration elapsed = Duration.between(recent.get(0).getRecordedAt(), recent.get(recent.size() - 1).getRecordedAt());
        if (elapsed.isZero() || elapsed.isNegative()) {
            return null;
        }
        return positive(GeoUtils.pathLengthKm(recent) / (elapsed.toMillis() / 3_600_000.0));
    }

    private Double historicalAverageSpeed(String entityId, EntityType entityType) {
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofDays(settings.getHistoricalWindowDays()));
        try {
            List<PositionSample> history = positionStore.queryRange(
                    entityId, entityType, start, end, settings.getHistoricalSampleLimit(), 0);
            return positive(history.stream()
                    .filter(s -> s.getSpeed() != null)
                    .mapToDouble(PositionSample::getSpeed)
                    .average()
                    .orElse(0));
        } catch (TrackingException e) {
            log.warn("Historical speed unavailable for {}_{}: {}", entityType, entityId, e.getMessage());
            return null;
        }
    }

    private double blend(Double currentSpeed, Double recentSpeed) {
        if (currentSpeed != null && recentSpeed != null) {
            return (currentSpeed * CURRENT_SPEED_WEIGHT + recentSpeed * RECENT_SPEED_WEIGHT)
                    / (CURRENT_SPEED_WEIGHT + RECENT_SPEED_WEIGHT);
        }
        if (recentSpeed != null) {
            return recentSpeed;
        }
        if (currentSpeed != null) {
            return currentSpeed;
        }
        return settings.getDefaultSpeedKmh();
    }

    static long hoursOfServiceDelayMinutes(double drivingMinutes) {
        long minutes = (long) Math.floor(drivingMinutes);
        return (minutes / HOS_BREAK_AFTER_MINUTES) * HOS_BREAK_MINUTES
                + (minutes / HOS_RESET_AFTER_MINUTES) * HOS_RESET_MINUTES;
    }

    static double confidence(boolean hasCurrentSpeed, boolean hasRecentSpeed, boolean routeAware,
                             boolean hasDriverPatterns, double distanceKm) {
        double confidence = MIN_CONFIDENCE;
        if (hasCurrentSpeed) confidence += 0.05;
        if (hasRecentSpeed) confidence += 0.1;
        if (routeAware) confidence += 0.1;
        if (hasDriverPatterns) confidence += 0.05;
        if (distanceKm < 50) {
            confidence += 0.1;
        } else if (distanceKm > 500) {
            confidence -= 0.1;
        }
        return clamp(confidence, MIN_CONFIDENCE, MAX_CONFIDENCE);
    }

    private static void validateDestination(double latitude, double longitude) {
        List<String> violations = new ArrayList<>();
        if (!GeoUtils.isValidLatitude(latitude)) {
            violations.add("destination latitude must be within [-90, 90], got " + latitude);
        }
        if (!GeoUtils.isValidLongitude(longitude)) {
            violations.add("destination longitude must be within [-180, 180], got " + longitude);
        }
        if (!violations.isEmpty()) {
            throw new PositionValidationException(violations);
        }
    }

    private static Double positive(Double value) {
        return value != null && value > 0 && Double.isFinite(value) ? value : null;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
