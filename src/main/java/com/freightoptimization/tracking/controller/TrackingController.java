package com.freightoptimization.tracking.controller;

import com.freightoptimization.tracking.dto.BatchIngestResponse;
import com.freightoptimization.tracking.dto.EtaBatchRequest;
import com.freightoptimization.tracking.dto.EtaOptions;
import com.freightoptimization.tracking.dto.IngestionOutcome;
import com.freightoptimization.tracking.exception.EntityNotFoundException;
import com.freightoptimization.tracking.exception.PositionConflictException;
import com.freightoptimization.tracking.exception.PositionUnavailableException;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.exception.TrackingException;
import com.freightoptimization.tracking.exception.TrackingStoreException;
import com.freightoptimization.tracking.exception.TrackingTimeoutException;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.service.LivePositionRelay;
import com.freightoptimization.tracking.service.PositionIngestionService;
import com.freightoptimization.tracking.service.TrackingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/tracking")
@RequiredArgsConstructor
@Tag(name = "Tracking", description = "Entity positions, trajectories, ETAs and load tracking")
public class TrackingController {

    private final TrackingService trackingService;
    private final PositionIngestionService ingestionService;
    private final LivePositionRelay livePositionRelay;

    @Operation(summary = "Record a position", description = "Validate and store one position report")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "202", description = "Position accepted, or ignored as a duplicate"),
        @ApiResponse(responseCode = "400", description = "Invalid position")
    })
    @PostMapping("/positions")
    public ResponseEntity<?> recordPosition(@RequestBody PositionSample sample) {
        try {
            IngestionOutcome outcome = ingestionService.recordPosition(sample);
            return ResponseEntity.accepted().body(Map.of("outcome", outcome));
        } catch (TrackingException | IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Record a batch of positions", description = "Each position is validated and stored independently")
    @PostMapping("/positions/batch")
    public ResponseEntity<BatchIngestResponse> recordPositions(@RequestBody List<PositionSample> samples) {
        return ResponseEntity.ok(ingestionService.recordPositions(samples));
    }

    @Operation(summary = "Get current position", description = "Latest known position, served from cache unless bypassed")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Position found"),
        @ApiResponse(responseCode = "404", description = "No position known for the entity")
    })
    @GetMapping("/{entityType}/{entityId}/position")
    public ResponseEntity<?> getCurrentPosition(
            @Parameter(description = "DRIVER, VEHICLE, LOAD or SMART_HUB") @PathVariable String entityType,
            @Parameter(description = "Entity ID") @PathVariable String entityId,
            @RequestParam(defaultValue = "false") boolean bypassCache) {
        try {
            return trackingService.getCurrentPosition(entityId, EntityType.fromValue(entityType), bypassCache)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElse(ResponseEntity.notFound().build());
        } catch (TrackingException | IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Get position history", description = "Raw samples in a time window, oldest first")
    @GetMapping("/{entityType}/{entityId}/history")
    public ResponseEntity<?> getPositionHistory(
            @PathVariable String entityType,
            @PathVariable String entityId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "1000") int limit,
            @RequestParam(defaultValue = "0") int offset,
            @Parameter(description = "Query deadline in milliseconds") @RequestParam(required = false) Long timeoutMs) {
        try {
            Duration timeout = timeoutMs != null ? Duration.ofMillis(timeoutMs) : null;
            return ResponseEntity.ok(trackingService.getPositionHistory(
                    entityId, EntityType.fromValue(entityType), start, end, limit, offset, timeout));
        } catch (TrackingException | IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Get trajectory", description = "Simplified path over a window, the last 24 hours by default")
    @GetMapping("/{entityType}/{entityId}/trajectory")
    public ResponseEntity<?> getTrajectory(
            @PathVariable String entityType,
            @PathVariable String entityId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @Parameter(description = "Simplification tolerance in degrees") @RequestParam(required = false) Double tolerance,
            @RequestParam(defaultValue = "false") boolean bypassCache) {
        try {
            return ResponseEntity.ok(trackingService.getTrajectory(
                    entityId, EntityType.fromValue(entityType), start, end, tolerance, bypassCache));
        } catch (TrackingException | IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Estimate arrival", description = "ETA from the entity's current position to a destination")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Estimate computed"),
        @ApiResponse(responseCode = "400", description = "Invalid destination"),
        @ApiResponse(responseCode = "422", description = "No current position for the entity")
    })
    @GetMapping("/{entityType}/{entityId}/eta")
    public ResponseEntity<?> getEta(
            @PathVariable String entityType,
            @PathVariable String entityId,
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam(defaultValue = "false") boolean considerTraffic,
            @RequestParam(defaultValue = "false") boolean considerWeather,
            @RequestParam(defaultValue = "false") boolean considerDriverPatterns,
            @RequestParam(defaultValue = "false") boolean considerHOS) {
        try {
            EtaOptions options = EtaOptions.builder()
                    .considerTraffic(considerTraffic)
                    .considerWeather(considerWeather)
                    .considerDriverPatterns(considerDriverPatterns)
                    .considerHOS(considerHOS)
                    .build();
            return ResponseEntity.ok(trackingService.getEta(
                    entityId, EntityType.fromValue(entityType), latitude, longitude, options));
        } catch (TrackingException | IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Estimate arrival for several entities", description = "ETAs of entities of one type to a shared destination; failures are reported per entity")
    @PostMapping("/eta/batch")
    public ResponseEntity<?> getEtaForEntities(@RequestBody EtaBatchRequest request) {
        try {
            if (request.getEntityType() == null || request.getLatitude() == null || request.getLongitude() == null) {
                throw new PositionValidationException("entityType, latitude and longitude are required");
            }
            return ResponseEntity.ok(trackingService.getEtaForEntities(request.getEntityIds(),
                    EntityType.fromValue(request.getEntityType()), request.getLatitude(), request.getLongitude(),
                    request.toOptions()));
        } catch (TrackingException | IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Estimate arrival at several destinations", description = "ETAs of one entity to each destination, in request order")
    @PostMapping("/{entityType}/{entityId}/eta/destinations")
    public ResponseEntity<?> getEtaToDestinations(
            @PathVariable String entityType,
            @PathVariable String entityId,
            @RequestBody EtaBatchRequest request) {
        try {
            return ResponseEntity.ok(trackingService.getEtaToDestinations(entityId, EntityType.fromValue(entityType),
                    request.getDestinations(), request.toOptions()));
        } catch (TrackingException | IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Find nearby entities", description = "Entities whose latest position is within the radius, nearest first")
    @GetMapping("/nearby")
    public ResponseEntity<?> getNearbyEntities(
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam(defaultValue = "10") double radiusKm,
            @Parameter(description = "Restrict to one entity type") @RequestParam(required = false) String entityType,
            @RequestParam(defaultValue = "50") int limit) {
        try {
            EntityType type = entityType != null ? EntityType.fromValue(entityType) : null;
            return ResponseEntity.ok(trackingService.getNearbyEntities(latitude, longitude, radiusKm, type, limit));
        } catch (TrackingException | IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Get remaining distance", description = "Kilometres from the current position to a destination")
    @GetMapping("/{entityType}/{entityId}/remaining-distance")
    public ResponseEntity<?> getRemainingDistance(
            @PathVariable String entityType,
            @PathVariable String entityId,
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam(defaultValue = "false") boolean considerTraffic) {
        try {
            EtaOptions options = EtaOptions.builder().considerTraffic(considerTraffic).build();
            double km = trackingService.getRemainingDistance(
                    entityId, EntityType.fromValue(entityType), latitude, longitude, options);
            return ResponseEntity.ok(Map.of("remainingDistanceKm", km));
        } catch (TrackingException | IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Clear cached data", description = "Drop the cached position, trajectories and ETAs of an entity")
    @ApiResponse(responseCode = "204", description = "Caches cleared")
    @DeleteMapping("/{entityType}/{entityId}/cache")
    public ResponseEntity<?> clearCaches(@PathVariable String entityType, @PathVariable String entityId) {
        try {
            EntityType type = EntityType.fromValue(entityType);
            trackingService.clearPositionCache(entityId, type);
            trackingService.clearTrajectoryCache(entityId, type);
            trackingService.clearEtaCache(entityId, type);
            return ResponseEntity.noContent().build();
        } catch (IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Relay live positions", description = "Publish upstream updates for the entity on /topic/positions/{ENTITY_TYPE}_{entityId}")
    @PutMapping("/{entityType}/{entityId}/live")
    public ResponseEntity<?> watch(@PathVariable String entityType, @PathVariable String entityId) {
        try {
            boolean added = livePositionRelay.watch(entityId, EntityType.fromValue(entityType));
            return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK).build();
        } catch (IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Stop relaying live positions")
    @DeleteMapping("/{entityType}/{entityId}/live")
    public ResponseEntity<?> unwatch(@PathVariable String entityType, @PathVariable String entityId) {
        try {
            boolean removed = livePositionRelay.unwatch(entityId, EntityType.fromValue(entityType));
            return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
        } catch (IllegalArgumentException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Track a load", description = "Position, ETA to delivery and trajectory of the load's assigned vehicle")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Tracking data; parts that could not be resolved are null"),
        @ApiResponse(responseCode = "404", description = "Load not found")
    })
    @GetMapping("/loads/{loadId}")
    public ResponseEntity<?> getLoadTracking(@Parameter(description = "Load ID") @PathVariable String loadId) {
        try {
            return ResponseEntity.ok(trackingService.getLoadTracking(loadId));
        } catch (TrackingException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Get route visualization", description = "Route line and map markers for a load")
    @GetMapping("/loads/{loadId}/route")
    public ResponseEntity<?> getRouteVisualization(
            @PathVariable String loadId,
            @RequestParam(defaultValue = "false") boolean includeStops,
            @RequestParam(required = false) Double tolerance) {
        try {
            return ResponseEntity.ok(trackingService.getRouteVisualization(loadId, includeStops, tolerance));
        } catch (TrackingException e) {
            return errorResponse(e);
        }
    }

    static ResponseEntity<?> errorResponse(RuntimeException e) {
        HttpStatus status;
        if (e instanceof PositionValidationException || e instanceof IllegalArgumentException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof PositionConflictException) {
            status = HttpStatus.CONFLICT;
        } else if (e instanceof EntityNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof PositionUnavailableException) {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        } else if (e instanceof TrackingTimeoutException) {
            status = HttpStatus.GATEWAY_TIMEOUT;
        } else if (e instanceof TrackingStoreException) {
            log.error("Position store unavailable: {}", e.getMessage());
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            log.error("Tracking request failed", e);
            status = HttpStatus.BAD_GATEWAY;
        }
        return ResponseEntity.status(status).body(e.getMessage());
    }
}
