package com.freightoptimization.tracking.controller;

import com.freightoptimization.tracking.exception.TrackingException;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.Geofence;
import com.freightoptimization.tracking.model.GeofenceEvent;
import com.freightoptimization.tracking.model.GeofenceEventType;
import com.freightoptimization.tracking.service.GeofenceService;
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

import java.time.Instant;

@Slf4j
@RestController
@RequestMapping("/api/v1/geofences")
@RequiredArgsConstructor
@Tag(name = "Geofences", description = "Geofence definitions and ENTER/EXIT/DWELL events")
public class GeofenceController {

    private final GeofenceService geofenceService;

    @Operation(summary = "Create a geofence", description = "CIRCLE, POLYGON or CORRIDOR for an entity type or a single entity")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Geofence created"),
        @ApiResponse(responseCode = "400", description = "Invalid geometry or missing fields")
    })
    @PostMapping
    public ResponseEntity<?> createGeofence(@RequestBody Geofence geofence) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(geofenceService.createGeofence(geofence));
        } catch (TrackingException | IllegalArgumentException e) {
            return TrackingController.errorResponse(e);
        }
    }

    @Operation(summary = "Get a geofence")
    @GetMapping("/{id}")
    public ResponseEntity<?> getGeofence(@PathVariable String id) {
        try {
            return ResponseEntity.ok(geofenceService.getGeofence(id));
        } catch (TrackingException e) {
            return TrackingController.errorResponse(e);
        }
    }

    @Operation(summary = "Update a geofence", description = "Only the fields present in the body change")
    @PutMapping("/{id}")
    public ResponseEntity<?> updateGeofence(@PathVariable String id, @RequestBody Geofence changes) {
        try {
            return ResponseEntity.ok(geofenceService.updateGeofence(id, changes));
        } catch (TrackingException | IllegalArgumentException e) {
            return TrackingController.errorResponse(e);
        }
    }

    @Operation(summary = "Delete a geofence")
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteGeofence(@PathVariable String id) {
        try {
            geofenceService.deleteGeofence(id);
            return ResponseEntity.noContent().build();
        } catch (TrackingException e) {
            return TrackingController.errorResponse(e);
        }
    }

    @Operation(summary = "List geofences", description = "Geofences of an entity type, optionally scoped to one entity")
    @GetMapping
    public ResponseEntity<?> listGeofences(
            @Parameter(description = "DRIVER, VEHICLE, LOAD or SMART_HUB") @RequestParam String entityType,
            @RequestParam(required = false) String entityId,
            @RequestParam(defaultValue = "true") boolean activeOnly) {
        try {
            return ResponseEntity.ok(geofenceService.listGeofences(EntityType.fromValue(entityType), entityId, activeOnly));
        } catch (TrackingException | IllegalArgumentException e) {
            return TrackingController.errorResponse(e);
        }
    }

    @Operation(summary = "Find nearby geofences", description = "Active geofences whose edge is within the radius, nearest first")
    @GetMapping("/nearby")
    public ResponseEntity<?> findNearby(
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam(required = false) Double radiusMeters,
            @RequestParam(required = false) String entityType) {
        try {
            EntityType type = entityType != null ? EntityType.fromValue(entityType) : null;
            return ResponseEntity.ok(geofenceService.findNearbyGeofences(latitude, longitude, radiusMeters, type));
        } catch (TrackingException | IllegalArgumentException e) {
            return TrackingController.errorResponse(e);
        }
    }

    @Operation(summary = "Get events of a geofence", description = "Events in a time window, oldest first")
    @GetMapping("/{id}/events")
    public ResponseEntity<?> getGeofenceEvents(
            @PathVariable String id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "100") int limit) {
        try {
            return ResponseEntity.ok(geofenceService.getGeofenceEvents(id, start, end, limit));
        } catch (TrackingException e) {
            return TrackingController.errorResponse(e);
        }
    }

    @Operation(summary = "Record an event", description = "Store an event reported by the caller, e.g. a gate check")
    @PostMapping("/{id}/events")
    public ResponseEntity<?> recordEvent(@PathVariable String id, @RequestBody GeofenceEvent event) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(geofenceService.recordEvent(id, event));
        } catch (TrackingException | IllegalArgumentException e) {
            return TrackingController.errorResponse(e);
        }
    }

    @Operation(summary = "Get events of an entity", description = "Geofence events of one entity in a time window")
    @GetMapping("/events/{entityType}/{entityId}")
    public ResponseEntity<?> getEntityEvents(
            @PathVariable String entityType,
            @PathVariable String entityId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @Parameter(description = "ENTER, EXIT or DWELL") @RequestParam(required = false) String eventType,
            @RequestParam(defaultValue = "100") int limit) {
        try {
            return ResponseEntity.ok(geofenceService.getEntityEvents(entityId, EntityType.fromValue(entityType),
                    start, end, GeofenceEventType.fromValue(eventType), limit));
        } catch (TrackingException | IllegalArgumentException e) {
            return TrackingController.errorResponse(e);
        }
    }
}
