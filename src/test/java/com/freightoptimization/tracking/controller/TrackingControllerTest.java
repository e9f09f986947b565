package com.freightoptimization.tracking.controller;

import com.freightoptimization.tracking.dto.BatchIngestResponse;
import com.freightoptimization.tracking.dto.EtaBatchResult;
import com.freightoptimization.tracking.dto.IngestionOutcome;
import com.freightoptimization.tracking.dto.LineString;
import com.freightoptimization.tracking.dto.LoadTrackingResult;
import com.freightoptimization.tracking.dto.NearbyEntity;
import com.freightoptimization.tracking.dto.RouteVisualization;
import com.freightoptimization.tracking.exception.EntityNotFoundException;
import com.freightoptimization.tracking.exception.PositionUnavailableException;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.exception.TrackingStoreException;
import com.freightoptimization.tracking.exception.TrackingTimeoutException;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.GeoPoint;
import com.freightoptimization.tracking.model.LoadStatus;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.service.LivePositionRelay;
import com.freightoptimization.tracking.service.PositionIngestionService;
import com.freightoptimization.tracking.service.TrackingService;
import com.freightoptimization.tracking.support.PositionSamples;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TrackingController.class)
class TrackingControllerTest {

    private static final Instant T = Instant.parse("2024-05-17T08:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TrackingService trackingService;

    @MockBean
    private PositionIngestionService ingestionService;

    @MockBean
    private LivePositionRelay livePositionRelay;

    private static final String POSITION_JSON = "{\"entityId\":\"v1\",\"entityType\":\"VEHICLE\","
            + "\"latitude\":40.0,\"longitude\":-75.0,\"speed\":62.5,\"source\":\"GPS_DEVICE\","
            + "\"recordedAt\":\"2024-05-17T08:00:00Z\"}";

    @Test
    void testRecordPosition() throws Exception {
        when(ingestionService.recordPosition(any(PositionSample.class))).thenReturn(IngestionOutcome.ACCEPTED);

        mockMvc.perform(post("/api/v1/tracking/positions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(POSITION_JSON))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.outcome").value("ACCEPTED"));

        verify(ingestionService).recordPosition(argThat(s -> "v1".equals(s.getEntityId())
                && s.getEntityType() == EntityType.VEHICLE && T.equals(s.getRecordedAt())));
    }

    @Test
    void testRecordPosition_invalid() throws Exception {
        when(ingestionService.recordPosition(any(PositionSample.class)))
                .thenThrow(new PositionValidationException("latitude must be within [-90, 90], was 95.0"));

        mockMvc.perform(post("/api/v1/tracking/positions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(POSITION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("latitude must be within [-90, 90], was 95.0"));
    }

    @Test
    void testRecordPositions_batch() throws Exception {
        when(ingestionService.recordPositions(any())).thenReturn(BatchIngestResponse.builder()
                .accepted(1).duplicates(0).rejected(0).rejections(List.of()).build());

        mockMvc.perform(post("/api/v1/tracking/positions/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + POSITION_JSON + "]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(1));
    }

    @Test
    void testGetCurrentPosition_found() throws Exception {
        when(trackingService.getCurrentPosition("v1", EntityType.VEHICLE, false))
                .thenReturn(Optional.of(PositionSamples.vehicle("v1", 40.0, -75.0, T, 62.5)));

        mockMvc.perform(get("/api/v1/tracking/vehicle/v1/position"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityId").value("v1"))
                .andExpect(jsonPath("$.entityType").value("VEHICLE"))
                .andExpect(jsonPath("$.speed").value(62.5))
                .andExpect(jsonPath("$.recordedAt").value("2024-05-17T08:00:00Z"));
    }

    @Test
    void testGetCurrentPosition_bypassCache() throws Exception {
        when(trackingService.getCurrentPosition("d1", EntityType.DRIVER, true)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/tracking/DRIVER/d1/position").param("bypassCache", "true"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testUnknownEntityType() throws Exception {
        mockMvc.perform(get("/api/v1/tracking/boat/b1/position"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(trackingService);
    }

    @Test
    void testGetPositionHistory_withDeadline() throws Exception {
        when(trackingService.getPositionHistory(eq("v1"), eq(EntityType.VEHICLE), eq(T.minusSeconds(3600)), eq(T),
                eq(50), eq(10), eq(Duration.ofMillis(250))))
                .thenReturn(List.of(PositionSamples.vehicle("v1", 40.0, -75.0, T)));

        mockMvc.perform(get("/api/v1/tracking/VEHICLE/v1/history")
                        .param("start", "2024-05-17T07:00:00Z")
                        .param("end", "2024-05-17T08:00:00Z")
                        .param("limit", "50")
                        .param("offset", "10")
                        .param("timeoutMs", "250"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].latitude").value(40.0));
    }

    @Test
    void testGetPositionHistory_timeout() throws Exception {
        when(trackingService.getPositionHistory(any(), any(), any(), any(), anyInt(), anyInt(), any()))
                .thenThrow(new TrackingTimeoutException("History for VEHICLE_v1 did not complete within 5000 ms"));

        mockMvc.perform(get("/api/v1/tracking/VEHICLE/v1/history")
                        .param("start", "2024-05-17T07:00:00Z")
                        .param("end", "2024-05-17T08:00:00Z"))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void testGetPositionHistory_unknownEntity() throws Exception {
        when(trackingService.getPositionHistory(any(), any(), any(), any(), anyInt(), anyInt(), any()))
                .thenThrow(new EntityNotFoundException("Unknown entity VEHICLE_ghost"));

        mockMvc.perform(get("/api/v1/tracking/VEHICLE/ghost/history")
                        .param("start", "2024-05-17T07:00:00Z")
                        .param("end", "2024-05-17T08:00:00Z"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Unknown entity VEHICLE_ghost"));
    }

    @Test
    void testGetEta_noPosition() throws Exception {
        when(trackingService.getEta(eq("v1"), eq(EntityType.VEHICLE), anyDouble(), anyDouble(), any()))
                .thenThrow(new PositionUnavailableException("No current position for VEHICLE_v1"));

        mockMvc.perform(get("/api/v1/tracking/VEHICLE/v1/eta")
                        .param("latitude", "40.7")
                        .param("longitude", "-74.0")
                        .param("considerWeather", "true"))
                .andExpect(status().isUnprocessableEntity());

        verify(trackingService).getEta(eq("v1"), eq(EntityType.VEHICLE), eq(40.7), eq(-74.0),
                argThat(o -> o.isConsiderWeather() && !o.isConsiderTraffic()));
    }

    @Test
    void testGetRemainingDistance() throws Exception {
        when(trackingService.getRemainingDistance(eq("v1"), eq(EntityType.VEHICLE), eq(40.7), eq(-74.0), any()))
                .thenReturn(128.4);

        mockMvc.perform(get("/api/v1/tracking/VEHICLE/v1/remaining-distance")
                        .param("latitude", "40.7")
                        .param("longitude", "-74.0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remainingDistanceKm").value(128.4));
    }

    @Test
    void testClearCaches() throws Exception {
        mockMvc.perform(delete("/api/v1/tracking/VEHICLE/v1/cache"))
                .andExpect(status().isNoContent());

        verify(trackingService).clearPositionCache("v1", EntityType.VEHICLE);
        verify(trackingService).clearTrajectoryCache("v1", EntityType.VEHICLE);
        verify(trackingService).clearEtaCache("v1", EntityType.VEHICLE);
    }

    @Test
    void testWatchAndUnwatch() throws Exception {
        when(livePositionRelay.watch("v1", EntityType.VEHICLE)).thenReturn(true, false);
        when(livePositionRelay.unwatch("v2", EntityType.VEHICLE)).thenReturn(false);

        mockMvc.perform(put("/api/v1/tracking/VEHICLE/v1/live")).andExpect(status().isCreated());
        mockMvc.perform(put("/api/v1/tracking/VEHICLE/v1/live")).andExpect(status().isOk());
        mockMvc.perform(delete("/api/v1/tracking/VEHICLE/v2/live")).andExpect(status().isNotFound());
    }

    @Test
    void testGetLoadTracking() throws Exception {
        LoadTrackingResult result = new LoadTrackingResult();
        result.setLoadId("L-1");
        result.setLoadStatus(LoadStatus.IN_TRANSIT);
        result.setVehicleId("v1");
        when(trackingService.getLoadTracking("L-1")).thenReturn(result);

        mockMvc.perform(get("/api/v1/tracking/loads/L-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loadStatus").value("IN_TRANSIT"))
                .andExpect(jsonPath("$.vehicleId").value("v1"))
                .andExpect(jsonPath("$.eta").doesNotExist());
    }

    @Test
    void testGetLoadTracking_notFound() throws Exception {
        when(trackingService.getLoadTracking("missing")).thenThrow(new EntityNotFoundException("Load missing not found"));

        mockMvc.perform(get("/api/v1/tracking/loads/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testGetRouteVisualization() throws Exception {
        RouteVisualization view = new RouteVisualization("L-1",
                LineString.straightLine(39.9, -75.2, 40.7, -74.0), false, List.of());
        when(trackingService.getRouteVisualization("L-1", true, 0.001)).thenReturn(view);

        mockMvc.perform(get("/api/v1/tracking/loads/L-1/route")
                        .param("includeStops", "true")
                        .param("tolerance", "0.001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.actualTrajectory").value(false))
                .andExpect(jsonPath("$.route.type").value("LineString"))
                .andExpect(jsonPath("$.route.coordinates[0][0]").value(-75.2));
    }

    @Test
    void testGetRouteVisualization_missingEndpoints() throws Exception {
        when(trackingService.getRouteVisualization("L-2", false, null))
                .thenThrow(new PositionValidationException("Load L-2 is missing origin or destination location"));

        mockMvc.perform(get("/api/v1/tracking/loads/L-2/route"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testGetCurrentPosition_storeUnavailable() throws Exception {
        when(trackingService.getCurrentPosition("v1", EntityType.VEHICLE, false))
                .thenThrow(new TrackingStoreException("Latest position for VEHICLE_v1 failed: connection refused"));

        mockMvc.perform(get("/api/v1/tracking/VEHICLE/v1/position"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void testGetNearbyEntities() throws Exception {
        PositionSample sample = PositionSamples.vehicle("v2", 40.01, -75.0, T);
        when(trackingService.getNearbyEntities(40.0, -75.0, 5.0, EntityType.VEHICLE, 50))
                .thenReturn(List.of(new NearbyEntity("v2", EntityType.VEHICLE, sample, 1.11)));

        mockMvc.perform(get("/api/v1/tracking/nearby")
                        .param("latitude", "40.0")
                        .param("longitude", "-75.0")
                        .param("radiusKm", "5")
                        .param("entityType", "vehicle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].entityId").value("v2"))
                .andExpect(jsonPath("$[0].distanceKm").value(1.11));
    }

    @Test
    void testGetNearbyEntities_allTypes() throws Exception {
        when(trackingService.getNearbyEntities(eq(40.0), eq(-75.0), eq(10.0), isNull(), eq(50))).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/tracking/nearby")
                        .param("latitude", "40.0")
                        .param("longitude", "-75.0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void testGetEtaForEntities() throws Exception {
        when(trackingService.getEtaForEntities(eq(List.of("v1", "ghost")), eq(EntityType.VEHICLE), eq(40.7), eq(-74.0),
                any())).thenReturn(List.of(
                        EtaBatchResult.failure("v1", null, "stale"),
                        EtaBatchResult.failure("ghost", null, "No current position for VEHICLE_ghost")));

        mockMvc.perform(post("/api/v1/tracking/eta/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityType\":\"VEHICLE\",\"entityIds\":[\"v1\",\"ghost\"],"
                                + "\"latitude\":40.7,\"longitude\":-74.0,\"considerTraffic\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].entityId").value("ghost"))
                .andExpect(jsonPath("$[1].error").value("No current position for VEHICLE_ghost"));

        verify(trackingService).getEtaForEntities(anyList(), any(), anyDouble(), anyDouble(),
                argThat(options -> options.isConsiderTraffic() && !options.isConsiderHOS()));
    }

    @Test
    void testGetEtaForEntities_missingDestination() throws Exception {
        mockMvc.perform(post("/api/v1/tracking/eta/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityType\":\"VEHICLE\",\"entityIds\":[\"v1\"]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(trackingService);
    }

    @Test
    void testGetEtaToDestinations() throws Exception {
        when(trackingService.getEtaToDestinations(eq("v1"), eq(EntityType.VEHICLE),
                eq(List.of(new GeoPoint(40.7, -74.0), new GeoPoint(41.0, -73.5))), any()))
                .thenReturn(List.of(EtaBatchResult.failure("v1", 0, "boom"), EtaBatchResult.failure("v1", 1, "boom")));

        mockMvc.perform(post("/api/v1/tracking/VEHICLE/v1/eta/destinations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destinations\":[{\"latitude\":40.7,\"longitude\":-74.0},"
                                + "{\"latitude\":41.0,\"longitude\":-73.5}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].destinationIndex").value(1));
    }

    @Test
    void testGetEtaToDestinations_oversized() throws Exception {
        when(trackingService.getEtaToDestinations(eq("v1"), eq(EntityType.VEHICLE), anyList(), any()))
                .thenThrow(new PositionValidationException("destinations exceeds the batch limit of 100"));

        mockMvc.perform(post("/api/v1/tracking/VEHICLE/v1/eta/destinations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destinations\":[]}"))
                .andExpect(status().isBadRequest());
    }
}
