package com.freightoptimization.tracking.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.support.PositionSamples;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PositionSampleValidatorTest {

    private static final Instant T = Instant.parse("2024-03-10T12:00:00Z");

    @Test
    void testValidSamplePasses() {
        assertDoesNotThrow(() -> PositionSampleValidator.validate(PositionSamples.vehicle("v1", 40.0, -75.0, T)));
    }

    @Test
    void testCollectsEveryViolation() {
        PositionSample sample = PositionSamples.vehicle("v1", 91.0, -181.0, T).toBuilder()
                .heading(360.0)
                .speed(-1.0)
                .accuracy(-5.0)
                .source(null)
                .build();

        PositionValidationException e = assertThrows(PositionValidationException.class,
                () -> PositionSampleValidator.validate(sample));

        assertEquals(6, e.getViolations().size());
    }

    @Test
    void testRecordedAfterCreatedRejected() {
        PositionSample sample = PositionSamples.vehicle("v1", 40.0, -75.0, T).toBuilder()
                .createdAt(T.minusSeconds(1))
                .build();

        PositionValidationException e = assertThrows(PositionValidationException.class,
                () -> PositionSampleValidator.validate(sample));
        assertTrue(e.getMessage().contains("recordedAt must not be after createdAt"));
    }

    @Test
    void testNonFiniteCoordinatesRejected() {
        PositionSample sample = PositionSamples.vehicle("v1", Double.NaN, -75.0, T);

        assertThrows(PositionValidationException.class, () -> PositionSampleValidator.validate(sample));
    }

    @Test
    void testMissingCoordinatesRejected() {
        PositionSample sample = PositionSamples.vehicle("v1", 40.0, -75.0, T).toBuilder()
                .latitude(null)
                .longitude(null)
                .build();

        PositionValidationException e = assertThrows(PositionValidationException.class,
                () -> PositionSampleValidator.validate(sample));

        assertEquals(List.of("latitude is required", "longitude is required"), e.getViolations());
    }

    @Test
    void testJsonWithoutLatitudeIsNotReadAsEquator() throws Exception {
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
        PositionSample sample = objectMapper.readValue("{\"entityId\":\"v1\",\"entityType\":\"VEHICLE\","
                + "\"longitude\":-75.0,\"source\":\"gps_device\",\"recordedAt\":\"2024-03-10T12:00:00Z\"}",
                PositionSample.class);

        assertNull(sample.getLatitude());
        PositionValidationException e = assertThrows(PositionValidationException.class,
                () -> PositionSampleValidator.validate(sample));
        assertTrue(e.getViolations().contains("latitude is required"));
    }
}
