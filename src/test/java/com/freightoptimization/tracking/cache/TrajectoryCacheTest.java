package com.freightoptimization.tracking.cache;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.Trajectory;
import com.freightoptimization.tracking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TrajectoryCacheTest {

    private static final Instant T = Instant.parse("2024-03-10T12:00:00Z");

    private MutableClock clock;
    private TrajectoryCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T);
        cache = new TrajectoryCache(new TrackingProperties(), clock);
    }

    @Test
    void testKeyedByWindowAndTolerance() {
        Trajectory trajectory = Trajectory.empty("v1", EntityType.VEHICLE, T.minusSeconds(3600), T, 0.0001);
        cache.put(T.minusSeconds(3600), T, trajectory);

        assertTrue(cache.get("v1", EntityType.VEHICLE, T.minusSeconds(3600), T, 0.0001).isPresent());
        assertTrue(cache.get("v1", EntityType.VEHICLE, T.minusSeconds(3600), T, 0.001).isEmpty());
        assertTrue(cache.get("v1", EntityType.VEHICLE, T.minusSeconds(1800), T, 0.0001).isEmpty());
    }

    @Test
    void testDefaultWindowCachedUnderNullBounds() {
        Trajectory trajectory = Trajectory.empty("v1", EntityType.VEHICLE, T.minusSeconds(86400), T, 0.0001);
        cache.put(null, null, trajectory);

        assertTrue(cache.get("v1", EntityType.VEHICLE, null, null, 0.0001).isPresent());
    }

    @Test
    void testExpiresAfterSixtySeconds() {
        cache.put(null, null, Trajectory.empty("v1", EntityType.VEHICLE, T, T, 0.0001));

        clock.advance(Duration.ofSeconds(60));

        assertTrue(cache.get("v1", EntityType.VEHICLE, null, null, 0.0001).isEmpty());
    }

    @Test
    void testInvalidateDropsEveryWindowOfEntity() {
        cache.put(null, null, Trajectory.empty("v1", EntityType.VEHICLE, T, T, 0.0001));
        cache.put(T, T, Trajectory.empty("v1", EntityType.VEHICLE, T, T, 0.01));
        cache.put(null, null, Trajectory.empty("v2", EntityType.VEHICLE, T, T, 0.0001));

        assertEquals(2, cache.invalidate("v1", EntityType.VEHICLE));
        assertTrue(cache.get("v2", EntityType.VEHICLE, null, null, 0.0001).isPresent());
    }
}
