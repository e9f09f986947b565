package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.config.TrackingConfig;
import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.exception.EntityNotFoundException;
import com.freightoptimization.tracking.exception.TrackingStoreException;
import com.freightoptimization.tracking.exception.TrackingTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueryDeadlineExecutorTest {

    private ExecutorService pool;
    private CountDownLatch release;
    private QueryDeadlineExecutor executor;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        release = new CountDownLatch(1);
        TrackingProperties properties = new TrackingProperties();
        properties.getStore().setQueryTimeout(Duration.ofMillis(100));
        executor = new QueryDeadlineExecutor(pool, properties);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        pool.shutdownNow();
    }

    private String blockUntilReleased() {
        try {
            release.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "late";
    }

    @Test
    void testReturnsResultWithinDeadline() {
        assertEquals("ok", executor.call("quick", () -> "ok"));
    }

    @Test
    void testDefaultDeadlineRaisesTimeout() {
        TrackingTimeoutException e = assertThrows(TrackingTimeoutException.class,
                () -> executor.call("slow query", this::blockUntilReleased));

        assertTrue(e.getMessage().contains("slow query"));
    }

    @Test
    void testPerCallDeadlineOverridesDefault() {
        long started = System.nanoTime();

        assertThrows(TrackingTimeoutException.class,
                () -> executor.call("slow query", Duration.ofMillis(20), this::blockUntilReleased));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 5_000);
    }

    @Test
    void testRuntimeExceptionPassesThroughUnwrapped() {
        assertThrows(EntityNotFoundException.class, () -> executor.call("lookup", () -> {
            throw new EntityNotFoundException("Unknown entity VEHICLE_v9");
        }));
    }

    @Test
    void testRejectedSubmissionBecomesStoreException() {
        TrackingProperties properties = new TrackingProperties();
        QueryDeadlineExecutor rejecting = new QueryDeadlineExecutor(command -> {
            throw new RejectedExecutionException("queue full");
        }, properties);

        TrackingStoreException e = assertThrows(TrackingStoreException.class,
                () -> rejecting.call("history for VEHICLE_v1", () -> "never"));

        assertTrue(e.getMessage().contains("saturated"));
        assertInstanceOf(RejectedExecutionException.class, e.getCause());
    }

    @Test
    void testSaturatedStorePoolRejectsInsteadOfRunningOnCaller() {
        TrackingProperties properties = new TrackingProperties();
        properties.getStore().setQueryThreads(1);
        properties.getStore().setQueryTimeout(Duration.ofMillis(100));
        Executor storePool = new TrackingConfig().storeQueryExecutor(properties);
        try {
            // one running plus a full queue of 50
            for (int i = 0; i < 51; i++) {
                storePool.execute(this::blockUntilReleased);
            }
            QueryDeadlineExecutor saturated = new QueryDeadlineExecutor(storePool, properties);
            Thread caller = Thread.currentThread();
            boolean[] ranOnCaller = {false};

            assertThrows(TrackingStoreException.class, () -> saturated.call("slow query", () -> {
                ranOnCaller[0] = Thread.currentThread() == caller;
                return "late";
            }));
            assertFalse(ranOnCaller[0]);
        } finally {
            release.countDown();
            ((ThreadPoolTaskExecutor) storePool).shutdown();
        }
    }
}
