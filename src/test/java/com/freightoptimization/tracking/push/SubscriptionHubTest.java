package com.freightoptimization.tracking.push;

import com.freightoptimization.tracking.cache.PositionCache;
import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.dto.LoadStatusUpdate;
import com.freightoptimization.tracking.exception.TrackingConnectionException;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SubscriptionHubTest {

    private static final Instant T = Instant.parse("2024-05-17T08:00:00Z");
    private static final EntityKey V1 = EntityKey.of(EntityType.VEHICLE, "v1");
    private static final EntityKey D1 = EntityKey.of(EntityType.DRIVER, "d1");

    private MutableClock clock;
    private FakeTransport transport;
    private PushMessageCodec codec;
    private PositionCache positionCache;
    private List<Runnable> scheduled;
    private List<Duration> delays;
    private SubscriptionHub hub;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T);
        transport = new FakeTransport();
        codec = new PushMessageCodec(Jackson2ObjectMapperBuilder.json().build());
        TrackingProperties properties = new TrackingProperties();
        positionCache = new PositionCache(properties, clock);
        scheduled = new ArrayList<>();
        delays = new ArrayList<>();
        TaskScheduler scheduler = mock(TaskScheduler.class);
        doAnswer(invocation -> {
            scheduled.add(invocation.getArgument(0));
            delays.add(Duration.between(clock.instant(), invocation.getArgument(1)));
            return mock(ScheduledFuture.class);
        }).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        hub = new SubscriptionHub(transport, codec, positionCache, scheduler, Runnable::run, clock, properties.getPush());
        hub.start();
    }

    private static String positionFrame(EntityKey key, double lat) {
        return "{\"event\":\"position_update\",\"key\":\"" + key.toWireKey() + "\",\"payload\":{"
                + "\"latitude\":" + lat + ",\"longitude\":-75.0,\"source\":\"GPS_DEVICE\","
                + "\"recordedAt\":\"2024-05-17T08:00:00Z\",\"createdAt\":\"2024-05-17T08:00:00Z\"}}";
    }

    @Test
    void testNoConnectionUntilFirstSubscription() {
        assertEquals(0, transport.connects);
        assertEquals(ConnectionState.DISCONNECTED, hub.state());

        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, e -> { });

        assertEquals(1, transport.connects);
        assertEquals(ConnectionState.CONNECTING, hub.state());
    }

    @Test
    void testSubscribeFrameSentOncePerKey() {
        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, e -> { });
        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, e -> { });
        transport.open();

        assertEquals(ConnectionState.CONNECTED, hub.state());
        assertEquals(List.of(codec.subscribe(V1)), transport.sent);

        hub.subscribe("d1", EntityType.DRIVER, p -> { }, e -> { });
        assertEquals(List.of(codec.subscribe(V1), codec.subscribe(D1)), transport.sent);
    }

    @Test
    void testUpdateDeliveredToEveryListenerAndCached() {
        List<PositionSample> first = new ArrayList<>();
        List<PositionSample> second = new ArrayList<>();
        hub.subscribe("v1", EntityType.VEHICLE, first::add, e -> { });
        hub.subscribe("v1", EntityType.VEHICLE, second::add, e -> { });
        transport.open();

        transport.receive(positionFrame(V1, 40.5));

        assertEquals(1, first.size());
        assertEquals(1, second.size());
        assertEquals(40.5, positionCache.get("v1", EntityType.VEHICLE).orElseThrow().getLatitude());
    }

    @Test
    void testFailingListenerDoesNotAffectOthers() {
        List<PositionSample> received = new ArrayList<>();
        hub.subscribe("v1", EntityType.VEHICLE, p -> {
            throw new IllegalStateException("boom");
        }, e -> { });
        hub.subscribe("v1", EntityType.VEHICLE, received::add, e -> { });
        transport.open();

        transport.receive(positionFrame(V1, 40.5));

        assertEquals(1, received.size());
    }

    @Test
    void testUpdatesForOtherKeysIgnored() {
        List<PositionSample> received = new ArrayList<>();
        hub.subscribe("v1", EntityType.VEHICLE, received::add, e -> { });
        transport.open();

        transport.receive(positionFrame(D1, 40.5));
        transport.receive("{not json");

        assertTrue(received.isEmpty());
        assertTrue(positionCache.get("d1", EntityType.DRIVER).isEmpty());
    }

    @Test
    void testUnsubscribeIsIdempotentAndStopsDelivery() {
        List<PositionSample> received = new ArrayList<>();
        Subscription subscription = hub.subscribe("v1", EntityType.VEHICLE, received::add, e -> { });
        transport.open();

        subscription.unsubscribe();
        subscription.unsubscribe();
        transport.receive(positionFrame(V1, 40.5));

        assertTrue(received.isEmpty());
        assertEquals(List.of(codec.subscribe(V1), codec.unsubscribe(V1)), transport.sent);
        assertTrue(hub.subscribedKeys().isEmpty());
    }

    @Test
    void testUnsubscribeKeepsKeyWhileOtherListenersRemain() {
        Subscription first = hub.subscribe("v1", EntityType.VEHICLE, p -> { }, e -> { });
        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, e -> { });
        transport.open();

        first.unsubscribe();

        assertEquals(List.of(codec.subscribe(V1)), transport.sent);
        assertEquals(Set.of(V1), hub.subscribedKeys());
    }

    @Test
    void testReconnectResubscribesEachKeyExactlyOnce() {
        List<TrackingConnectionException> errors = new ArrayList<>();
        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, errors::add);
        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, errors::add);
        hub.subscribe("d1", EntityType.DRIVER, p -> { }, errors::add);
        hub.subscribeLoadStatus("L-1", s -> { }, errors::add);
        transport.open();
        transport.sent.clear();

        transport.drop(1006, "abnormal closure");

        assertEquals(4, errors.size());
        assertEquals(2, transport.connects);
        assertEquals(ConnectionState.CONNECTING, hub.state());

        transport.open();

        assertEquals(ConnectionState.CONNECTED, hub.state());
        assertEquals(List.of(codec.subscribe(V1), codec.subscribe(D1), codec.subscribeLoadStatus("L-1")), transport.sent);
    }

    @Test
    void testCallbacksFromSupersededConnectionIgnored() {
        List<PositionSample> received = new ArrayList<>();
        hub.subscribe("v1", EntityType.VEHICLE, received::add, e -> { });
        transport.open();
        PushTransport.Listener stale = transport.current();
        transport.drop(1006, "abnormal closure");
        transport.open();

        stale.onMessage(positionFrame(V1, 40.5));
        stale.onClose(1000, "late close");

        assertTrue(received.isEmpty());
        assertEquals(ConnectionState.CONNECTED, hub.state());
        assertEquals(2, transport.connects);
    }

    @Test
    void testBacksOffThenFailsAfterMaxAttempts() {
        List<TrackingConnectionException> errors = new ArrayList<>();
        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, errors::add);

        for (int attempt = 1; attempt <= 5; attempt++) {
            transport.current().onError(new IOException("connection refused"));
            assertEquals(attempt, hub.retryAttempts());
            if (attempt < 5) {
                assertEquals(ConnectionState.DISCONNECTED, hub.state());
                scheduled.get(attempt - 1).run();
                assertEquals(attempt + 1, transport.connects);
            }
        }

        assertEquals(ConnectionState.FAILED, hub.state());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(5)),
                delays);
        assertEquals(5, errors.size());
        assertEquals(5, transport.connects);
    }

    @Test
    void testNewSubscriptionResetsFailedHub() {
        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, e -> { });
        for (int attempt = 1; attempt <= 5; attempt++) {
            transport.current().onError(new IOException("connection refused"));
            if (attempt < 5) {
                scheduled.get(attempt - 1).run();
            }
        }
        assertEquals(ConnectionState.FAILED, hub.state());

        hub.subscribe("d1", EntityType.DRIVER, p -> { }, e -> { });

        assertEquals(0, hub.retryAttempts());
        assertEquals(ConnectionState.CONNECTING, hub.state());
        assertEquals(6, transport.connects);
        transport.open();
        assertEquals(List.of(codec.subscribe(V1), codec.subscribe(D1)), transport.sent);
    }

    @Test
    void testCloseDuringHandshakeCountsAsFailedAttempt() {
        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, e -> { });

        transport.current().onClose(1002, "protocol error");

        assertEquals(1, hub.retryAttempts());
        assertEquals(ConnectionState.DISCONNECTED, hub.state());
        assertEquals(1, scheduled.size());
    }

    @Test
    void testLoadStatusDispatch() {
        List<LoadStatusUpdate> received = new ArrayList<>();
        hub.subscribeLoadStatus("L-1", received::add, e -> { });
        transport.open();

        transport.receive("{\"event\":\"load_status\",\"loadId\":\"L-1\",\"status\":\"IN_TRANSIT\"}");
        transport.receive("{\"event\":\"load_status\",\"loadId\":\"L-2\",\"status\":\"DELIVERED\"}");

        assertEquals(1, received.size());
        assertEquals("IN_TRANSIT", received.get(0).getStatus());
        assertEquals(List.of(codec.subscribeLoadStatus("L-1")), transport.sent);
    }

    @Test
    void testStopClosesTransportAndIgnoresLateCallbacks() {
        hub.subscribe("v1", EntityType.VEHICLE, p -> { }, e -> { });
        transport.open();

        hub.stop();
        transport.current().onClose(1000, "bye");

        assertTrue(transport.closed);
        assertEquals(ConnectionState.DISCONNECTED, hub.state());
        assertEquals(1, transport.connects);
    }

    @Test
    void testBackoffDoublesUpToCap() {
        assertEquals(Duration.ofSeconds(1), hub.backoff(1));
        assertEquals(Duration.ofSeconds(2), hub.backoff(2));
        assertEquals(Duration.ofSeconds(4), hub.backoff(3));
        assertEquals(Duration.ofSeconds(5), hub.backoff(4));
        assertEquals(Duration.ofSeconds(5), hub.backoff(40));
    }

    private static final class FakeTransport implements PushTransport {
        private final List<Listener> listeners = new ArrayList<>();
        private final List<String> sent = new ArrayList<>();
        private int connects;
        private boolean open;
        private boolean closed;

        @Override
        public void connect(Listener listener) {
            listeners.add(listener);
            connects++;
        }

        @Override
        public void send(String text) {
            if (!open) {
                throw new TrackingConnectionException("not connected");
            }
            sent.add(text);
        }

        @Override
        public void close() {
            open = false;
            closed = true;
        }

        Listener current() {
            return listeners.get(listeners.size() - 1);
        }

        void open() {
            open = true;
            current().onOpen();
        }

        void receive(String frame) {
            current().onMessage(frame);
        }

        void drop(int code, String reason) {
            open = false;
            current().onClose(code, reason);
        }
    }
}
