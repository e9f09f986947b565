package com.freightoptimization.tracking.push;

import com.freightoptimization.tracking.cache.PositionCache;
import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.dto.LoadStatusUpdate;
import com.freightoptimization.tracking.exception.TrackingConnectionException;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.PositionSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Multiplexes per-entity and per-load subscriptions over one upstream push connection.
 *
 * <p>One lock guards the connection state, the listener maps and outbound sends. Transport callbacks
 * and inbound frames are processed on {@code eventLoop}; listener callbacks always run outside the
 * lock. Each connection attempt gets a generation number and callbacks from older attempts are
 * ignored.
 *
 * <p>Failed attempts back off {@code min(initialBackoff * 2^(n-1), maxBackoff)}. After
 * {@code maxAttempts} consecutive failures the hub is {@link ConnectionState#FAILED} until the next
 * subscription resets the counter.
 */
@Slf4j
public class SubscriptionHub {

    private final PushTransport transport;
    private final PushMessageCodec codec;
    private final PositionCache positionCache;
    private final TaskScheduler scheduler;
    private final Executor eventLoop;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<EntityKey, Set<Registration<PositionSample>>> positionListeners = new LinkedHashMap<>();
    private final Map<String, Set<Registration<LoadStatusUpdate>>> loadListeners = new LinkedHashMap<>();
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int retryAttempts;
    private long generation;
    private boolean running;
    private ScheduledFuture<?> pendingReconnect;

    public SubscriptionHub(PushTransport transport, PushMessageCodec codec, PositionCache positionCache,
                           TaskScheduler scheduler, Executor eventLoop, Clock clock, TrackingProperties.Push settings) {
        this.transport = transport;
        this.codec = codec;
        this.positionCache = positionCache;
        this.scheduler = scheduler;
        this.eventLoop = eventLoop;
        this.clock = clock;
        this.maxAttempts = settings.getMaxAttempts();
        this.initialBackoff = settings.getInitialBackoff();
        this.maxBackoff = settings.getMaxBackoff();
    }

    public void start() {
        long connectGeneration;
        lock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
            log.info("Subscription hub started");
            connectGeneration = prepareConnectLocked();
        } finally {
            lock.unlock();
        }
        openConnection(connectGeneration);
    }

    public void stop() {
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            generation++;
            cancelPendingReconnectLocked();
            state = ConnectionState.DISCONNECTED;
        } finally {
            lock.unlock();
        }
        transport.close();
        log.info("Subscription hub stopped");
    }

    public Subscription subscribe(String entityId, EntityType entityType,
                                  Consumer<PositionSample> onUpdate, Consumer<TrackingConnectionException> onError) {
        EntityKey key = EntityKey.of(entityType, entityId);
        Registration<PositionSample> registration = new Registration<>(key.toWireKey(), onUpdate, onError);
        long connectGeneration;
        lock.lock();
        try {
            Set<Registration<PositionSample>> listeners = positionListeners.computeIfAbsent(key, k -> new LinkedHashSet<>());
            boolean first = listeners.isEmpty();
            listeners.add(registration);
            if (first && state == ConnectionState.CONNECTED) {
                sendLocked(codec.subscribe(key));
            }
            connectGeneration = prepareConnectLocked();
        } finally {
            lock.unlock();
        }
        openConnection(connectGeneration);
        return () -> removePositionListener(key, registration);
    }

    public Subscription subscribeLoadStatus(String loadId, Consumer<LoadStatusUpdate> onStatus,
                                            Consumer<TrackingConnectionException> onError) {
        if (loadId == null || loadId.isBlank()) {
            throw new IllegalArgumentException("loadId must not be blank");
        }
        Registration<LoadStatusUpdate> registration = new Registration<>("LOAD_STATUS_" + loadId, onStatus, onError);
        long connectGeneration;
        lock.lock();
        try {
            Set<Registration<LoadStatusUpdate>> listeners = loadListeners.computeIfAbsent(loadId, k -> new LinkedHashSet<>());
            boolean first = listeners.isEmpty();
            listeners.add(registration);
            if (first && state == ConnectionState.CONNECTED) {
                sendLocked(codec.subscribeLoadStatus(loadId));
            }
            connectGeneration = prepareConnectLocked();
        } finally {
            lock.unlock();
        }
        openConnection(connectGeneration);
        return () -> removeLoadListener(loadId, registration);
    }

    public ConnectionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int retryAttempts() {
        lock.lock();
        try {
            return retryAttempts;
        } finally {
            lock.unlock();
        }
    }

    public Set<EntityKey> subscribedKeys() {
        lock.lock();
        try {
            return Set.copyOf(positionListeners.keySet());
        } finally {
            lock.unlock();
        }
    }

    public Set<String> subscribedLoads() {
        lock.lock();
        try {
            return Set.copyOf(loadListeners.keySet());
        } finally {
            lock.unlock();
        }
    }

    private void removePositionListener(EntityKey key, Registration<PositionSample> registration) {
        if (!registration.deactivate()) {
            return;
        }
        lock.lock();
        try {
            Set<Registration<PositionSample>> listeners = positionListeners.get(key);
            if (listeners != null && listeners.remove(registration) && listeners.isEmpty()) {
                positionListeners.remove(key);
                if (state == ConnectionState.CONNECTED) {
                    sendLocked(codec.unsubscribe(key));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void removeLoadListener(String loadId, Registration<LoadStatusUpdate> registration) {
        if (!registration.deactivate()) {
            return;
        }
        lock.lock();
        try {
            Set<Registration<LoadStatusUpdate>> listeners = loadListeners.get(loadId);
            if (listeners != null && listeners.remove(registration) && listeners.isEmpty()) {
                loadListeners.remove(loadId);
                if (state == ConnectionState.CONNECTED) {
                    sendLocked(codec.unsubscribeLoadStatus(loadId));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to CONNECTING when a connection is wanted and none is underway.
     *
     * @return the new attempt's generation, or -1 when no attempt should start
     */
    private long prepareConnectLocked() {
        if (!running || !hasSubscriptionsLocked()) {
            return -1;
        }
        if (state == ConnectionState.FAILED) {
            log.info("Retrying push connection after earlier failure");
            retryAttempts = 0;
            state = ConnectionState.DISCONNECTED;
        }
        if (state != ConnectionState.DISCONNECTED || pendingReconnect != null) {
            return -1;
        }
        state = ConnectionState.CONNECTING;
        return ++generation;
    }

    private void openConnection(long connectGeneration) {
        if (connectGeneration < 0) {
            return;
        }
        log.info("Connecting to push feed (attempt {})", retryAttempts() + 1);
        try {
            transport.connect(new ConnectionListener(connectGeneration));
        } catch (RuntimeException e) {
            onConnectFailure(connectGeneration, e);
        }
    }

    private void reconnect() {
        long connectGeneration;
        lock.lock();
        try {
            pendingReconnect = null;
            connectGeneration = prepareConnectLocked();
        } finally {
            lock.unlock();
        }
        openConnection(connectGeneration);
    }

    private void onOpen(long attempt) {
        lock.lock();
        try {
            if (attempt != generation || state != ConnectionState.CONNECTING) {
                return;
            }
            state = ConnectionState.CONNECTED;
            retryAttempts = 0;
            log.info("Push connection established, resubscribing {} entities and {} loads",
                    positionListeners.size(), loadListeners.size());
            for (EntityKey key : positionListeners.keySet()) {
                sendLocked(codec.subscribe(key));
            }
            for (String loadId : loadListeners.keySet()) {
                sendLocked(codec.subscribeLoadStatus(loadId));
            }
        } finally {
            lock.unlock();
        }
    }

    private void onConnectFailure(long attempt, Throwable cause) {
        List<Registration<?>> toNotify;
        int attemptNumber;
        lock.lock();
        try {
            if (attempt != generation || state != ConnectionState.CONNECTING) {
                return;
            }
            attemptNumber = ++retryAttempts;
            toNotify = allRegistrationsLocked();
            if (retryAttempts >= maxAttempts) {
                state = ConnectionState.FAILED;
                log.error("Push connection failed after {} attempts, giving up", retryAttempts);
            } else {
                state = ConnectionState.DISCONNECTED;
                Duration delay = backoff(retryAttempts);
                log.warn("Push connection attempt {} failed ({}), retrying in {} ms",
                        retryAttempts, cause.getMessage(), delay.toMillis());
                pendingReconnect = scheduler.schedule(() -> eventLoop.execute(this::reconnect),
                        clock.instant().plus(delay));
            }
        } finally {
            lock.unlock();
        }
        notifyErrors(toNotify, new TrackingConnectionException(
                "Push connection attempt " + attemptNumber + " failed: " + cause.getMessage(), cause));
    }

    private void onClose(long attempt, int code, String reason) {
        List<Registration<?>> toNotify;
        long connectGeneration;
        boolean handshakeFailed = false;
        lock.lock();
        try {
            if (attempt != generation) {
                return;
            }
            if (state == ConnectionState.CONNECTING) {
                handshakeFailed = true;
                toNotify = List.of();
                connectGeneration = -1;
            } else if (state == ConnectionState.CONNECTED) {
                state = ConnectionState.DISCONNECTED;
                log.warn("Push connection dropped ({} {}), reconnecting", code, reason);
                toNotify = allRegistrationsLocked();
                connectGeneration = prepareConnectLocked();
            } else {
                return;
            }
        } finally {
            lock.unlock();
        }
        if (handshakeFailed) {
            onConnectFailure(attempt, new TrackingConnectionException("Connection closed during handshake: " + code));
            return;
        }
        notifyErrors(toNotify, new TrackingConnectionException("Push connection lost: " + code + " " + reason));
        openConnection(connectGeneration);
    }

    private void onTransportError(long attempt, Throwable error) {
        List<Registration<?>> toNotify;
        boolean handshakeFailed;
        lock.lock();
        try {
            if (attempt != generation) {
                return;
            }
            handshakeFailed = state == ConnectionState.CONNECTING;
            toNotify = handshakeFailed ? List.of() : allRegistrationsLocked();
        } finally {
            lock.unlock();
        }
        if (handshakeFailed) {
            onConnectFailure(attempt, error);
            return;
        }
        log.warn("Push transport error: {}", error.getMessage());
        notifyErrors(toNotify, new TrackingConnectionException("Push transport error: " + error.getMessage(), error));
    }

    private void onMessage(long attempt, String text) {
        InboundPushEvent event = codec.decode(text).orElse(null);
        if (event == null) {
            return;
        }
        if (event.getKind() == InboundPushEvent.Kind.POSITION_UPDATE) {
            List<Registration<PositionSample>> targets;
            lock.lock();
            try {
                if (attempt != generation) {
                    return;
                }
                Set<Registration<PositionSample>> listeners = positionListeners.get(event.getKey());
                if (listeners == null || listeners.isEmpty()) {
                    log.debug("Dropping update for unsubscribed key {}", event.getKey());
                    return;
                }
                targets = new ArrayList<>(listeners);
            } finally {
                lock.unlock();
            }
            positionCache.put(event.getPosition());
            targets.forEach(r -> r.deliver(event.getPosition()));
        } else {
            LoadStatusUpdate update = event.getLoadStatus();
            List<Registration<LoadStatusUpdate>> targets;
            lock.lock();
            try {
                if (attempt != generation) {
                    return;
                }
                Set<Registration<LoadStatusUpdate>> listeners = loadListeners.get(update.getLoadId());
                if (listeners == null || listeners.isEmpty()) {
                    log.debug("Dropping status for unsubscribed load {}", update.getLoadId());
                    return;
                }
                targets = new ArrayList<>(listeners);
            } finally {
                lock.unlock();
            }
            targets.forEach(r -> r.deliver(update));
        }
    }

    Duration backoff(int attempt) {
        long millis = initialBackoff.toMillis() << Math.min(attempt - 1, 30);
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }

    private void sendLocked(String frame) {
        try {
            transport.send(frame);
        } catch (RuntimeException e) {
            // the close callback follows and triggers the reconnect
            log.warn("Failed to send push frame: {}", e.getMessage());
        }
    }

    private boolean hasSubscriptionsLocked() {
        return !positionListeners.isEmpty() || !loadListeners.isEmpty();
    }

    private List<Registration<?>> allRegistrationsLocked() {
        List<Registration<?>> all = new ArrayList<>();
        positionListeners.values().forEach(all::addAll);
        loadListeners.values().forEach(all::addAll);
        return all;
    }

    private void cancelPendingReconnectLocked() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    private static void notifyErrors(List<Registration<?>> registrations, TrackingConnectionException error) {
        for (Registration<?> registration : registrations) {
            registration.fail(error);
        }
    }

    private final class ConnectionListener implements PushTransport.Listener {
        private final long attempt;

        ConnectionListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onOpen() {
            eventLoop.execute(() -> SubscriptionHub.this.onOpen(attempt));
        }

        @Override
        public void onMessage(String text) {
            eventLoop.execute(() -> SubscriptionHub.this.onMessage(attempt, text));
        }

        @Override
        public void onClose(int code, String reason) {
            eventLoop.execute(() -> SubscriptionHub.this.onClose(attempt, code, reason));
        }

        @Override
        public void onError(Throwable error) {
            eventLoop.execute(() -> onTransportError(attempt, error));
        }
    }

    private static final class Registration<T> {
        private final String target;
        private final Consumer<T> onUpdate;
        private final Consumer<TrackingConnectionException> onError;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Registration(String target, Consumer<T> onUpdate, Consumer<TrackingConnectionException> onError) {
            this.target = target;
            this.onUpdate = onUpdate;
            this.onError = onError;
        }

        boolean deactivate() {
            return active.compareAndSet(true, false);
        }

        void deliver(T value) {
            if (!active.get() || onUpdate == null) {
                return;
            }
            try {
                onUpdate.accept(value);
            } catch (RuntimeException e) {
                log.error("Listener for {} failed", target, e);
            }
        }

        void fail(TrackingConnectionException error) {
            if (!active.get() || onError == null) {
                return;
            }
            try {
                onError.accept(error);
            } catch (RuntimeException e) {
                log.error("Error listener for {} failed", target, e);
            }
        }
    }
}
