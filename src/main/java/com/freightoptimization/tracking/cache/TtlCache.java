package com.freightoptimization.tracking.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * In-memory keyed store with a fixed time-to-live. One lock guards the whole map, so key
 * insertion and removal are atomic with respect to reads.
 *
 * <p>An entry inserted at {@code T} is visible strictly before {@code T + ttl}. Expired entries are
 * treated as absent and removed when next touched, or by {@link #evictExpired()}.
 */
public class TtlCache<K, V> {

    private final Duration ttl;
    private final Clock clock;
    private final Map<K, Entry<V>> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public TtlCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<V> get(K key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(now, ttl)) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unconditional overwrite; last writer wins.
     */
    public void put(K key, V value) {
        Objects.requireNonNull(value, "value");
        Entry<V> entry = new Entry<>(value, clock.instant());
        lock.lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(K key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public int invalidateIf(Predicate<K> predicate) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<K> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (predicate.test(it.next())) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int evictExpired() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> entry.isExpired(now, ttl));
            return before - entries.size();
        } finally {
            lock.unlock();
        }
    }

    /** Number of stored entries, expired ones included until they are evicted. */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant insertedAt;

        private Entry(V value, Instant insertedAt) {
            this.value = value;
            this.insertedAt = insertedAt;
        }

        private boolean isExpired(Instant now, Duration ttl) {
            return !now.isBefore(insertedAt.plus(ttl));
        }
    }
}
