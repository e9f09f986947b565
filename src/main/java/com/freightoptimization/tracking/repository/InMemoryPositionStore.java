package com.freightoptimization.tracking.repository;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.exception.EntityNotFoundException;
import com.freightoptimization.tracking.exception.PositionConflictException;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.geo.GeoUtils;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.MonthlyPartition;
import com.freightoptimization.tracking.model.PositionSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Heap-backed store honouring the same monthly partition contract as {@link MongoPositionStore}.
 * Used by tests and single-node deployments ({@code tracking.store.type=memory}).
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "tracking.store.type", havingValue = "memory")
public class InMemoryPositionStore implements PositionStore {

    private static final Comparator<PositionSample> BY_RECORDED_AT = Comparator.comparing(PositionSample::getRecordedAt);

    private final Clock clock;
    private final int retentionMonths;
    private final boolean enforceUniqueSamples;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final TreeMap<MonthlyPartition, Map<EntityKey, List<PositionSample>>> partitions = new TreeMap<>();
    private final Map<MonthlyPartition, Set<String>> uniqueKeys = new HashMap<>();
    private final Map<EntityKey, PositionSample> latestByEntity = new HashMap<>();

    public InMemoryPositionStore(TrackingProperties properties, Clock clock) {
        this.clock = clock;
        this.retentionMonths = properties.getStore().getRetentionMonths();
        this.enforceUniqueSamples = properties.getStore().isEnforceUniqueSamples();
    }

    @Override
    public void append(PositionSample sample) {
        PositionSampleValidator.validate(sample);
        MonthlyPartition partition = MonthlyPartition.containing(sample.getRecordedAt());
        Instant cutoff = MonthlyPartition.retentionCutoff(clock.instant(), retentionMonths);
        if (!partition.getRangeEnd().isAfter(cutoff)) {
            throw new PositionValidationException("recordedAt " + sample.getRecordedAt()
                    + " is older than the " + retentionMonths + "-month retention window");
        }

        EntityKey key = sample.key();
        lock.writeLock().lock();
        try {
            if (!partitions.containsKey(partition)) {
                createPartition(partition);
            }
            if (enforceUniqueSamples && sample.getSourceLogId() != null) {
                String uniqueKey = sample.getEntityId() + "|" + sample.getRecordedAt() + "|" + sample.getSourceLogId();
                if (!uniqueKeys.computeIfAbsent(partition, p -> new HashSet<>()).add(uniqueKey)) {
                    throw new PositionConflictException("Duplicate sample " + uniqueKey);
                }
            }
            List<PositionSample> series = partitions.get(partition).computeIfAbsent(key, k -> new ArrayList<>());
            int index = Collections.binarySearch(series, sample, BY_RECORDED_AT);
            // after any equal timestamps, so insertion order breaks ties
            int insertAt = index < 0 ? -index - 1 : upperBound(series, index);
            series.add(insertAt, sample);

            PositionSample current = latestByEntity.get(key);
            if (current == null || !sample.getRecordedAt().isBefore(current.getRecordedAt())) {
                latestByEntity.put(key, sample);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<PositionSample> queryRange(String entityId, EntityType entityType, Instant start, Instant end,
                                           int limit, int offset) {
        EntityKey key = EntityKey.of(entityType, entityId);
        lock.readLock().lock();
        try {
            if (!latestByEntity.containsKey(key)) {
                throw new EntityNotFoundException("Unknown entity " + key);
            }
            List<PositionSample> result = new ArrayList<>();
            if (limit <= 0 || start.isAfter(end)) {
                return result;
            }
            int skipped = 0;
            for (Map.Entry<MonthlyPartition, Map<EntityKey, List<PositionSample>>> entry : partitions.entrySet()) {
                if (!entry.getKey().overlaps(start, end)) {
                    continue;
                }
                for (PositionSample sample : entry.getValue().getOrDefault(key, List.of())) {
                    if (sample.getRecordedAt().isBefore(start) || sample.getRecordedAt().isAfter(end)) {
                        continue;
                    }
                    if (skipped < offset) {
                        skipped++;
                        continue;
                    }
                    result.add(sample);
                    if (result.size() >= limit) {
                        return result;
                    }
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<PositionSample> latest(String entityId, EntityType entityType) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(latestByEntity.get(EntityKey.of(entityType, entityId)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<PositionSample> recent(String entityId, EntityType entityType, int count) {
        EntityKey key = EntityKey.of(entityType, entityId);
        lock.readLock().lock();
        try {
            List<PositionSample> newestFirst = new ArrayList<>();
            for (Map<EntityKey, List<PositionSample>> partition : partitions.descendingMap().values()) {
                List<PositionSample> series = partition.getOrDefault(key, List.of());
                for (int i = series.size() - 1; i >= 0 && newestFirst.size() < count; i--) {
                    newestFirst.add(series.get(i));
                }
                if (newestFirst.size() >= count) {
                    break;
                }
            }
            Collections.reverse(newestFirst);
            return newestFirst;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<PositionSample> findNearby(double latitude, double longitude, double radiusKm, EntityType entityType,
                                           int limit) {
        List<PositionSample> candidates;
        lock.readLock().lock();
        try {
            candidates = new ArrayList<>(latestByEntity.values());
        } finally {
            lock.readLock().unlock();
        }
        return candidates.stream()
                .filter(sample -> entityType == null || sample.getEntityType() == entityType)
                .filter(sample -> distanceKm(sample, latitude, longitude) <= radiusKm)
                .sorted(Comparator.comparingDouble(sample -> distanceKm(sample, latitude, longitude)))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    private static double distanceKm(PositionSample sample, double latitude, double longitude) {
        return GeoUtils.haversineKm(latitude, longitude, sample.getLatitude(), sample.getLongitude());
    }

    @Override
    public List<MonthlyPartition> ensureUpcomingPartition(Instant now) {
        MonthlyPartition current = MonthlyPartition.containing(now);
        List<MonthlyPartition> created = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (MonthlyPartition partition : List.of(current, current.next())) {
                if (!partitions.containsKey(partition)) {
                    createPartition(partition);
                    created.add(partition);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return created;
    }

    @Override
    public List<MonthlyPartition> pruneOldPartitions(Instant now, int retentionMonths) {
        Instant cutoff = MonthlyPartition.retentionCutoff(now, retentionMonths);
        List<MonthlyPartition> dropped = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (MonthlyPartition partition : new ArrayList<>(partitions.keySet())) {
                if (!partition.getRangeEnd().isAfter(cutoff)) {
                    partitions.remove(partition);
                    uniqueKeys.remove(partition);
                    dropped.add(partition);
                    log.info("Dropped position partition {}", partition.getName());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return dropped;
    }

    @Override
    public List<MonthlyPartition> partitions() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(partitions.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void createPartition(MonthlyPartition partition) {
        partitions.put(partition, new HashMap<>());
        log.info("Created position partition {}", partition);
    }

    private static int upperBound(List<PositionSample> series, int index) {
        Instant recordedAt = series.get(index).getRecordedAt();
        int i = index;
        while (i < series.size() && series.get(i).getRecordedAt().equals(recordedAt)) {
            i++;
        }
        return i;
    }
}
