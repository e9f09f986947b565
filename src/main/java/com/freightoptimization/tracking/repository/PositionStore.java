package com.freightoptimization.tracking.repository;

import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.MonthlyPartition;
import com.freightoptimization.tracking.model.PositionSample;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only position history, partitioned by calendar month of {@code recordedAt}.
 *
 * <p>Partitions cover {@code [monthStart, nextMonthStart)} in UTC, are contiguous and never
 * overlap. Maintenance calls are idempotent and may run concurrently with reads and writes.
 */
public interface PositionStore {

    /**
     * Validates and persists a sample, creating its month's partition first if needed.
     *
     * @throws com.freightoptimization.tracking.exception.PositionValidationException on a malformed
     *         sample, or one older than the retention window
     * @throws com.freightoptimization.tracking.exception.PositionConflictException on a duplicate
     *         when the uniqueness constraint is enabled
     */
    void append(PositionSample sample);

    /**
     * Samples with {@code start <= recordedAt <= end}, ascending by {@code recordedAt}.
     *
     * @throws com.freightoptimization.tracking.exception.EntityNotFoundException when the entity has
     *         never reported a position
     */
    List<PositionSample> queryRange(String entityId, EntityType entityType, Instant start, Instant end,
                                    int limit, int offset);

    Optional<PositionSample> latest(String entityId, EntityType entityType);

    /**
     * The trailing {@code count} samples, ascending. Empty for unknown entities.
     */
    List<PositionSample> recent(String entityId, EntityType entityType, int count);

    /**
     * Latest positions lying within {@code radiusKm} of a point, nearest first.
     *
     * @param entityType restricts the search to one type; null searches all types
     */
    List<PositionSample> findNearby(double latitude, double longitude, double radiusKm, EntityType entityType,
                                    int limit);

    /**
     * Creates the partitions for the month of {@code now} and the month after, when absent.
     *
     * @return the partitions this call created
     */
    List<MonthlyPartition> ensureUpcomingPartition(Instant now);

    /**
     * Drops partitions lying entirely before the retention window.
     *
     * @return the partitions this call dropped
     */
    List<MonthlyPartition> pruneOldPartitions(Instant now, int retentionMonths);

    /** Existing partitions, ascending. */
    List<MonthlyPartition> partitions();
}
