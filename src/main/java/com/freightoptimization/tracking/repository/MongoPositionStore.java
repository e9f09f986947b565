package com.freightoptimization.tracking.repository;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.exception.EntityNotFoundException;
import com.freightoptimization.tracking.exception.PositionConflictException;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.exception.TrackingException;
import com.freightoptimization.tracking.exception.TrackingStoreException;
import com.freightoptimization.tracking.exception.TrackingTimeoutException;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.MonthlyPartition;
import com.freightoptimization.tracking.model.PositionSample;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.client.result.UpdateResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.geo.GeoJsonPoint;
import org.springframework.data.mongodb.core.index.GeoSpatialIndexType;
import org.springframework.data.mongodb.core.index.GeospatialIndex;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * MongoDB store with one collection per calendar month. Each partition carries an
 * {@code (entityId, entityType, recordedAt desc)} index and a 2dsphere index on {@code location};
 * with the uniqueness constraint enabled it also carries a partial unique index on
 * {@code (entityId, recordedAt, sourceLogId)}. Nearby searches run against the latest-position
 * collection, whose {@code position.location} carries its own 2dsphere index.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "tracking.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoPositionStore implements PositionStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final int retentionMonths;
    private final boolean enforceUniqueSamples;
    private final Duration queryTimeout;

    private static final String LATEST_LOCATION_FIELD = "position.location";

    private final Set<MonthlyPartition> knownPartitions = ConcurrentHashMap.newKeySet();
    private volatile boolean latestIndexEnsured;
    private final Object partitionLock = new Object();

    public MongoPositionStore(MongoTemplate mongoTemplate, TrackingProperties properties, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        this.retentionMonths = properties.getStore().getRetentionMonths();
        this.enforceUniqueSamples = properties.getStore().isEnforceUniqueSamples();
        this.queryTimeout = properties.getStore().getQueryTimeout();
    }

    @Override
    public void append(PositionSample sample) {
        PositionSampleValidator.validate(sample);
        MonthlyPartition partition = MonthlyPartition.containing(sample.getRecordedAt());
        Instant now = clock.instant();
        if (!partition.getRangeEnd().isAfter(MonthlyPartition.retentionCutoff(now, retentionMonths))) {
            throw new PositionValidationException("recordedAt " + sample.getRecordedAt()
                    + " is older than the " + retentionMonths + "-month retention window");
        }

        try {
            ensurePartition(partition);
            try {
                mongoTemplate.insert(PositionHistoryDocument.from(sample), partition.getName());
            } catch (DuplicateKeyException e) {
                throw new PositionConflictException("Duplicate sample for " + sample.key() + " at "
                        + sample.getRecordedAt() + " (sourceLogId=" + sample.getSourceLogId() + ")", e);
            }
            updateLatest(sample, now);
        } catch (DataAccessException e) {
            throw translate(e, "Append for " + sample.key());
        }
    }

    private void updateLatest(PositionSample sample, Instant now) {
        String id = sample.key().toWireKey();
        Query newerThanStored = new Query(Criteria.where("_id").is(id).and("recordedAt").lte(sample.getRecordedAt()));
        Update update = new Update()
                .set("recordedAt", sample.getRecordedAt())
                .set("position", PositionHistoryDocument.from(sample))
                .set("updatedAt", now);
        UpdateResult result = mongoTemplate.updateFirst(newerThanStored, update, EntityPositionDocument.class);
        if (result.getMatchedCount() > 0) {
            return;
        }
        try {
            mongoTemplate.insert(EntityPositionDocument.first(sample, now));
        } catch (DuplicateKeyException e) {
            // the stored position is newer than this sample
            log.debug("Kept newer latest position for {}", id);
        }
    }

    @Override
    public List<PositionSample> queryRange(String entityId, EntityType entityType, Instant start, Instant end,
                                           int limit, int offset) {
        EntityKey key = EntityKey.of(entityType, entityId);
        try {
            if (!mongoTemplate.exists(Query.query(Criteria.where("_id").is(key.toWireKey())), EntityPositionDocument.class)) {
                throw new EntityNotFoundException("Unknown entity " + key);
            }
            List<PositionSample> result = new ArrayList<>();
            if (limit <= 0 || start.isAfter(end)) {
                return result;
            }
            long toSkip = Math.max(0, offset);
            for (MonthlyPartition partition : partitions()) {
                if (!partition.overlaps(start, end)) {
                    continue;
                }
                if (toSkip > 0) {
                    long count = mongoTemplate.count(rangeQuery(key, start, end), partition.getName());
                    if (count <= toSkip) {
                        toSkip -= count;
                        continue;
                    }
                }
                Query query = rangeQuery(key, start, end)
                        .with(Sort.by(Sort.Direction.ASC, "recordedAt"))
                        .skip(toSkip)
                        .limit(limit - result.size());
                toSkip = 0;
                mongoTemplate.find(query, PositionHistoryDocument.class, partition.getName())
                        .forEach(doc -> result.add(doc.toSample()));
                if (result.size() >= limit) {
                    break;
                }
            }
            return result;
        } catch (DataAccessException e) {
            throw translate(e, "Range query for " + key);
        }
    }

    @Override
    public Optional<PositionSample> latest(String entityId, EntityType entityType) {
        String id = EntityKey.of(entityType, entityId).toWireKey();
        try {
            return Optional.ofNullable(mongoTemplate.findById(id, EntityPositionDocument.class))
                    .map(EntityPositionDocument::getPosition)
                    .map(PositionHistoryDocument::toSample);
        } catch (DataAccessException e) {
            throw translate(e, "Latest position lookup for " + id);
        }
    }

    @Override
    public List<PositionSample> recent(String entityId, EntityType entityType, int count) {
        EntityKey key = EntityKey.of(entityType, entityId);
        List<PositionSample> newestFirst = new ArrayList<>();
        if (count <= 0) {
            return newestFirst;
        }
        List<MonthlyPartition> partitions = partitions();
        Collections.reverse(partitions);
        try {
            for (MonthlyPartition partition : partitions) {
                Query query = entityQuery(key)
                        .with(Sort.by(Sort.Direction.DESC, "recordedAt"))
                        .limit(count - newestFirst.size());
                mongoTemplate.find(query, PositionHistoryDocument.class, partition.getName())
                        .forEach(doc -> newestFirst.add(doc.toSample()));
                if (newestFirst.size() >= count) {
                    break;
                }
            }
        } catch (DataAccessException e) {
            throw translate(e, "Recent samples for " + key);
        }
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    /**
     * {@code $nearSphere} over the latest-position collection; results come back nearest first.
     */
    @Override
    public List<PositionSample> findNearby(double latitude, double longitude, double radiusKm, EntityType entityType,
                                           int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        try {
            ensureLatestPositionIndex();
            Criteria criteria = Criteria.where(LATEST_LOCATION_FIELD)
                    .nearSphere(new GeoJsonPoint(longitude, latitude))
                    .maxDistance(radiusKm * 1000.0);
            if (entityType != null) {
                criteria = criteria.and("entityType").is(entityType);
            }
            Query query = new Query(criteria).limit(limit);
            query.maxTime(queryTimeout);
            return mongoTemplate.find(query, EntityPositionDocument.class).stream()
                    .map(EntityPositionDocument::getPosition)
                    .map(PositionHistoryDocument::toSample)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw translate(e, "Nearby query around (" + latitude + ", " + longitude + ")");
        }
    }

    private void ensureLatestPositionIndex() {
        if (latestIndexEnsured) {
            return;
        }
        mongoTemplate.indexOps(EntityPositionDocument.class).ensureIndex(new GeospatialIndex(LATEST_LOCATION_FIELD)
                .typed(GeoSpatialIndexType.GEO_2DSPHERE)
                .named("latest_location_2dsphere_idx"));
        latestIndexEnsured = true;
    }

    @Override
    public List<MonthlyPartition> ensureUpcomingPartition(Instant now) {
        MonthlyPartition current = MonthlyPartition.containing(now);
        List<MonthlyPartition> created = new ArrayList<>();
        try {
            for (MonthlyPartition partition : List.of(current, current.next())) {
                if (ensurePartition(partition)) {
                    created.add(partition);
                }
            }
        } catch (DataAccessException e) {
            throw translate(e, "Partition creation");
        }
        return created;
    }

    @Override
    public List<MonthlyPartition> pruneOldPartitions(Instant now, int retentionMonths) {
        Instant cutoff = MonthlyPartition.retentionCutoff(now, retentionMonths);
        List<MonthlyPartition> dropped = new ArrayList<>();
        synchronized (partitionLock) {
            for (MonthlyPartition partition : partitions()) {
                if (!partition.getRangeEnd().isAfter(cutoff)) {
                    try {
                        mongoTemplate.dropCollection(partition.getName());
                    } catch (DataAccessException e) {
                        throw translate(e, "Dropping partition " + partition.getName());
                    }
                    knownPartitions.remove(partition);
                    dropped.add(partition);
                    log.info("Dropped position partition {}", partition.getName());
                }
            }
        }
        return dropped;
    }

    @Override
    public List<MonthlyPartition> partitions() {
        try {
            return mongoTemplate.getCollectionNames().stream()
                    .map(MonthlyPartition::parse)
                    .flatMap(Optional::stream)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw translate(e, "Listing partitions");
        }
    }

    /**
     * Creates the partition collection and its indexes if missing.
     *
     * @return true when this call created it
     */
    private boolean ensurePartition(MonthlyPartition partition) {
        if (knownPartitions.contains(partition)) {
            return false;
        }
        synchronized (partitionLock) {
            String name = partition.getName();
            if (mongoTemplate.collectionExists(name)) {
                knownPartitions.add(partition);
                return false;
            }
            try {
                mongoTemplate.createCollection(name);
            } catch (DataAccessException e) {
                // another instance may have created it between the check and the create
                if (!mongoTemplate.collectionExists(name)) {
                    throw e;
                }
                knownPartitions.add(partition);
                return false;
            }
            IndexOperations indexOps = mongoTemplate.indexOps(name);
            indexOps.ensureIndex(new Index()
                    .on("entityId", Sort.Direction.ASC)
                    .on("entityType", Sort.Direction.ASC)
                    .on("recordedAt", Sort.Direction.DESC)
                    .named("entity_recorded_at_idx"));
            indexOps.ensureIndex(new GeospatialIndex("location")
                    .typed(GeoSpatialIndexType.GEO_2DSPHERE)
                    .named("location_2dsphere_idx"));
            if (enforceUniqueSamples) {
                indexOps.ensureIndex(new Index()
                        .on("entityId", Sort.Direction.ASC)
                        .on("recordedAt", Sort.Direction.ASC)
                        .on("sourceLogId", Sort.Direction.ASC)
                        .unique()
                        .partial(PartialIndexFilter.of(Criteria.where("sourceLogId").exists(true)))
                        .named("unique_sample_idx"));
            }
            knownPartitions.add(partition);
            log.info("Created position partition {}", partition);
            return true;
        }
    }

    private Query entityQuery(EntityKey key) {
        Query query = new Query(Criteria.where("entityId").is(key.getEntityId())
                .and("entityType").is(key.getEntityType()));
        query.maxTime(queryTimeout);
        return query;
    }

    private Query rangeQuery(EntityKey key, Instant start, Instant end) {
        Query query = new Query(Criteria.where("entityId").is(key.getEntityId())
                .and("entityType").is(key.getEntityType())
                .and("recordedAt").gte(start).lte(end));
        query.maxTime(queryTimeout);
        return query;
    }

    /**
     * Server-side timeouts become {@link TrackingTimeoutException}; every other driver failure
     * becomes {@link TrackingStoreException}.
     */
    private TrackingException translate(DataAccessException e, String operation) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof QueryTimeoutException || cause instanceof MongoExecutionTimeoutException) {
                return new TrackingTimeoutException(operation + " exceeded " + queryTimeout.toMillis() + " ms", e);
            }
            cause = cause.getCause();
        }
        log.error("{} failed: {}", operation, e.getMessage());
        return new TrackingStoreException(operation + " failed: " + e.getMessage(), e);
    }
}
