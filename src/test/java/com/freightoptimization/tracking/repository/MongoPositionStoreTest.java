package com.freightoptimization.tracking.repository;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.exception.EntityNotFoundException;
import com.freightoptimization.tracking.exception.PositionConflictException;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.exception.TrackingStoreException;
import com.freightoptimization.tracking.exception.TrackingTimeoutException;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.MonthlyPartition;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.support.PositionSamples;
import com.mongodb.client.result.UpdateResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.bson.Document;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoPositionStoreTest {

    private static final Instant T = Instant.parse("2024-05-17T08:00:00Z");
    private static final String MAY = "position_history_y2024m05";

    @Mock
    private MongoTemplate mongoTemplate;
    @Mock
    private IndexOperations indexOperations;

    private TrackingProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TrackingProperties();
    }

    private MongoPositionStore store() {
        return new MongoPositionStore(mongoTemplate, properties, Clock.fixed(T, ZoneOffset.UTC));
    }

    @Test
    void testAppendCreatesPartitionAndLatestRecord() {
        PositionSample sample = PositionSamples.vehicle("v1", 40.0, -75.0, T);
        when(mongoTemplate.collectionExists(MAY)).thenReturn(false);
        when(mongoTemplate.indexOps(MAY)).thenReturn(indexOperations);
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(EntityPositionDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        store().append(sample);

        verify(mongoTemplate).createCollection(MAY);
        verify(indexOperations, times(2)).ensureIndex(any());
        verify(mongoTemplate).insert(any(PositionHistoryDocument.class), eq(MAY));
        verify(mongoTemplate).insert(any(EntityPositionDocument.class));
    }

    @Test
    void testAppendSkipsPartitionCreationOnceKnown() {
        when(mongoTemplate.collectionExists(MAY)).thenReturn(true);
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(EntityPositionDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        MongoPositionStore store = store();

        store.append(PositionSamples.vehicle("v1", 40.0, -75.0, T.minusSeconds(60)));
        store.append(PositionSamples.vehicle("v1", 40.1, -75.0, T));

        verify(mongoTemplate, times(1)).collectionExists(MAY);
        verify(mongoTemplate, never()).createCollection(anyString());
        verify(mongoTemplate, never()).insert(any(EntityPositionDocument.class));
    }

    @Test
    void testUniquenessAddsPartialIndexAndMapsDuplicates() {
        properties.getStore().setEnforceUniqueSamples(true);
        PositionSample sample = PositionSamples.vehicle("v1", 40.0, -75.0, T).toBuilder().sourceLogId("log-1").build();
        when(mongoTemplate.collectionExists(MAY)).thenReturn(false);
        when(mongoTemplate.indexOps(MAY)).thenReturn(indexOperations);
        when(mongoTemplate.insert(any(PositionHistoryDocument.class), eq(MAY)))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key"));

        assertThrows(PositionConflictException.class, () -> store().append(sample));

        verify(indexOperations, times(3)).ensureIndex(any());
        verify(mongoTemplate, never()).updateFirst(any(Query.class), any(Update.class), eq(EntityPositionDocument.class));
    }

    @Test
    void testAppendRejectsInvalidSampleBeforeWriting() {
        assertThrows(PositionValidationException.class,
                () -> store().append(PositionSamples.vehicle("v1", 95.0, -75.0, T)));

        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void testQueryRangeUnknownEntity() {
        when(mongoTemplate.exists(any(Query.class), eq(EntityPositionDocument.class))).thenReturn(false);

        assertThrows(EntityNotFoundException.class,
                () -> store().queryRange("ghost", EntityType.VEHICLE, T.minusSeconds(60), T, 10, 0));
    }

    @Test
    void testQueryRangeReadsOverlappingPartitionsInOrder() {
        PositionHistoryDocument april = PositionHistoryDocument.from(
                PositionSamples.vehicle("v1", 40.0, -75.0, Instant.parse("2024-04-30T23:00:00Z")));
        PositionHistoryDocument may = PositionHistoryDocument.from(PositionSamples.vehicle("v1", 40.1, -75.0, T));
        when(mongoTemplate.exists(any(Query.class), eq(EntityPositionDocument.class))).thenReturn(true);
        when(mongoTemplate.getCollectionNames()).thenReturn(Set.of(
                MAY, "position_history_y2024m04", "position_history_y2024m03", "entity_positions"));
        when(mongoTemplate.find(any(Query.class), eq(PositionHistoryDocument.class), eq("position_history_y2024m04")))
                .thenReturn(List.of(april));
        when(mongoTemplate.find(any(Query.class), eq(PositionHistoryDocument.class), eq(MAY)))
                .thenReturn(List.of(may));

        List<PositionSample> result = store().queryRange("v1", EntityType.VEHICLE,
                Instant.parse("2024-04-15T00:00:00Z"), T, 10, 0);

        assertEquals(2, result.size());
        assertEquals(40.0, result.get(0).getLatitude());
        assertEquals(40.1, result.get(1).getLatitude());
        verify(mongoTemplate, never()).find(any(Query.class), eq(PositionHistoryDocument.class),
                eq("position_history_y2024m03"));
    }

    @Test
    void testLatestTimeoutTranslated() {
        when(mongoTemplate.findById("VEHICLE_v1", EntityPositionDocument.class))
                .thenThrow(new QueryTimeoutException("operation exceeded time limit"));

        assertThrows(TrackingTimeoutException.class, () -> store().latest("v1", EntityType.VEHICLE));
    }

    @Test
    void testPartitionsParsedFromCollectionNames() {
        when(mongoTemplate.getCollectionNames()).thenReturn(Set.of(
                "position_history_y2024m06", "entity_positions", MAY, "position_history_y2024m13"));

        assertEquals(List.of(MonthlyPartition.of(YearMonth.of(2024, 5)), MonthlyPartition.of(YearMonth.of(2024, 6))),
                store().partitions());
    }

    @Test
    void testPruneDropsPartitionsBeforeRetention() {
        when(mongoTemplate.getCollectionNames()).thenReturn(Set.of(
                "position_history_y2024m01", "position_history_y2024m02", MAY));

        List<MonthlyPartition> dropped = store().pruneOldPartitions(T, 3);

        assertEquals(List.of(MonthlyPartition.of(YearMonth.of(2024, 1))), dropped);
        verify(mongoTemplate).dropCollection("position_history_y2024m01");
        verify(mongoTemplate, never()).dropCollection(MAY);
    }

    @Test
    void testReadOutageTranslatedToStoreException() {
        when(mongoTemplate.findById("VEHICLE_v1", EntityPositionDocument.class))
                .thenThrow(new DataAccessResourceFailureException("Timed out after 30000 ms while waiting for a server"));

        TrackingStoreException e = assertThrows(TrackingStoreException.class,
                () -> store().latest("v1", EntityType.VEHICLE));
        assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
    }

    @Test
    void testAppendOutageTranslatedToStoreException() {
        when(mongoTemplate.collectionExists(MAY))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(TrackingStoreException.class,
                () -> store().append(PositionSamples.vehicle("v1", 40.0, -75.0, T)));
        verify(mongoTemplate, never()).insert(any(PositionHistoryDocument.class), any(String.class));
    }

    @Test
    void testPartitionListingOutageTranslatedToStoreException() {
        when(mongoTemplate.getCollectionNames()).thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThrows(TrackingStoreException.class, () -> store().partitions());
    }

    @Test
    void testFindNearbyQueriesLatestPositionsWithNearSphere() {
        PositionSample sample = PositionSamples.vehicle("v1", 40.01, -75.0, T);
        when(mongoTemplate.indexOps(EntityPositionDocument.class)).thenReturn(indexOperations);
        when(mongoTemplate.find(any(Query.class), eq(EntityPositionDocument.class)))
                .thenReturn(List.of(EntityPositionDocument.first(sample, T)));

        List<PositionSample> nearby = store().findNearby(40.0, -75.0, 5.0, EntityType.VEHICLE, 10);

        assertEquals(1, nearby.size());
        assertEquals("v1", nearby.get(0).getEntityId());
        verify(indexOperations).ensureIndex(any());
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(EntityPositionDocument.class));
        Document criteria = query.getValue().getQueryObject();
        Document location = (Document) criteria.get("position.location");
        Document nearSphere = (Document) location.get("$nearSphere");
        assertEquals(5000.0, nearSphere.get("$maxDistance"));
        assertEquals(EntityType.VEHICLE, criteria.get("entityType"));
        assertEquals(10, query.getValue().getLimit());
    }

    @Test
    void testFindNearbyWithoutLimitSkipsQuery() {
        assertTrue(store().findNearby(40.0, -75.0, 5.0, null, 0).isEmpty());
        verifyNoInteractions(mongoTemplate);
    }
}
