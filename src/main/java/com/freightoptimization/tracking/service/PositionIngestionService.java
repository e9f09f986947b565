package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.cache.EtaCache;
import com.freightoptimization.tracking.cache.PositionCache;
import com.freightoptimization.tracking.dto.BatchIngestResponse;
import com.freightoptimization.tracking.dto.IngestionOutcome;
import com.freightoptimization.tracking.exception.PositionConflictException;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.repository.PositionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Write path for position reports: validate, append, warm the current-position cache, broadcast.
 * A sample that becomes the entity's latest also drops its cached ETAs and runs geofence detection.
 */
@Slf4j
@Service
public class PositionIngestionService {

    private final PositionStore positionStore;
    private final PositionCache positionCache;
    private final EtaCache etaCache;
    private final PositionUpdatePublisher publisher;
    private final GeofenceService geofenceService;
    private final Clock clock;

    public PositionIngestionService(PositionStore positionStore, PositionCache positionCache, EtaCache etaCache,
                                    PositionUpdatePublisher publisher, GeofenceService geofenceService, Clock clock) {
        this.positionStore = positionStore;
        this.positionCache = positionCache;
        this.etaCache = etaCache;
        this.publisher = publisher;
        this.geofenceService = geofenceService;
        this.clock = clock;
    }

    /**
     * A duplicate under the uniqueness constraint is logged and reported as
     * {@link IngestionOutcome#DUPLICATE}; nothing else changes.
     *
     * @throws PositionValidationException when the sample is malformed
     */
    public IngestionOutcome recordPosition(PositionSample sample) {
        if (sample == null) {
            throw new PositionValidationException("position sample is required");
        }
        PositionSample stamped = sample.getCreatedAt() == null
                ? sample.toBuilder().createdAt(clock.instant()).build()
                : sample;
        try {
            positionStore.append(stamped);
        } catch (PositionConflictException e) {
            log.warn("Ignoring duplicate position: {}", e.getMessage());
            return IngestionOutcome.DUPLICATE;
        }

        Optional<PositionSample> cached = positionCache.get(stamped.getEntityId(), stamped.getEntityType());
        if (cached.isEmpty() || !stamped.getRecordedAt().isBefore(cached.get().getRecordedAt())) {
            positionCache.put(stamped);
            etaCache.invalidate(stamped.getEntityId(), stamped.getEntityType());
            publisher.publishPosition(stamped);
            detectGeofenceEvents(stamped);
        }
        log.debug("Recorded position for {} at {}", stamped.key(), stamped.getRecordedAt());
        return IngestionOutcome.ACCEPTED;
    }

    /**
     * The sample is already stored, so a detection failure is logged rather than failing the write.
     */
    private void detectGeofenceEvents(PositionSample sample) {
        try {
            geofenceService.processPositionUpdate(sample);
        } catch (RuntimeException e) {
            log.warn("Geofence detection failed for {}: {}", sample.key(), e.getMessage());
        }
    }

    /**
     * Records each sample independently; one bad sample does not stop the batch.
     */
    public BatchIngestResponse recordPositions(List<PositionSample> samples) {
        int accepted = 0;
        int duplicates = 0;
        List<BatchIngestResponse.RejectionDetail> rejections = new ArrayList<>();
        for (int i = 0; i < samples.size(); i++) {
            PositionSample sample = samples.get(i);
            try {
                if (recordPosition(sample) == IngestionOutcome.ACCEPTED) {
                    accepted++;
                } else {
                    duplicates++;
                }
            } catch (PositionValidationException e) {
                rejections.add(new BatchIngestResponse.RejectionDetail(
                        i, sample != null ? sample.getEntityId() : null, e.getMessage()));
            }
        }
        if (!rejections.isEmpty()) {
            log.warn("Rejected {} of {} positions in batch", rejections.size(), samples.size());
        }
        return BatchIngestResponse.builder()
                .accepted(accepted)
                .duplicates(duplicates)
                .rejected(rejections.size())
                .rejections(rejections)
                .build();
    }
}
