package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.geo.GeoUtils;
import com.freightoptimization.tracking.geo.PolylineSimplifier;
import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.model.Trajectory;
import com.freightoptimization.tracking.repository.PositionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds simplified travel paths from the raw position history.
 */
@Slf4j
@Service
public class TrajectoryEngine {

    public static final double DEFAULT_TOLERANCE = 0.0001;

    private final PositionStore positionStore;
    private final int pageSize;

    public TrajectoryEngine(PositionStore positionStore, TrackingProperties properties) {
        this.positionStore = positionStore;
        this.pageSize = properties.getStore().getTrajectoryPageSize();
    }

    /**
     * Reads every sample in {@code [start, end]} and simplifies the path with Douglas-Peucker over
     * (longitude, latitude) in degrees. First and last samples are always kept.
     *
     * @throws PositionValidationException for a negative or NaN tolerance, or a missing bound
     * @throws com.freightoptimization.tracking.exception.EntityNotFoundException for an unknown entity
     */
    public Trajectory buildTrajectory(String entityId, EntityType entityType, Instant start, Instant end, double tolerance) {
        if (Double.isNaN(tolerance) || tolerance < 0) {
            throw new PositionValidationException("tolerance must be a non-negative number, got " + tolerance);
        }
        if (start == null || end == null) {
            throw new PositionValidationException("start and end are required");
        }

        List<PositionSample> raw = new ArrayList<>();
        int offset = 0;
        while (true) {
            List<PositionSample> page = positionStore.queryRange(entityId, entityType, start, end, pageSize, offset);
            raw.addAll(page);
            if (page.size() < pageSize) {
                break;
            }
            offset += page.size();
        }

        if (raw.isEmpty()) {
            return Trajectory.empty(entityId, entityType, start, end, tolerance);
        }

        List<PositionSample> simplified = PolylineSimplifier.simplify(
                raw, PositionSample::getLongitude, PositionSample::getLatitude, tolerance);
        log.debug("Trajectory for {}_{}: {} raw -> {} points", entityType, entityId, raw.size(), simplified.size());

        return Trajectory.builder()
                .entityId(entityId)
                .entityType(entityType)
                .start(start)
                .end(end)
                .tolerance(tolerance)
                .rawPointCount(raw.size())
                .distanceKm(GeoUtils.pathLengthKm(raw))
                .points(List.copyOf(simplified))
                .build();
    }
}
