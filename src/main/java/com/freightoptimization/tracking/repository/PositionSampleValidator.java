package com.freightoptimization.tracking.repository;

import com.freightoptimization.tracking.exception.PositionValidationException;
import com.freightoptimization.tracking.geo.GeoUtils;
import com.freightoptimization.tracking.model.PositionSample;

import java.util.ArrayList;
import java.util.List;

/**
 * Range checks applied to every sample before it reaches a partition.
 */
public final class PositionSampleValidator {

    private PositionSampleValidator() {
    }

    public static void validate(PositionSample sample) {
        if (sample == null) {
            throw new PositionValidationException("sample is required");
        }
        List<String> violations = new ArrayList<>();

        if (sample.getEntityId() == null || sample.getEntityId().isBlank()) {
            violations.add("entityId is required");
        }
        if (sample.getEntityType() == null) {
            violations.add("entityType is required");
        }
        if (sample.getLatitude() == null) {
            violations.add("latitude is required");
        } else if (!GeoUtils.isValidLatitude(sample.getLatitude())) {
            violations.add("latitude must be within [-90, 90], was " + sample.getLatitude());
        }
        if (sample.getLongitude() == null) {
            violations.add("longitude is required");
        } else if (!GeoUtils.isValidLongitude(sample.getLongitude())) {
            violations.add("longitude must be within [-180, 180], was " + sample.getLongitude());
        }
        Double heading = sample.getHeading();
        if (heading != null && (!Double.isFinite(heading) || heading < 0 || heading >= 360)) {
            violations.add("heading must be within [0, 360), was " + heading);
        }
        Double speed = sample.getSpeed();
        if (speed != null && (!Double.isFinite(speed) || speed < 0)) {
            violations.add("speed must be >= 0, was " + speed);
        }
        Double accuracy = sample.getAccuracy();
        if (accuracy != null && (!Double.isFinite(accuracy) || accuracy < 0)) {
            violations.add("accuracy must be >= 0, was " + accuracy);
        }
        if (sample.getSource() == null) {
            violations.add("source is required");
        }
        if (sample.getRecordedAt() == null) {
            violations.add("recordedAt is required");
        }
        if (sample.getCreatedAt() == null) {
            violations.add("createdAt is required");
        }
        if (sample.getRecordedAt() != null && sample.getCreatedAt() != null
                && sample.getRecordedAt().isAfter(sample.getCreatedAt())) {
            violations.add("recordedAt must not be after createdAt");
        }

        if (!violations.isEmpty()) {
            throw new PositionValidationException(violations);
        }
    }
}
