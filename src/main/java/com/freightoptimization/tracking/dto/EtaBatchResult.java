package com.freightoptimization.tracking.dto;

import lombok.Value;

/**
 * One item of a batch estimate. Exactly one of {@code estimate} and {@code error} is set.
 */
@Value
public class EtaBatchResult {
    String entityId;
    /** Position of the destination in the request, or null for a multi-entity batch. */
    Integer destinationIndex;
    EtaEstimate estimate;
    String error;

    public static EtaBatchResult success(String entityId, Integer destinationIndex, EtaEstimate estimate) {
        return new EtaBatchResult(entityId, destinationIndex, estimate, null);
    }

    public static EtaBatchResult failure(String entityId, Integer destinationIndex, String error) {
        return new EtaBatchResult(entityId, destinationIndex, null, error);
    }

    public boolean isSuccess() {
        return estimate != null;
    }
}
