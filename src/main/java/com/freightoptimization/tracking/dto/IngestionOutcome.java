package com.freightoptimization.tracking.dto;

public enum IngestionOutcome {
    ACCEPTED,
    DUPLICATE
}
