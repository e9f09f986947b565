package com.freightoptimization.tracking.push;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Retries exhausted; a new subscription starts over. */
    FAILED
}
