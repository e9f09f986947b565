package com.freightoptimization.tracking.push;

/**
 * A single duplex text connection to the upstream tracking feed. Implementations report
 * everything asynchronously through the {@link Listener} passed to {@link #connect}.
 */
public interface PushTransport {

    /** Starts a connection attempt; completion or failure is reported to {@code listener}. */
    void connect(Listener listener);

    /**
     * @throws com.freightoptimization.tracking.exception.TrackingConnectionException when not connected
     */
    void send(String text);

    void close();

    interface Listener {
        void onOpen();

        void onMessage(String text);

        void onClose(int code, String reason);

        void onError(Throwable error);
    }
}
