package com.freightoptimization.tracking.push;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by the hub. {@link #unsubscribe()} is idempotent.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();

    static Subscription combine(Subscription... parts) {
        List<Subscription> copy = List.of(parts);
        AtomicBoolean done = new AtomicBoolean();
        return () -> {
            if (done.compareAndSet(false, true)) {
                copy.forEach(Subscription::unsubscribe);
            }
        };
    }
}
