package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.exception.TrackingException;
import com.freightoptimization.tracking.exception.TrackingStoreException;
import com.freightoptimization.tracking.exception.TrackingTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs blocking store reads on the store query pool and gives up on them after a deadline.
 */
@Slf4j
@Component
public class QueryDeadlineExecutor {

    private final Executor executor;
    private final Duration defaultTimeout;

    public QueryDeadlineExecutor(@Qualifier("storeQueryExecutor") Executor executor, TrackingProperties properties) {
        this.executor = executor;
        this.defaultTimeout = properties.getStore().getQueryTimeout();
    }

    public <T> T call(String operation, Supplier<T> query) {
        return call(operation, null, query);
    }

    /**
     * @param timeout deadline for this call; null means {@code tracking.store.query-timeout}
     * @throws TrackingTimeoutException when the deadline passes first
     * @throws TrackingStoreException when the query pool is saturated
     */
    public <T> T call(String operation, Duration timeout, Supplier<T> query) {
        Duration deadline = timeout != null ? timeout : defaultTimeout;
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(query, executor);
        } catch (RejectedExecutionException e) {
            log.warn("{} rejected: store query pool is saturated", operation);
            throw new TrackingStoreException(operation + " rejected: store query pool is saturated", e);
        }
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} exceeded its {} ms deadline", operation, deadline.toMillis());
            throw new TrackingTimeoutException(operation + " did not complete within " + deadline.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TrackingException(operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TrackingException(operation + " was interrupted", e);
        }
    }
}
