package org.javai.netguard.service;

import org.javai.netguard.ClassifiedError;
import org.javai.netguard.NetworkFailureException;
import org.javai.netguard.cache.GeoCache;
import org.javai.netguard.cache.LocationSample;
import org.javai.netguard.config.AdaptiveConfigProvider;
import org.javai.netguard.network.NetworkStatus;
import org.javai.netguard.network.StatusMonitor;
import org.javai.netguard.retry.RetryOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Fetches location-dependent data through the cache, falling back to the remote source
 * under the retry policy for the current network status.
 *
 * <ol>
 *   <li>A fresh cached value is returned without contacting the remote source.</li>
 *   <li>While offline the call fails fast with a non-retryable {@code CONNECTION} error.</li>
 *   <li>Otherwise the remote fetch runs with the adaptive policy and timeout, and a successful
 *       value is cached for the sample.</li>
 * </ol>
 */
public final class GeoFetchService<T> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(GeoFetchService.class);

    private final String operation;
    private final GeoCache<T> cache;
    private final StatusMonitor monitor;
    private final AdaptiveConfigProvider config;
    private final RetryOrchestrator orchestrator;

    private final Object sweepLock = new Object();
    private ScheduledFuture<?> sweep;

    /**
     * @param operation Operation name used when reporting remote failures
     */
    public GeoFetchService(String operation, GeoCache<T> cache, StatusMonitor monitor,
            AdaptiveConfigProvider config, RetryOrchestrator orchestrator) {
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
    }

    public CompletableFuture<T> fetch(LocationSample sample, Supplier<? extends CompletionStage<T>> remote) {
        return fetch(sample, Map.of(), remote);
    }

    /**
     * Returns the value for {@code sample}, from the cache when possible.
     *
     * @param sample the position to fetch for
     * @param params request parameters that are part of the cache key
     * @param remote starts one remote fetch
     */
    public CompletableFuture<T> fetch(LocationSample sample, Map<String, ?> params,
            Supplier<? extends CompletionStage<T>> remote) {
        Objects.requireNonNull(sample, "sample must not be null");
        Optional<T> cached = cache.get(sample.coordinates(), sample.accuracyMeters(), params);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        return refresh(sample, params, remote);
    }

    public CompletableFuture<T> refresh(LocationSample sample, Supplier<? extends CompletionStage<T>> remote) {
        return refresh(sample, Map.of(), remote);
    }

    /**
     * Fetches from the remote source regardless of the cache and caches the result.
     * Cancelling the returned future cancels the remote fetch.
     */
    public CompletableFuture<T> refresh(LocationSample sample, Map<String, ?> params,
            Supplier<? extends CompletionStage<T>> remote) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(remote, "remote must not be null");
        NetworkStatus status = monitor.current();
        if (!status.online()) {
            LOG.debug("Offline, not fetching [{}] for {}", operation, sample.coordinates());
            return CompletableFuture.failedFuture(new NetworkFailureException(
                    ClassifiedError.offline("Device is offline, cannot fetch [" + operation + "]")));
        }
        CompletableFuture<T> fetched = orchestrator.executeWithTimeout(
                operation, remote, config.requestTimeoutFor(status), config.policyFor(status));
        CompletableFuture<T> result = fetched.thenApply(value -> {
            cache.put(sample.coordinates(), sample.accuracyMeters(), value, params);
            return value;
        });
        result.whenComplete((value, failure) -> {
            if (result.isCancelled()) {
                fetched.cancel(true);
            }
        });
        return result;
    }

    /**
     * Periodically removes expired entries on a caller-owned scheduler.
     * Replaces any sweep started earlier.
     */
    public void startSweeping(ScheduledExecutorService scheduler, Duration period) {
        Objects.requireNonNull(scheduler, "scheduler must not be null");
        Objects.requireNonNull(period, "period must not be null");
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive, was: " + period);
        }
        synchronized (sweepLock) {
            stopSweeping();
            long millis = period.toMillis();
            sweep = scheduler.scheduleAtFixedRate(this::sweepOnce, millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    public GeoCache<T> cache() {
        return cache;
    }

    /**
     * Stops sweeping and closes the cache.
     */
    @Override
    public void close() {
        synchronized (sweepLock) {
            stopSweeping();
        }
        cache.close();
    }

    private void stopSweeping() {
        if (sweep != null) {
            sweep.cancel(false);
            sweep = null;
        }
    }

    private void sweepOnce() {
        try {
            cache.sweep();
        } catch (RuntimeException e) {
            // An exception would silently cancel the scheduled task.
            LOG.warn("Sweep of cache [{}] failed", cache.name(), e);
        }
    }
}
