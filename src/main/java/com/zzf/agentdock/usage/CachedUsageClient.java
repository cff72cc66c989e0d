package com.zzf.agentdock.usage;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wraps a {@link UsageSource} with a bounded wait and a last-known value, so a hung source only
 * costs the caller the timeout. One worker thread runs the source; while a fetch is still running, later
 * callers wait on that same fetch instead of starting another, and a fetch that finishes late still updates
 * the last-known value.
 */
@Slf4j
public class CachedUsageClient implements AutoCloseable {
    private final UsageSource source;
    private final long timeoutMs;
    private final ExecutorService executor;
    private final AtomicReference<UsageSnapshot> lastKnown = new AtomicReference<>();
    private Future<UsageSnapshot> inFlight;

    public CachedUsageClient(UsageSource source, Duration timeout) {
        this.source = source;
        this.timeoutMs = timeout.toMillis();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agentdock-usage-" + source.name());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Fresh usage when the source answers in time, otherwise the last value that did.
     */
    public Optional<UsageSnapshot> fetchUsage() {
        Future<UsageSnapshot> future = currentFetch();
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("usage.fetch timeout source={} timeoutMs={} stillRunning=true", source.name(), timeoutMs);
        } catch (ExecutionException e) {
            log.warn("usage.fetch failed source={} err={}", source.name(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return Optional.ofNullable(lastKnown.get());
    }

    private synchronized Future<UsageSnapshot> currentFetch() {
        if (inFlight == null || inFlight.isDone()) {
            inFlight = executor.submit(() -> {
                UsageSnapshot snapshot = source.fetchUsage();
                if (snapshot != null) {
                    lastKnown.set(snapshot);
                }
                return snapshot;
            });
        }
        return inFlight;
    }

    public Optional<UsageSnapshot> lastKnown() {
        return Optional.ofNullable(lastKnown.get());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
