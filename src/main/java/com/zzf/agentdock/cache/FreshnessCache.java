package com.zzf.agentdock.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Short-lived memo with per-key serialization of recomputation.
 * <p>
 * A memo younger than the validity window is returned without locking. Otherwise the caller takes the
 * key's lock, re-checks, and only then computes. Callers racing on the same key block and reuse the
 * winner's result; different keys never wait on each other. Failed computations are not memoized.
 */
public final class FreshnessCache<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(FreshnessCache.class);

    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final KeyedLocks<K> locks = new KeyedLocks<>();
    private final long validityNanos;
    private final LongSupplier nanoClock;

    public FreshnessCache(Duration validity) {
        this(validity, System::nanoTime);
    }

    public FreshnessCache(Duration validity, LongSupplier nanoClock) {
        this.validityNanos = validity.toNanos();
        this.nanoClock = nanoClock;
    }

    public V getOrCompute(K key, Supplier<V> compute) {
        Entry<V> cached = fresh(key);
        if (cached != null) {
            return cached.value;
        }
        ReentrantLock lock = locks.lockFor(key);
        lock.lock();
        try {
            cached = fresh(key);
            if (cached != null) {
                return cached.value;
            }
            V value = compute.get();
            entries.put(key, new Entry<>(value, nanoClock.getAsLong()));
            return value;
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(K key) {
        if (entries.remove(key) != null) {
            logger.debug("cache.invalidate key={}", key);
        }
    }

    public void clear() {
        entries.clear();
    }

    private Entry<V> fresh(K key) {
        Entry<V> e = entries.get(key);
        if (e == null) {
            return null;
        }
        return nanoClock.getAsLong() - e.storedAt < validityNanos ? e : null;
    }

    private static final class Entry<V> {
        private final V value;
        private final long storedAt;

        private Entry(V value, long storedAt) {
            this.value = value;
            this.storedAt = storedAt;
        }
    }
}
