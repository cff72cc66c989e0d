package com.zzf.agentdock.cache;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 按 key 分片的锁表，锁懒创建，查表不持有被保护的锁。
 */
public final class KeyedLocks<K> {
    private final ConcurrentMap<K, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(K key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    public <T> T withLock(K key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(K key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public int size() {
        return locks.size();
    }
}
