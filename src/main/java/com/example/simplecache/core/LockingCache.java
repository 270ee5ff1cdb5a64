package com.example.simplecache.core;

import com.example.simplecache.stats.StatsSnapshot;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Serializes every call to a delegate cache behind one lock, so compound
 * check-then-act sequences inside the delegate stay atomic across threads.
 *
 * {@link #keys()} returns a copy taken under the lock. {@link #getOrLoad} holds the
 * lock while the loader runs; concurrent loads of the same key call it once.
 */
public class LockingCache<K, V> implements Cache<K, V> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Cache<K, V> delegate;

    public LockingCache(Cache<K, V> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate cannot be null");
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void lockedRun(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(K key, V value) {
        lockedRun(() -> delegate.set(key, value));
    }

    @Override
    public void set(K key, V value, long ttlMillis) {
        lockedRun(() -> delegate.set(key, value, ttlMillis));
    }

    @Override
    public Optional<V> get(K key) {
        return locked(() -> delegate.get(key));
    }

    @Override
    public V getOrLoad(K key, Function<? super K, ? extends V> loader) {
        return locked(() -> delegate.getOrLoad(key, loader));
    }

    @Override
    public boolean has(K key) {
        return locked(() -> delegate.has(key));
    }

    @Override
    public boolean delete(K key) {
        return locked(() -> delegate.delete(key));
    }

    @Override
    public void clear() {
        lockedRun(delegate::clear);
    }

    @Override
    public int size() {
        return locked(delegate::size);
    }

    @Override
    public long ttl(K key) {
        return locked(() -> delegate.ttl(key));
    }

    @Override
    public boolean expire(K key, long ttlMillis) {
        return locked(() -> delegate.expire(key, ttlMillis));
    }

    @Override
    public boolean persist(K key) {
        return locked(() -> delegate.persist(key));
    }

    @Override
    public Iterable<K> keys() {
        return locked(() -> {
            List<K> copy = new ArrayList<>();
            delegate.keys().forEach(copy::add);
            return Collections.unmodifiableList(copy);
        });
    }

    @Override
    public int purgeExpired() {
        return locked(delegate::purgeExpired);
    }

    @Override
    public StatsSnapshot getStats() {
        return locked(delegate::getStats);
    }

    @Override
    public void resetStats() {
        lockedRun(delegate::resetStats);
    }

    @Override
    public void enableStats() {
        lockedRun(delegate::enableStats);
    }

    @Override
    public void disableStats() {
        lockedRun(delegate::disableStats);
    }

    @Override
    public boolean isStatsEnabled() {
        return locked(delegate::isStatsEnabled);
    }

    @Override
    public String toString() {
        return "LockingCache{" + delegate + "}";
    }
}
