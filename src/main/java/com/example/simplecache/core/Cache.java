package com.example.simplecache.core;

import com.example.simplecache.stats.StatsSnapshot;
import java.util.Optional;
import java.util.function.Function;

/**
 * In-process key-value cache with optional per-entry expiry.
 *
 * Expiry is lazy: an entry whose TTL has elapsed stays in the store (and in
 * {@link #size()} and {@link #keys()}) until an operation visits it.
 * TTLs are in milliseconds. Keys and values must not be null.
 */
public interface Cache<K, V> {

    /** {@link #ttl} result for a key that is not stored. */
    long TTL_ABSENT = -2L;

    /** {@link #ttl} result for a key stored without expiry. */
    long TTL_PERSISTENT = -1L;

    /**
     * Stores the value using the configured default TTL, if any.
     * Overwriting an existing key makes it the freshest entry.
     *
     * @throws CapacityExceededException if the cache is full and may not evict
     */
    void set(K key, V value);

    /**
     * Stores the value with an explicit TTL that takes precedence over the default.
     *
     * @throws CapacityExceededException if the cache is full and may not evict
     */
    void set(K key, V value, long ttlMillis);

    Optional<V> get(K key);

    /**
     * Returns the cached value, or loads, stores (with the default TTL) and returns it.
     * Loader exceptions propagate and leave the cache untouched.
     */
    V getOrLoad(K key, Function<? super K, ? extends V> loader);

    /**
     * Presence check. Does not count as a hit or miss and does not refresh recency.
     */
    boolean has(K key);

    /**
     * @return true if a live entry was removed
     */
    boolean delete(K key);

    void clear();

    /**
     * Number of stored entries, including expired ones not yet visited.
     */
    int size();

    /**
     * @return {@link #TTL_ABSENT}, {@link #TTL_PERSISTENT}, or the remaining milliseconds
     */
    long ttl(K key);

    /**
     * Sets a new expiry of now + ttlMillis on an existing entry.
     */
    boolean expire(K key, long ttlMillis);

    /**
     * Removes the expiry of an existing entry.
     */
    boolean persist(K key);

    /**
     * Keys in iteration order, oldest first. Each call starts a fresh pass.
     */
    Iterable<K> keys();

    /**
     * Removes every entry whose TTL has elapsed.
     *
     * @return number of entries removed
     */
    int purgeExpired();

    StatsSnapshot getStats();

    void resetStats();

    void enableStats();

    void disableStats();

    boolean isStatsEnabled();
}
