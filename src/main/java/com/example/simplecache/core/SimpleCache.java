package com.example.simplecache.core;

import com.example.simplecache.eviction.EvictionStrategy;
import com.example.simplecache.stats.CacheStats;
import com.example.simplecache.stats.StatsSnapshot;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded cache engine.
 *
 * Every operation first resolves lazy expiry for the key it touches; only
 * {@code set} may then run eviction. Not synchronized: wrap in {@link LockingCache}
 * when the instance is shared between threads.
 */
public class SimpleCache<K, V> implements Cache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(SimpleCache.class);

    private final EntryStore<K, V> store;
    private final EvictionStrategy<K, V> evictionStrategy;
    private final CacheStats stats;
    private final CacheClock clock;
    private final CacheOptions options;

    public SimpleCache() {
        this(CacheOptions.defaults());
    }

    public SimpleCache(CacheOptions options) {
        this(options, CacheClock.SYSTEM, defaultRandom(options));
    }

    public SimpleCache(CacheOptions options, CacheClock clock, RandomGenerator random) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.store = new EntryStore<>();
        this.evictionStrategy = options.getEvictionPolicy().createStrategy(random);
        this.stats = new CacheStats(options.isStatsEnabled());
    }

    private static RandomGenerator defaultRandom(CacheOptions options) {
        Objects.requireNonNull(options, "Options cannot be null");
        return options.getRandomSeed() != null ? new Well19937c(options.getRandomSeed()) : new Well19937c();
    }

    @Override
    public void set(K key, V value) {
        long now = clock.currentTimeMillis();
        put(key, value, options.hasDefaultTtl() ? expiryFrom(now, options.getDefaultTtlMillis()) : CacheEntry.NO_EXPIRY);
    }

    @Override
    public void set(K key, V value, long ttlMillis) {
        requireValidTtl(ttlMillis);
        put(key, value, expiryFrom(clock.currentTimeMillis(), ttlMillis));
    }

    private void put(K key, V value, long expiryTime) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");

        boolean overwrite = store.containsKey(key);
        if (!overwrite && !evictionStrategy.permitsEviction() && store.size() >= options.getCapacity()) {
            log.debug("Rejecting key {}: capacity {} reached and policy {} does not evict",
                key, options.getCapacity(), evictionStrategy.policy());
            throw new CapacityExceededException(options.getCapacity());
        }

        // overwrite refreshes recency and FIFO position
        if (overwrite) {
            store.remove(key);
        }
        store.addLast(new CacheEntry<>(key, value, expiryTime));
        stats.recordSet();

        evictIfNeeded();
    }

    private void evictIfNeeded() {
        while (store.size() > options.getCapacity()) {
            Optional<K> victim = evictionStrategy.selectVictim(store);
            if (victim.isEmpty()) {
                return;
            }
            store.remove(victim.get());
            stats.recordEviction();
            log.trace("Evicted key {} under policy {}", victim.get(), evictionStrategy.policy());
        }
    }

    @Override
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "Key cannot be null");

        CacheEntry<K, V> entry = liveEntry(key);
        if (entry == null) {
            stats.recordMiss();
            return Optional.empty();
        }

        evictionStrategy.onHit(store, entry);
        stats.recordHit();
        return Optional.of(entry.getValue());
    }

    @Override
    public V getOrLoad(K key, Function<? super K, ? extends V> loader) {
        Objects.requireNonNull(loader, "Loader cannot be null");

        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        V loaded = Objects.requireNonNull(loader.apply(key), "Loader returned null for key " + key);
        set(key, loaded);
        return loaded;
    }

    @Override
    public boolean has(K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return liveEntry(key) != null;
    }

    @Override
    public boolean delete(K key) {
        Objects.requireNonNull(key, "Key cannot be null");

        if (liveEntry(key) == null) {
            return false;
        }
        store.remove(key);
        stats.recordDelete();
        return true;
    }

    @Override
    public void clear() {
        store.clear();
        if (stats.isEnabled()) {
            stats.reset();
        }
    }

    @Override
    public int size() {
        return store.size();
    }

    @Override
    public long ttl(K key) {
        Objects.requireNonNull(key, "Key cannot be null");

        long now = clock.currentTimeMillis();
        CacheEntry<K, V> entry = liveEntry(key, now);
        if (entry == null) {
            return TTL_ABSENT;
        }
        if (!entry.hasExpiry()) {
            return TTL_PERSISTENT;
        }
        return Math.max(0L, entry.getExpiryTime() - now);
    }

    @Override
    public boolean expire(K key, long ttlMillis) {
        Objects.requireNonNull(key, "Key cannot be null");
        requireValidTtl(ttlMillis);

        long now = clock.currentTimeMillis();
        CacheEntry<K, V> entry = liveEntry(key, now);
        if (entry == null) {
            return false;
        }
        entry.setExpiryTime(expiryFrom(now, ttlMillis));
        return true;
    }

    @Override
    public boolean persist(K key) {
        Objects.requireNonNull(key, "Key cannot be null");

        CacheEntry<K, V> entry = liveEntry(key);
        if (entry == null) {
            return false;
        }
        entry.setExpiryTime(CacheEntry.NO_EXPIRY);
        return true;
    }

    @Override
    public Iterable<K> keys() {
        return store.keys();
    }

    @Override
    public int purgeExpired() {
        long now = clock.currentTimeMillis();
        int removed = 0;
        Iterator<CacheEntry<K, V>> it = store.entryIterator();
        while (it.hasNext()) {
            if (it.next().isExpiredAt(now)) {
                it.remove();
                stats.recordExpire();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired entries", removed);
        }
        return removed;
    }

    @Override
    public StatsSnapshot getStats() {
        return stats.snapshot();
    }

    @Override
    public void resetStats() {
        stats.reset();
    }

    @Override
    public void enableStats() {
        stats.setEnabled(true);
    }

    @Override
    public void disableStats() {
        stats.setEnabled(false);
    }

    @Override
    public boolean isStatsEnabled() {
        return stats.isEnabled();
    }

    public CacheOptions getOptions() {
        return options;
    }

    private CacheEntry<K, V> liveEntry(K key) {
        return liveEntry(key, clock.currentTimeMillis());
    }

    /**
     * Looks the key up, dropping the entry and counting an expiry if its TTL has elapsed.
     */
    private CacheEntry<K, V> liveEntry(K key, long now) {
        CacheEntry<K, V> entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpiredAt(now)) {
            store.remove(key);
            stats.recordExpire();
            return null;
        }
        return entry;
    }

    private static void requireValidTtl(long ttlMillis) {
        if (ttlMillis < 0) {
            throw new IllegalArgumentException("TTL cannot be negative: " + ttlMillis);
        }
    }

    // saturates instead of overflowing into the past
    private static long expiryFrom(long now, long ttlMillis) {
        long expiry = now + ttlMillis;
        if (((now ^ expiry) & (ttlMillis ^ expiry)) < 0 || expiry == CacheEntry.NO_EXPIRY) {
            return CacheEntry.NO_EXPIRY - 1;
        }
        return expiry;
    }

    @Override
    public String toString() {
        return String.format("SimpleCache{entries=%d, policy=%s, capacity=%s, stats=%s}",
            store.size(), evictionStrategy.policy(),
            options.isBounded() ? String.valueOf(options.getCapacity()) : "unbounded",
            stats.isEnabled() ? "on" : "off");
    }
}
