package com.example.simplecache.stats;

/**
 * Outcome counters for one cache instance.
 *
 * Recording is a no-op while disabled; counts gathered earlier are kept as they
 * are. Not thread-safe, the owning cache serializes access.
 */
public class CacheStats {

    private boolean enabled;

    private long hits;
    private long misses;
    private long sets;
    private long deletes;
    private long evictions;
    private long expires;

    public CacheStats(boolean enabled) {
        this.enabled = enabled;
    }

    public void recordHit() {
        if (enabled) {
            hits++;
        }
    }

    public void recordMiss() {
        if (enabled) {
            misses++;
        }
    }

    public void recordSet() {
        if (enabled) {
            sets++;
        }
    }

    public void recordDelete() {
        if (enabled) {
            deletes++;
        }
    }

    public void recordEviction() {
        if (enabled) {
            evictions++;
        }
    }

    public void recordExpire() {
        if (enabled) {
            expires++;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void reset() {
        hits = 0;
        misses = 0;
        sets = 0;
        deletes = 0;
        evictions = 0;
        expires = 0;
    }

    public StatsSnapshot snapshot() {
        return new StatsSnapshot(hits, misses, sets, deletes, evictions, expires);
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
