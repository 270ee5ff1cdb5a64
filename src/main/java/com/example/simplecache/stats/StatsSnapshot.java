package com.example.simplecache.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;

/**
 * Point-in-time copy of the cache counters. Rates are percentages rounded to two
 * decimals and are 0 when there have been no requests.
 */
public final class StatsSnapshot {

    private final long hits;
    private final long misses;
    private final long sets;
    private final long deletes;
    private final long evictions;
    private final long expires;

    public StatsSnapshot(long hits, long misses, long sets, long deletes, long evictions, long expires) {
        this.hits = hits;
        this.misses = misses;
        this.sets = sets;
        this.deletes = deletes;
        this.evictions = evictions;
        this.expires = expires;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getSets() {
        return sets;
    }

    public long getDeletes() {
        return deletes;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getExpires() {
        return expires;
    }

    public long getTotalRequests() {
        return hits + misses;
    }

    public double getHitRate() {
        return percentage(hits);
    }

    public double getMissRate() {
        return percentage(misses);
    }

    private double percentage(long count) {
        long total = getTotalRequests();
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(count)
            .multiply(BigDecimal.valueOf(100))
            .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
            .doubleValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StatsSnapshot that = (StatsSnapshot) o;
        return hits == that.hits && misses == that.misses && sets == that.sets
            && deletes == that.deletes && evictions == that.evictions && expires == that.expires;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hits, misses, sets, deletes, evictions, expires);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "StatsSnapshot{hits=%d, misses=%d, sets=%d, deletes=%d, evictions=%d, expires=%d, "
                + "totalRequests=%d, hitRate=%.2f, missRate=%.2f}",
            hits, misses, sets, deletes, evictions, expires, getTotalRequests(), getHitRate(), getMissRate());
    }
}
