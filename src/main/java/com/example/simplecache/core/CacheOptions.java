package com.example.simplecache.core;

import com.example.simplecache.eviction.EvictionPolicy;
import java.util.Objects;

/**
 * Immutable construction settings for a {@link SimpleCache}.
 */
public final class CacheOptions {

    /** Capacity of a cache with no size bound. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final long NO_DEFAULT_TTL = -1L;

    private final int capacity;
    private final long defaultTtlMillis;
    private final EvictionPolicy evictionPolicy;
    private final boolean statsEnabled;
    private final Long randomSeed;

    private CacheOptions(Builder builder) {
        this.capacity = builder.capacity;
        this.defaultTtlMillis = builder.defaultTtlMillis;
        this.evictionPolicy = builder.evictionPolicy;
        this.statsEnabled = builder.statsEnabled;
        this.randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Unbounded LRU cache, no default TTL, statistics off.
     */
    public static CacheOptions defaults() {
        return builder().build();
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isBounded() {
        return capacity != UNBOUNDED;
    }

    public boolean hasDefaultTtl() {
        return defaultTtlMillis != NO_DEFAULT_TTL;
    }

    /**
     * @return the default TTL in milliseconds; only meaningful when {@link #hasDefaultTtl()}
     */
    public long getDefaultTtlMillis() {
        return defaultTtlMillis;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    public boolean isStatsEnabled() {
        return statsEnabled;
    }

    /**
     * @return seed for the random eviction generator, or null to seed from the environment
     */
    public Long getRandomSeed() {
        return randomSeed;
    }

    @Override
    public String toString() {
        return "CacheOptions{capacity=" + (isBounded() ? String.valueOf(capacity) : "unbounded")
            + ", defaultTtlMillis=" + (hasDefaultTtl() ? String.valueOf(defaultTtlMillis) : "none")
            + ", evictionPolicy=" + evictionPolicy
            + ", statsEnabled=" + statsEnabled + "}";
    }

    public static final class Builder {
        private int capacity = UNBOUNDED;
        private long defaultTtlMillis = NO_DEFAULT_TTL;
        private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
        private boolean statsEnabled;
        private Long randomSeed;

        private Builder() {
        }

        public Builder capacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("Capacity must be positive");
            }
            this.capacity = capacity;
            return this;
        }

        public Builder unbounded() {
            this.capacity = UNBOUNDED;
            return this;
        }

        public Builder defaultTtlMillis(long defaultTtlMillis) {
            if (defaultTtlMillis < 0) {
                throw new IllegalArgumentException("Default TTL cannot be negative");
            }
            this.defaultTtlMillis = defaultTtlMillis;
            return this;
        }

        public Builder noDefaultTtl() {
            this.defaultTtlMillis = NO_DEFAULT_TTL;
            return this;
        }

        public Builder evictionPolicy(EvictionPolicy evictionPolicy) {
            this.evictionPolicy = Objects.requireNonNull(evictionPolicy, "Eviction policy cannot be null");
            return this;
        }

        public Builder enableStats(boolean statsEnabled) {
            this.statsEnabled = statsEnabled;
            return this;
        }

        public Builder randomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public CacheOptions build() {
            return new CacheOptions(this);
        }
    }
}
