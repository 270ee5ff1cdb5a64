package com.example.simplecache.config;

import com.example.simplecache.core.CacheOptions;
import com.example.simplecache.eviction.EvictionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

/**
 * Cache settings bound from {@code simplecache.*}.
 */
@Validated
@ConfigurationProperties(prefix = "simplecache")
public class SimpleCacheProperties {

    /**
     * Maximum number of entries. Unset means unbounded.
     */
    @Min(1)
    private Integer capacity;

    /**
     * TTL applied when a write does not give one. Plain numbers are milliseconds.
     */
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration defaultTtl;

    @NotNull
    private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;

    private boolean enableStats;

    /**
     * Seed for random eviction, for reproducible runs.
     */
    private Long randomSeed;

    /**
     * Wrap the cache bean so it can be shared between threads.
     */
    private boolean threadSafe = true;

    @Valid
    private Workload workload = new Workload();

    public CacheOptions toOptions() {
        CacheOptions.Builder builder = CacheOptions.builder()
            .evictionPolicy(evictionPolicy)
            .enableStats(enableStats)
            .randomSeed(randomSeed);
        if (capacity != null) {
            builder.capacity(capacity);
        }
        if (defaultTtl != null) {
            builder.defaultTtlMillis(defaultTtl.toMillis());
        }
        return builder.build();
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    public void setEvictionPolicy(EvictionPolicy evictionPolicy) {
        this.evictionPolicy = evictionPolicy;
    }

    public boolean isEnableStats() {
        return enableStats;
    }

    public void setEnableStats(boolean enableStats) {
        this.enableStats = enableStats;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public boolean isThreadSafe() {
        return threadSafe;
    }

    public void setThreadSafe(boolean threadSafe) {
        this.threadSafe = threadSafe;
    }

    public Workload getWorkload() {
        return workload;
    }

    public void setWorkload(Workload workload) {
        this.workload = workload;
    }

    /**
     * Startup workload replay used to compare eviction policies.
     */
    public static class Workload {

        private boolean enabled;

        @Min(1)
        private int requests = 100_000;

        @Min(1)
        private int universe = 10_000;

        @DecimalMin(value = "0.0", inclusive = false)
        private double alpha = 0.9;

        /**
         * Share of requests for one-off keys outside the Zipf universe.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double scanRatio;

        @Min(1)
        private int threads = 4;

        @Min(0)
        private long backendLatencyMillis;

        private long seed = 42L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getRequests() {
            return requests;
        }

        public void setRequests(int requests) {
            this.requests = requests;
        }

        public int getUniverse() {
            return universe;
        }

        public void setUniverse(int universe) {
            this.universe = universe;
        }

        public double getAlpha() {
            return alpha;
        }

        public void setAlpha(double alpha) {
            this.alpha = alpha;
        }

        public double getScanRatio() {
            return scanRatio;
        }

        public void setScanRatio(double scanRatio) {
            this.scanRatio = scanRatio;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public long getBackendLatencyMillis() {
            return backendLatencyMillis;
        }

        public void setBackendLatencyMillis(long backendLatencyMillis) {
            this.backendLatencyMillis = backendLatencyMillis;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }
    }
}
