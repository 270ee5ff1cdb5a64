package com.example.simplecache.eviction;

import java.util.Locale;
import java.util.Objects;
import org.apache.commons.math3.random.RandomGenerator;

public enum EvictionPolicy {
    LRU,
    FIFO,
    RANDOM,
    NONE;

    /**
     * Case-insensitive lookup, accepting the lower-case names used in configuration.
     */
    public static EvictionPolicy fromName(String name) {
        Objects.requireNonNull(name, "Eviction policy name cannot be null");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown eviction policy: " + name, e);
        }
    }

    /**
     * @param random source for {@link #RANDOM} victim selection, ignored by the other policies
     */
    public <K, V> EvictionStrategy<K, V> createStrategy(RandomGenerator random) {
        switch (this) {
            case LRU:
                return new LruEvictionStrategy<>();
            case FIFO:
                return new FifoEvictionStrategy<>();
            case RANDOM:
                return new RandomEvictionStrategy<>(Objects.requireNonNull(random, "Random generator cannot be null"));
            case NONE:
                return new RejectingEvictionStrategy<>();
            default:
                throw new IllegalStateException("Unhandled eviction policy: " + this);
        }
    }
}
