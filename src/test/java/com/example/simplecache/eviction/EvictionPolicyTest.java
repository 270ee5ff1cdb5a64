package com.example.simplecache.eviction;

import com.example.simplecache.core.Cache;
import com.example.simplecache.core.CacheOptions;
import com.example.simplecache.core.CapacityExceededException;
import com.example.simplecache.core.ManualClock;
import com.example.simplecache.core.SimpleCache;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EvictionPolicyTest {

    private final ManualClock clock = new ManualClock(0L);

    private SimpleCache<String, Integer> newCache(EvictionPolicy policy, int capacity, RandomGenerator random) {
        CacheOptions options = CacheOptions.builder()
            .capacity(capacity)
            .evictionPolicy(policy)
            .enableStats(true)
            .build();
        return new SimpleCache<>(options, clock, random);
    }

    private SimpleCache<String, Integer> newCache(EvictionPolicy policy, int capacity) {
        return newCache(policy, capacity, new Well19937c(1L));
    }

    private static List<String> keysOf(Cache<String, ?> cache) {
        List<String> keys = new ArrayList<>();
        cache.keys().forEach(keys::add);
        return keys;
    }

    @Test
    void testLruEvictsLeastRecentlyRead() {
        SimpleCache<String, Integer> cache = newCache(EvictionPolicy.LRU, 2);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.get("a");
        cache.set("c", 3);

        assertTrue(cache.has("a"));
        assertFalse(cache.has("b"));
        assertTrue(cache.has("c"));
        assertEquals(1, cache.getStats().getEvictions());
    }

    @Test
    void testLruOverwriteRefreshesRecency() {
        SimpleCache<String, Integer> cache = newCache(EvictionPolicy.LRU, 2);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("a", 10);
        cache.set("c", 3);

        assertEquals(Optional.of(10), cache.get("a"));
        assertFalse(cache.has("b"));
    }

    @Test
    void testLruHasDoesNotRefreshRecency() {
        SimpleCache<String, Integer> cache = newCache(EvictionPolicy.LRU, 2);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.has("a");
        cache.set("c", 3);

        assertFalse(cache.has("a"));
        assertTrue(cache.has("b"));
    }

    @Test
    void testFifoIgnoresReads() {
        SimpleCache<String, Integer> cache = newCache(EvictionPolicy.FIFO, 2);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.get("a");
        cache.get("a");
        cache.set("c", 3);

        assertFalse(cache.has("a"));
        assertTrue(cache.has("b"));
        assertTrue(cache.has("c"));
    }

    @Test
    void testFifoOverwriteResetsPosition() {
        SimpleCache<String, Integer> cache = newCache(EvictionPolicy.FIFO, 2);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("a", 11);
        cache.set("c", 3);

        assertTrue(cache.has("a"));
        assertFalse(cache.has("b"));
        assertEquals(List.of("a", "c"), keysOf(cache));
    }

    @Test
    void testRandomUsesInjectedGenerator() {
        RandomGenerator random = mock(RandomGenerator.class);
        when(random.nextInt(3)).thenReturn(1);

        SimpleCache<String, Integer> cache = newCache(EvictionPolicy.RANDOM, 2, random);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("c", 3);

        verify(random).nextInt(3);
        assertTrue(cache.has("a"));
        assertFalse(cache.has("b"));
        assertTrue(cache.has("c"));
        assertEquals(1, cache.getStats().getEvictions());
    }

    @Test
    void testRandomIsReproducibleWithSeed() {
        SimpleCache<String, Integer> first = newCache(EvictionPolicy.RANDOM, 5, new Well19937c(99L));
        SimpleCache<String, Integer> second = newCache(EvictionPolicy.RANDOM, 5, new Well19937c(99L));
        for (int i = 0; i < 50; i++) {
            first.set("k" + i, i);
            second.set("k" + i, i);
        }

        assertEquals(keysOf(first), keysOf(second));
        assertEquals(5, first.size());
    }

    @Test
    void testRandomWithSeedFromOptions() {
        CacheOptions options = CacheOptions.builder()
            .capacity(3)
            .evictionPolicy(EvictionPolicy.RANDOM)
            .randomSeed(5L)
            .build();
        SimpleCache<String, Integer> first = new SimpleCache<>(options);
        SimpleCache<String, Integer> second = new SimpleCache<>(options);
        for (int i = 0; i < 20; i++) {
            first.set("k" + i, i);
            second.set("k" + i, i);
        }

        assertEquals(keysOf(first), keysOf(second));
    }

    @Test
    void testNoneRejectsNewKeyWhenFull() {
        SimpleCache<String, Integer> cache = newCache(EvictionPolicy.NONE, 1);
        cache.set("a", 1);

        CapacityExceededException e = assertThrows(CapacityExceededException.class, () -> cache.set("b", 2));

        assertEquals(1, e.getCapacity());
        assertTrue(cache.has("a"));
        assertFalse(cache.has("b"));
        assertEquals(1, cache.size());
        assertEquals(1, cache.getStats().getSets());
        assertEquals(0, cache.getStats().getEvictions());
    }

    @Test
    void testNoneAllowsOverwriteWhenFull() {
        SimpleCache<String, Integer> cache = newCache(EvictionPolicy.NONE, 2);
        cache.set("a", 1);
        cache.set("b", 2);

        assertDoesNotThrow(() -> cache.set("a", 3));
        assertEquals(Optional.of(3), cache.get("a"));
        assertEquals(2, cache.size());
    }

    @Test
    void testNoneAcceptsAgainAfterDelete() {
        SimpleCache<String, Integer> cache = newCache(EvictionPolicy.NONE, 1);
        cache.set("a", 1);
        cache.delete("a");

        cache.set("b", 2);
        assertTrue(cache.has("b"));
    }

    @ParameterizedTest
    @EnumSource(value = EvictionPolicy.class, names = {"LRU", "FIFO", "RANDOM"})
    void testCapacityInvariant(EvictionPolicy policy) {
        SimpleCache<String, Integer> cache = newCache(policy, 3);
        for (int i = 0; i < 100; i++) {
            cache.set("k" + (i % 7), i);
            cache.get("k" + (i % 5));
            assertTrue(cache.size() <= 3, "size exceeded capacity after set #" + i);
        }
    }

    @Test
    void testUnboundedNeverEvicts() {
        SimpleCache<String, Integer> cache = new SimpleCache<>(CacheOptions.builder().enableStats(true).build());
        for (int i = 0; i < 1000; i++) {
            cache.set("k" + i, i);
        }

        assertEquals(1000, cache.size());
        assertEquals(0, cache.getStats().getEvictions());
    }

    @Test
    void testFromName() {
        assertEquals(EvictionPolicy.LRU, EvictionPolicy.fromName("lru"));
        assertEquals(EvictionPolicy.FIFO, EvictionPolicy.fromName(" FIFO "));
        assertEquals(EvictionPolicy.RANDOM, EvictionPolicy.fromName("Random"));
        assertEquals(EvictionPolicy.NONE, EvictionPolicy.fromName("none"));
        assertThrows(IllegalArgumentException.class, () -> EvictionPolicy.fromName("lfu"));
    }

    @Test
    void testCreateStrategy() {
        for (EvictionPolicy policy : EvictionPolicy.values()) {
            EvictionStrategy<String, Integer> strategy = policy.createStrategy(new Well19937c(1L));
            assertEquals(policy, strategy.policy());
            assertEquals(policy != EvictionPolicy.NONE, strategy.permitsEviction());
        }
    }

    @Test
    void testCapacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> CacheOptions.builder().capacity(0));
        assertThrows(IllegalArgumentException.class, () -> CacheOptions.builder().capacity(-3));
    }
}
