package com.example.simplecache.eviction;

import com.example.simplecache.core.CacheEntry;
import com.example.simplecache.core.EntryStore;
import java.util.Optional;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Evicts a uniformly chosen entry. Pass a seeded generator for reproducible runs.
 */
public class RandomEvictionStrategy<K, V> implements EvictionStrategy<K, V> {

    private final RandomGenerator random;

    public RandomEvictionStrategy(RandomGenerator random) {
        this.random = random;
    }

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.RANDOM;
    }

    @Override
    public void onHit(EntryStore<K, V> store, CacheEntry<K, V> entry) {
        // no-op
    }

    @Override
    public Optional<K> selectVictim(EntryStore<K, V> store) {
        int size = store.size();
        if (size == 0) {
            return Optional.empty();
        }
        return Optional.of(store.keyAt(random.nextInt(size)));
    }
}
