package com.example.simplecache.eviction;

import com.example.simplecache.core.CacheEntry;
import com.example.simplecache.core.EntryStore;
import java.util.Optional;

/**
 * Policy NONE: never evicts. The cache checks {@link #permitsEviction()} before
 * inserting a new key and rejects the write with a
 * {@link com.example.simplecache.core.CapacityExceededException} when full.
 */
public class RejectingEvictionStrategy<K, V> implements EvictionStrategy<K, V> {

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.NONE;
    }

    @Override
    public void onHit(EntryStore<K, V> store, CacheEntry<K, V> entry) {
        // no-op
    }

    @Override
    public Optional<K> selectVictim(EntryStore<K, V> store) {
        return Optional.empty();
    }

    @Override
    public boolean permitsEviction() {
        return false;
    }
}
