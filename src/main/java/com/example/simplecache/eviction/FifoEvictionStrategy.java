package com.example.simplecache.eviction;

import com.example.simplecache.core.CacheEntry;
import com.example.simplecache.core.EntryStore;
import java.util.Optional;

/**
 * Evicts the oldest inserted entry. Reads never change the order, only
 * (re)insertion does.
 */
public class FifoEvictionStrategy<K, V> implements EvictionStrategy<K, V> {

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.FIFO;
    }

    @Override
    public void onHit(EntryStore<K, V> store, CacheEntry<K, V> entry) {
        // no-op
    }

    @Override
    public Optional<K> selectVictim(EntryStore<K, V> store) {
        CacheEntry<K, V> oldest = store.first();
        return oldest == null ? Optional.empty() : Optional.of(oldest.getKey());
    }
}
