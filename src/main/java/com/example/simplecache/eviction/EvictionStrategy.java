package com.example.simplecache.eviction;

import com.example.simplecache.core.CacheEntry;
import com.example.simplecache.core.EntryStore;
import java.util.Optional;

public interface EvictionStrategy<K, V> {

    EvictionPolicy policy();

    /**
     * Called after a successful read of a live entry.
     */
    void onHit(EntryStore<K, V> store, CacheEntry<K, V> entry);

    /**
     * Picks the key to remove from an over-capacity store. The caller removes it.
     */
    Optional<K> selectVictim(EntryStore<K, V> store);

    /**
     * False for strategies that reject inserts into a full cache instead of evicting.
     */
    default boolean permitsEviction() {
        return true;
    }
}
