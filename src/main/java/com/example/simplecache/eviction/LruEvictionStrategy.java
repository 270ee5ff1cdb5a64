package com.example.simplecache.eviction;

import com.example.simplecache.core.CacheEntry;
import com.example.simplecache.core.EntryStore;

/**
 * Least-recently-used eviction. Victim selection is the same as FIFO (head of the
 * store), but every hit moves the entry to the tail, so the head is always the
 * entry that was neither read nor written for the longest time.
 */
public class LruEvictionStrategy<K, V> extends FifoEvictionStrategy<K, V> {

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.LRU;
    }

    @Override
    public void onHit(EntryStore<K, V> store, CacheEntry<K, V> entry) {
        store.moveToEnd(entry);
    }
}
