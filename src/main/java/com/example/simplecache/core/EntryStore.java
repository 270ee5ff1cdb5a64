package com.example.simplecache.core;

import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Key to entry mapping that remembers insertion order.
 *
 * Entries are kept in a doubly linked list from oldest (head) to freshest (tail)
 * next to a hash index, so appending, moving an entry to the tail and removing the
 * head are all O(1). The list order is what LRU and FIFO eviction pick victims from.
 *
 * Not thread-safe.
 */
public class EntryStore<K, V> {

    // Key -> entry for O(1) access
    private final Map<K, CacheEntry<K, V>> index = new HashMap<>();

    private CacheEntry<K, V> head;
    private CacheEntry<K, V> tail;

    // bumped on every structural change, checked by key iterators
    private int modCount;

    public CacheEntry<K, V> get(K key) {
        return index.get(key);
    }

    public boolean containsKey(K key) {
        return index.containsKey(key);
    }

    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    /**
     * Appends a new entry at the tail. The key must not already be present.
     */
    public void addLast(CacheEntry<K, V> entry) {
        CacheEntry<K, V> previous = index.putIfAbsent(entry.key, entry);
        if (previous != null) {
            throw new IllegalStateException("Key already stored: " + entry.key);
        }
        linkLast(entry);
        modCount++;
    }

    /**
     * Marks the entry as the freshest one.
     */
    public void moveToEnd(CacheEntry<K, V> entry) {
        if (entry == tail) {
            return;
        }
        unlink(entry);
        linkLast(entry);
        modCount++;
    }

    public CacheEntry<K, V> remove(K key) {
        CacheEntry<K, V> entry = index.remove(key);
        if (entry != null) {
            unlink(entry);
            modCount++;
        }
        return entry;
    }

    /**
     * Oldest entry in list order, or null when empty.
     */
    public CacheEntry<K, V> first() {
        return head;
    }

    /**
     * Key at the given position in list order. Walks the list, O(n).
     */
    public K keyAt(int position) {
        if (position < 0 || position >= index.size()) {
            throw new IndexOutOfBoundsException("Position " + position + " outside store of size " + index.size());
        }
        CacheEntry<K, V> node = head;
        for (int i = 0; i < position; i++) {
            node = node.next;
        }
        return node.key;
    }

    public void clear() {
        // drop the links so detached entries do not keep each other reachable
        CacheEntry<K, V> node = head;
        while (node != null) {
            CacheEntry<K, V> next = node.next;
            node.prev = null;
            node.next = null;
            node = next;
        }
        index.clear();
        head = tail = null;
        modCount++;
    }

    /**
     * Live view of the keys from oldest to freshest. Every call to
     * {@link Iterable#iterator()} starts again at the head; iterators fail fast
     * if the store is structurally modified while they are in use.
     */
    public Iterable<K> keys() {
        return KeyIterator::new;
    }

    /**
     * Iterates entries from oldest to freshest. Removing the entry just returned
     * through {@link Iterator#remove()} is supported.
     */
    public Iterator<CacheEntry<K, V>> entryIterator() {
        return new EntryIterator();
    }

    // --- Doubly linked list operations ---

    private void linkLast(CacheEntry<K, V> entry) {
        entry.next = null;
        entry.prev = tail;
        if (tail == null) {
            head = entry;
        } else {
            tail.next = entry;
        }
        tail = entry;
    }

    private void unlink(CacheEntry<K, V> entry) {
        if (entry.prev != null) {
            entry.prev.next = entry.next;
        } else {
            head = entry.next;
        }

        if (entry.next != null) {
            entry.next.prev = entry.prev;
        } else {
            tail = entry.prev;
        }
        entry.prev = null;
        entry.next = null;
    }

    private class EntryIterator implements Iterator<CacheEntry<K, V>> {
        private CacheEntry<K, V> nextEntry = head;
        private CacheEntry<K, V> lastReturned;
        private int expectedModCount = modCount;

        @Override
        public boolean hasNext() {
            return nextEntry != null;
        }

        @Override
        public CacheEntry<K, V> next() {
            checkForComodification();
            if (nextEntry == null) {
                throw new NoSuchElementException();
            }
            lastReturned = nextEntry;
            nextEntry = nextEntry.next;
            return lastReturned;
        }

        @Override
        public void remove() {
            if (lastReturned == null) {
                throw new IllegalStateException();
            }
            checkForComodification();
            EntryStore.this.remove(lastReturned.key);
            lastReturned = null;
            expectedModCount = modCount;
        }

        final void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }

    private final class KeyIterator implements Iterator<K> {
        private final EntryIterator entries = new EntryIterator();

        @Override
        public boolean hasNext() {
            return entries.hasNext();
        }

        @Override
        public K next() {
            return entries.next().key;
        }
    }
}
