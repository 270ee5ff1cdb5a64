package com.example.simplecache.core;

public class CacheEntry<K, V> {

    /** Expiry value of an entry that never expires. */
    public static final long NO_EXPIRY = Long.MAX_VALUE;

    final K key;
    final V value;
    long expiryTime;   // absolute timestamp in millis, NO_EXPIRY when persistent

    // recency list links, owned by EntryStore
    CacheEntry<K, V> prev;
    CacheEntry<K, V> next;

    public CacheEntry(K key, V value, long expiryTime) {
        this.key = key;
        this.value = value;
        this.expiryTime = expiryTime;
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    public long getExpiryTime() {
        return expiryTime;
    }

    public boolean hasExpiry() {
        return expiryTime != NO_EXPIRY;
    }

    /**
     * An entry is expired once the clock is strictly past its expiry timestamp,
     * so an entry stored with a TTL of zero is still readable in the same millisecond.
     */
    public boolean isExpiredAt(long now) {
        return hasExpiry() && now > expiryTime;
    }

    void setExpiryTime(long expiryTime) {
        this.expiryTime = expiryTime;
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", expiryTime="
            + (hasExpiry() ? String.valueOf(expiryTime) : "never") + "}";
    }
}
