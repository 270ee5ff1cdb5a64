package com.example.simplecache.core;

/**
 * Thrown by {@link Cache#set} when the cache is full and its eviction policy
 * does not allow removing entries to make room.
 */
public class CapacityExceededException extends RuntimeException {

    private final int capacity;

    public CapacityExceededException(int capacity) {
        super("Cache capacity reached: " + capacity);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
