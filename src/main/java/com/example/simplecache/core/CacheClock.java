package com.example.simplecache.core;

/**
 * Source of the current time used for TTL bookkeeping.
 */
@FunctionalInterface
public interface CacheClock {

    CacheClock SYSTEM = System::currentTimeMillis;

    long currentTimeMillis();
}
