package com.example.simplecache.workload;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Stand-in for a slow origin that the cache fronts during workload runs.
 */
public class MockBackend {

    private final AtomicLong requestCount = new AtomicLong();
    private final long latencyMillis;

    public MockBackend(long latencyMillis) {
        this.latencyMillis = latencyMillis;
    }

    // Simulates a slow backend fetch
    public Object fetch(String key) {
        requestCount.incrementAndGet();
        if (latencyMillis > 0) {
            try {
                Thread.sleep(latencyMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while fetching " + key, e);
            }
        }
        return "value-for-" + key;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public long getLatencyMillis() {
        return latencyMillis;
    }
}
