package com.example.simplecache.workload;

import com.example.simplecache.config.SimpleCacheProperties;
import com.example.simplecache.core.CacheOptions;
import com.example.simplecache.core.LockingCache;
import com.example.simplecache.core.SimpleCache;
import com.example.simplecache.eviction.EvictionPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkloadSimulatorTest {

    private static SimpleCacheProperties.Workload settings(int requests, int threads, double scanRatio) {
        SimpleCacheProperties.Workload workload = new SimpleCacheProperties.Workload();
        workload.setRequests(requests);
        workload.setUniverse(100);
        workload.setAlpha(1.0);
        workload.setThreads(threads);
        workload.setScanRatio(scanRatio);
        workload.setSeed(3L);
        return workload;
    }

    private static LockingCache<String, Object> cache(EvictionPolicy policy, int capacity) {
        return new LockingCache<>(new SimpleCache<>(CacheOptions.builder()
            .capacity(capacity)
            .evictionPolicy(policy)
            .enableStats(true)
            .randomSeed(1L)
            .build()));
    }

    @Test
    void testEveryMissHitsBackendOnce() throws Exception {
        LockingCache<String, Object> cache = cache(EvictionPolicy.LRU, 20);
        MockBackend backend = new MockBackend(0);

        WorkloadReport report = new WorkloadSimulator(settings(1_000, 1, 0.0)).run(cache, backend);

        assertEquals(1_000, report.getRequests());
        assertEquals(1_000, report.getStats().getTotalRequests());
        assertEquals(report.getStats().getMisses(), report.getBackendRequests());
        assertEquals(report.getStats().getMisses(), report.getStats().getSets());
        assertTrue(report.getStats().getHits() > 0);
        assertTrue(report.getFinalSize() <= 20);
        assertTrue(report.getP99Millis() >= report.getP50Millis());
    }

    @Test
    void testUnboundedCacheLoadsEachKeyOnce() throws Exception {
        LockingCache<String, Object> cache = new LockingCache<>(new SimpleCache<>(CacheOptions.builder()
            .enableStats(true).build()));
        MockBackend backend = new MockBackend(0);

        WorkloadReport report = new WorkloadSimulator(settings(2_000, 4, 0.0)).run(cache, backend);

        assertEquals(2_000, report.getRequests());
        // nothing is ever evicted, so every key is fetched exactly once
        assertEquals(report.getFinalSize(), report.getBackendRequests());
        assertEquals(0, report.getStats().getEvictions());
    }

    @Test
    void testScanKeysAreAlwaysMisses() throws Exception {
        LockingCache<String, Object> cache = cache(EvictionPolicy.FIFO, 10);
        MockBackend backend = new MockBackend(0);

        WorkloadReport report = new WorkloadSimulator(settings(500, 2, 1.0)).run(cache, backend);

        assertEquals(0, report.getStats().getHits());
        assertEquals(500, report.getBackendRequests());
        assertEquals(490, report.getStats().getEvictions());
    }

    @Test
    void testBackendCountsAndFormatsValues() {
        MockBackend backend = new MockBackend(0);

        assertEquals("value-for-k", backend.fetch("k"));
        assertEquals(1, backend.getRequestCount());
    }
}
