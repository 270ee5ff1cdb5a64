package com.example.simplecache.workload;

import com.example.simplecache.config.SimpleCacheProperties;
import com.example.simplecache.core.Cache;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a read-through workload against a cache: Zipf-distributed keys over a
 * fixed universe, optionally mixed with one-off scan keys, each miss loading from
 * a {@link MockBackend}.
 *
 * With more than one thread the cache must be safe to share, e.g. a
 * {@link com.example.simplecache.core.LockingCache}.
 */
public class WorkloadSimulator {

    private static final Logger log = LoggerFactory.getLogger(WorkloadSimulator.class);

    private final SimpleCacheProperties.Workload settings;

    public WorkloadSimulator(SimpleCacheProperties.Workload settings) {
        this.settings = settings;
    }

    public WorkloadReport run(Cache<String, Object> cache, MockBackend backend)
            throws InterruptedException, ExecutionException {
        int threads = settings.getThreads();
        int totalRequests = settings.getRequests();
        // start scan keys outside the universe so they never collide with hot keys
        AtomicLong scanIndex = new AtomicLong(settings.getUniverse() + 1L);
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();

        log.info("Starting workload (requests={}, universe={}, threads={}, alpha={}, scanRatio={}, latency={}ms)",
            totalRequests, settings.getUniverse(), threads, settings.getAlpha(), settings.getScanRatio(),
            backend.getLatencyMillis());

        List<Callable<Long>> workers = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            // spread the remainder over the first workers
            int share = totalRequests / threads + (i < totalRequests % threads ? 1 : 0);
            long workerSeed = settings.getSeed() + i;
            workers.add(() -> runWorker(cache, backend, share, workerSeed, scanIndex, latencies));
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        long issued = 0;
        try {
            for (Future<Long> future : executor.invokeAll(workers)) {
                issued += future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);

        WorkloadReport report = new WorkloadReport(issued, backend.getRequestCount(), cache.size(),
            cache.getStats(), stats.getPercentile(50), stats.getPercentile(99), stats.getMax());
        log.info("Workload finished: {}", report);
        return report;
    }

    private long runWorker(Cache<String, Object> cache, MockBackend backend, int requests, long seed,
                           AtomicLong scanIndex, ConcurrentLinkedQueue<Double> latencies) {
        RandomGenerator rand = new Well19937c(seed);
        // ZipfDistribution is not thread-safe, one per worker
        ZipfDistribution zipf = new ZipfDistribution(rand, settings.getUniverse(), settings.getAlpha());

        long issued = 0;
        for (int n = 0; n < requests; n++) {
            String key;
            if (rand.nextDouble() < settings.getScanRatio()) {
                key = "scan-" + scanIndex.getAndIncrement();
            } else {
                key = "key-" + zipf.sample();
            }

            long start = System.nanoTime();
            cache.getOrLoad(key, backend::fetch);
            latencies.add((System.nanoTime() - start) / 1_000_000.0);
            issued++;
        }
        return issued;
    }
}
