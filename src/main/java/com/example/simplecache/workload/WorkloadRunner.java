package com.example.simplecache.workload;

import com.example.simplecache.config.SimpleCacheProperties;
import com.example.simplecache.core.Cache;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the configured workload once at startup.
 * Enable with {@code simplecache.workload.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "simplecache.workload", name = "enabled", havingValue = "true")
public class WorkloadRunner implements CommandLineRunner {

    private final Cache<String, Object> cache;
    private final SimpleCacheProperties properties;

    private WorkloadReport lastReport;

    public WorkloadRunner(Cache<String, Object> cache, SimpleCacheProperties properties) {
        this.cache = cache;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws Exception {
        SimpleCacheProperties.Workload workload = properties.getWorkload();
        MockBackend backend = new MockBackend(workload.getBackendLatencyMillis());
        lastReport = new WorkloadSimulator(workload).run(cache, backend);
    }

    public WorkloadReport getLastReport() {
        return lastReport;
    }
}
