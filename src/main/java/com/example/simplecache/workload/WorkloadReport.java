package com.example.simplecache.workload;

import com.example.simplecache.stats.StatsSnapshot;

public class WorkloadReport {

    private final long requests;
    private final long backendRequests;
    private final int finalSize;
    private final StatsSnapshot stats;
    private final double p50Millis;
    private final double p99Millis;
    private final double maxMillis;

    public WorkloadReport(long requests, long backendRequests, int finalSize, StatsSnapshot stats,
                          double p50Millis, double p99Millis, double maxMillis) {
        this.requests = requests;
        this.backendRequests = backendRequests;
        this.finalSize = finalSize;
        this.stats = stats;
        this.p50Millis = p50Millis;
        this.p99Millis = p99Millis;
        this.maxMillis = maxMillis;
    }

    public long getRequests() {
        return requests;
    }

    public long getBackendRequests() {
        return backendRequests;
    }

    public int getFinalSize() {
        return finalSize;
    }

    public StatsSnapshot getStats() {
        return stats;
    }

    public double getP50Millis() {
        return p50Millis;
    }

    public double getP99Millis() {
        return p99Millis;
    }

    public double getMaxMillis() {
        return maxMillis;
    }

    @Override
    public String toString() {
        return String.format("WorkloadReport{requests=%d, backendRequests=%d, finalSize=%d, "
                + "latency: p50=%.3fms p99=%.3fms max=%.3fms, %s}",
            requests, backendRequests, finalSize, p50Millis, p99Millis, maxMillis, stats);
    }
}
