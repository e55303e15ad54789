package com.swarmnet.core.state;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only record of finished queries, written concurrently by every
 * in-flight query and read by SwarmOrchestrator.getStatus().
 */
@Component
public class PerformanceMetricsStore {

    private final Queue<QueryMetrics> entries = new ConcurrentLinkedQueue<>();

    public void record(QueryMetrics metrics) {
        entries.add(metrics);
    }

    public int totalProcessed() {
        return entries.size();
    }

    public double averageProcessingMillis() {
        return entries.stream()
                .mapToLong(QueryMetrics::getProcessingMillis)
                .average()
                .orElse(0.0);
    }

    public List<QueryMetrics> snapshot() {
        return List.copyOf(entries);
    }
}
