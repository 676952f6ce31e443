package com.di.retailstar.context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered metric name to count/percentage map accumulated across the stages of one run.
 * Owned by a single {@link RunContext}; safe for the parallel dimension builders.
 */
public class QualityStats {

    private final Map<String, Number> metrics = new LinkedHashMap<>();

    public synchronized void record(String metric, Number value) {
        metrics.put(metric, value);
    }

    public synchronized void increment(String metric, long delta) {
        Number current = metrics.get(metric);
        metrics.put(metric, (current == null ? 0L : current.longValue()) + delta);
    }

    public synchronized Number get(String metric) {
        return metrics.get(metric);
    }

    public synchronized long getLong(String metric) {
        Number n = metrics.get(metric);
        return n == null ? 0L : n.longValue();
    }

    public synchronized boolean contains(String metric) {
        return metrics.containsKey(metric);
    }

    public synchronized Map<String, Number> snapshot() {
        return new LinkedHashMap<>(metrics);
    }
}
