package com.kotsin.predictive.metrics;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process counters for model runs, skipped metrics and dashboard cache hits.
 */
@Component
public class AnalyticsMetrics {
    private final Map<String, AtomicLong> modelRunsByModel = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> modelFailuresByModel = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> metricsSkippedByStage = new ConcurrentHashMap<>();
    private final AtomicLong dashboardsComputed = new AtomicLong(0);
    private final AtomicLong dashboardCacheHits = new AtomicLong(0);

    public void incModelRun(String model) { modelRunsByModel.computeIfAbsent(model, k -> new AtomicLong()).incrementAndGet(); }
    public void incModelFailure(String model) { modelFailuresByModel.computeIfAbsent(model, k -> new AtomicLong()).incrementAndGet(); }
    public void incMetricSkipped(String stage) { metricsSkippedByStage.computeIfAbsent(stage, k -> new AtomicLong()).incrementAndGet(); }
    public void incDashboardComputed() { dashboardsComputed.incrementAndGet(); }
    public void incDashboardCacheHit() { dashboardCacheHits.incrementAndGet(); }

    public Map<String, Long> getModelRunsByModel() { return toLongMap(modelRunsByModel); }
    public Map<String, Long> getModelFailuresByModel() { return toLongMap(modelFailuresByModel); }
    public Map<String, Long> getMetricsSkippedByStage() { return toLongMap(metricsSkippedByStage); }
    public long getDashboardsComputed() { return dashboardsComputed.get(); }
    public long getDashboardCacheHits() { return dashboardCacheHits.get(); }

    private Map<String, Long> toLongMap(Map<String, AtomicLong> src) {
        Map<String, Long> out = new ConcurrentHashMap<>();
        src.forEach((k, v) -> out.put(k, v.get()));
        return Map.copyOf(out);
    }
}
