package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered observation history of one metric.
 *
 * Observations are sorted ascending by timestamp at construction (stable sort, so
 * duplicate timestamps keep their input order; no dedup).
 */
@Value
public class MetricHistory {

    private static final Duration DEFAULT_INTERVAL = Duration.ofDays(1);

    String metricName;
    MetricCategory category;
    AggregationPeriod aggregationPeriod;
    List<MetricObservation> observations;

    @Builder
    public MetricHistory(String metricName, MetricCategory category,
                         AggregationPeriod aggregationPeriod, List<MetricObservation> observations) {
        this.metricName = metricName;
        this.category = category;
        this.aggregationPeriod = aggregationPeriod != null ? aggregationPeriod : AggregationPeriod.DAILY;
        List<MetricObservation> sorted = observations != null ? new ArrayList<>(observations) : new ArrayList<>();
        sorted.sort(Comparator.comparing(MetricObservation::getTimestamp));
        this.observations = List.copyOf(sorted);
    }

    @JsonIgnore
    public int size() {
        return observations.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return observations.isEmpty();
    }

    /**
     * Values in timestamp order.
     */
    public double[] values() {
        double[] values = new double[observations.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = observations.get(i).getValue();
        }
        return values;
    }

    @JsonIgnore
    public Instant getStartTime() {
        return observations.isEmpty() ? null : observations.get(0).getTimestamp();
    }

    @JsonIgnore
    public Instant getEndTime() {
        return observations.isEmpty() ? null : observations.get(observations.size() - 1).getTimestamp();
    }

    /**
     * Mean spacing between consecutive observations; one day when it cannot be derived.
     */
    @JsonIgnore
    public Duration getMeanInterval() {
        if (observations.size() < 2) {
            return DEFAULT_INTERVAL;
        }
        long spanMillis = Duration.between(getStartTime(), getEndTime()).toMillis();
        long stepMillis = spanMillis / (observations.size() - 1);
        return stepMillis > 0 ? Duration.ofMillis(stepMillis) : DEFAULT_INTERVAL;
    }

    /**
     * Copy holding only the first {@code count} observations.
     */
    public MetricHistory head(int count) {
        int end = Math.max(0, Math.min(count, observations.size()));
        return new MetricHistory(metricName, category, aggregationPeriod, observations.subList(0, end));
    }
}
