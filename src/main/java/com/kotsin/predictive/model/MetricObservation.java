package com.kotsin.predictive.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One observed value of a named business metric.
 * Values must be finite and timestamps present; violations are rejected at construction.
 */
@Value
public class MetricObservation {

    String id;
    String name;
    double value;
    Instant timestamp;
    MetricCategory category;
    String unit;

    @Builder
    public MetricObservation(String id, String name, double value, Instant timestamp,
                             MetricCategory category, String unit) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Observation value must be finite for '" + name + "': " + value);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Observation timestamp is required for '" + name + "'");
        }
        this.id = id;
        this.name = name;
        this.value = value;
        this.timestamp = timestamp;
        this.category = category;
        this.unit = unit;
    }
}
