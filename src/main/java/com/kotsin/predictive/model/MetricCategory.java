package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Business area a metric belongs to.
 */
public enum MetricCategory {
    REVENUE,
    PERFORMANCE,
    ENGAGEMENT,
    CONVERSION,
    SATISFACTION;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
