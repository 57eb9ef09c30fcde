package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Bucket size the collaborator used when producing a metric history.
 */
public enum AggregationPeriod {
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
