package com.kotsin.predictive.model;

import lombok.Value;

/**
 * Closed [lower, upper] band around a predicted value.
 */
@Value
public class ConfidenceInterval {
    double lower;
    double upper;

    public double width() {
        return upper - lower;
    }
}
