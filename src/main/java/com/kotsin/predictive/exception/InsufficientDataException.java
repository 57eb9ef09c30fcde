package com.kotsin.predictive.exception;

import lombok.Getter;

/**
 * Thrown when a history holds too few observations for the requested operation
 * (trend needs 2, forecasting needs 5).
 */
@Getter
public class InsufficientDataException extends AnalyticsException {

    private final String metric;
    private final int required;
    private final int actual;

    public InsufficientDataException(String metric, String operation, int required, int actual) {
        super(String.format("Insufficient data for %s of '%s': need at least %d observations, got %d",
                operation, metric, required, actual));
        this.metric = metric;
        this.required = required;
        this.actual = actual;
    }
}
