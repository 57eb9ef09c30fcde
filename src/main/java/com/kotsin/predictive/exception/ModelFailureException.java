package com.kotsin.predictive.exception;

import lombok.Getter;

/**
 * A single forecast model could not fit a metric.
 * Recovered locally by skipping the model; fatal only when every model fails.
 */
@Getter
public class ModelFailureException extends AnalyticsException {

    private final String metric;
    private final String model;

    public ModelFailureException(String metric, String model, String message) {
        super(String.format("Model '%s' failed for '%s': %s", model, metric, message));
        this.metric = metric;
        this.model = model;
    }

    public ModelFailureException(String metric, String model, Throwable cause) {
        super(String.format("Model '%s' failed for '%s': %s", model, metric, cause.getMessage()), cause);
        this.metric = metric;
        this.model = model;
    }
}
