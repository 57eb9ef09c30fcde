package com.kotsin.predictive.forecast.model;

import com.kotsin.predictive.model.ForecastModelType;
import com.kotsin.predictive.model.MetricHistory;

/**
 * One point-forecast strategy. Implementations are stateless and thread-safe.
 */
public interface ForecastModel {

    int MIN_OBSERVATIONS = 5;

    ForecastModelType type();

    /**
     * Fit the history and predict {@code horizon} steps ahead.
     *
     * @throws com.kotsin.predictive.exception.InsufficientDataException below {@link #MIN_OBSERVATIONS}
     * @throws com.kotsin.predictive.exception.ModelFailureException when the model cannot fit
     */
    ModelFit fit(MetricHistory history, int horizon);
}
