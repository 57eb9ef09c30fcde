package com.kotsin.predictive.forecast.model;

import com.kotsin.predictive.model.ForecastModelType;
import com.kotsin.predictive.model.ForecastPoint;
import lombok.Value;

import java.util.List;

/**
 * Predictions of one model plus its self-reported accuracy in [0, 1].
 */
@Value
public class ModelFit {
    ForecastModelType type;
    List<ForecastPoint> points;
    double accuracy;
}
