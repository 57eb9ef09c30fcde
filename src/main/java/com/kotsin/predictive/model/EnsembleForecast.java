package com.kotsin.predictive.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Accuracy-weighted blend of every model that fitted a metric.
 *
 * modelWeights is keyed by model code and sums to 1 across contributing models.
 */
@Value
@Builder
public class EnsembleForecast {

    String metric;
    List<ForecastPoint> points;
    Map<String, Double> modelWeights;
    double confidence;
    List<ForecastModelType> models;
    List<ForecastModelType> failedModels;
}
