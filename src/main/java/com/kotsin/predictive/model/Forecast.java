package com.kotsin.predictive.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Best-model forecast for one metric, with error metrics measured against history.
 */
@Value
@Builder
public class Forecast {

    String metric;
    ForecastModelType model;
    List<ForecastPoint> points;
    double accuracy;
    double mape;
    double rmse;
    Instant generatedAt;
    Instant validUntil;

    /**
     * First {@code count} points (fewer when the horizon is shorter).
     */
    public List<ForecastPoint> nearTerm(int count) {
        return points.subList(0, Math.min(count, points.size()));
    }
}
