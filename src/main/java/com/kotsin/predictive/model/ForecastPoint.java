package com.kotsin.predictive.model;

import com.kotsin.predictive.util.MathUtils;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One step of a forecast horizon.
 *
 * Invariants: predictedValue >= 0, lower <= predictedValue <= upper, confidence in [0, 1].
 * Use {@link #of} to build points from raw model output.
 */
@Value
@Builder
public class ForecastPoint {

    Instant timestamp;
    double predictedValue;
    double confidence;
    ConfidenceInterval interval;

    /**
     * Normalize raw model output into a valid point: the prediction is floored at 0
     * and the band is centred on the floored value, lower bound floored at 0.
     *
     * @param rawValue  unconstrained model prediction
     * @param halfWidth distance from prediction to each band edge (absolute value is used)
     */
    public static ForecastPoint of(Instant timestamp, double rawValue, double confidence, double halfWidth) {
        double predicted = Math.max(0.0, MathUtils.isValidNumber(rawValue) ? rawValue : 0.0);
        double width = MathUtils.isValidNumber(halfWidth) ? Math.abs(halfWidth) : 0.0;
        return ForecastPoint.builder()
                .timestamp(timestamp)
                .predictedValue(predicted)
                .confidence(MathUtils.clampUnit(confidence))
                .interval(new ConfidenceInterval(Math.max(0.0, predicted - width), predicted + width))
                .build();
    }
}
