package com.kotsin.predictive.forecast;

import com.kotsin.predictive.model.ForecastPoint;

import java.util.List;

/**
 * MAPE and RMSE over index-aligned actual/predicted pairs (the shorter length wins).
 */
public final class ForecastErrorMetrics {

    private ForecastErrorMetrics() {}

    /**
     * Mean absolute percentage error (in %), averaged over pairs whose actual is non-zero.
     * 0 when there are no such pairs.
     */
    public static double mape(double[] actual, List<ForecastPoint> predicted) {
        int pairs = Math.min(actual.length, predicted.size());
        double total = 0.0;
        int counted = 0;
        for (int i = 0; i < pairs; i++) {
            if (actual[i] != 0) {
                total += Math.abs((actual[i] - predicted.get(i).getPredictedValue()) / actual[i]);
                counted++;
            }
        }
        return counted == 0 ? 0.0 : total / counted * 100.0;
    }

    public static double rmse(double[] actual, List<ForecastPoint> predicted) {
        int pairs = Math.min(actual.length, predicted.size());
        if (pairs == 0) {
            return 0.0;
        }
        double sumSquared = 0.0;
        for (int i = 0; i < pairs; i++) {
            double error = actual[i] - predicted.get(i).getPredictedValue();
            sumSquared += error * error;
        }
        return Math.sqrt(sumSquared / pairs);
    }
}
