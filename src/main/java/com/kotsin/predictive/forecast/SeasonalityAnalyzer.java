package com.kotsin.predictive.forecast;

import com.kotsin.predictive.util.MathUtils;
import lombok.Value;

/**
 * SeasonalityAnalyzer - Autocorrelation period search and additive decomposition
 *
 * Used by the seasonal forecast model (lags up to 12) and by seasonal insight
 * extraction (lags up to 30).
 */
public final class SeasonalityAnalyzer {

    private SeasonalityAnalyzer() {}

    public static final int DEFAULT_PERIOD = 7;
    private static final int MIN_LAG = 2;

    /**
     * Multiples of the true period correlate about as well as the period itself;
     * a longer lag must beat the best shorter one by more than this.
     */
    private static final double LAG_TIE_TOLERANCE = 1e-3;

    // ======================== PERIOD DETECTION ========================

    /**
     * Lag in [2, min(n/3, maxLag)] with the highest positive autocorrelation,
     * or {@link #DEFAULT_PERIOD} when no lag correlates positively.
     */
    public static int detectPeriod(double[] values, int maxLag) {
        int upper = Math.min(values.length / 3, maxLag);
        int bestPeriod = -1;
        double bestCorrelation = 0.0;

        for (int lag = MIN_LAG; lag <= upper; lag++) {
            double correlation = autocorrelation(values, lag);
            double margin = bestPeriod < 0 ? 0.0 : LAG_TIE_TOLERANCE;
            if (correlation > bestCorrelation + margin) {
                bestCorrelation = correlation;
                bestPeriod = lag;
            }
        }
        return bestPeriod < 0 ? DEFAULT_PERIOD : bestPeriod;
    }

    /**
     * Pearson correlation between values[0, n-lag) and values[lag, n). 0 when undefined.
     */
    public static double autocorrelation(double[] values, int lag) {
        if (lag <= 0 || lag >= values.length) {
            return 0.0;
        }
        int n = values.length - lag;
        double mean1 = MathUtils.mean(values, 0, n);
        double mean2 = MathUtils.mean(values, lag, values.length);

        double numerator = 0.0;
        double denominator1 = 0.0;
        double denominator2 = 0.0;
        for (int i = 0; i < n; i++) {
            double diff1 = values[i] - mean1;
            double diff2 = values[i + lag] - mean2;
            numerator += diff1 * diff2;
            denominator1 += diff1 * diff1;
            denominator2 += diff2 * diff2;
        }
        return MathUtils.safeDivide(numerator, Math.sqrt(denominator1 * denominator2), 0.0);
    }

    // ======================== DECOMPOSITION ========================

    @Value
    public static class Decomposition {
        int period;
        double[] trend;
        double[] seasonal;
        double[] residual;
    }

    /**
     * value = trend + seasonal[i % period] + residual.
     *
     * Trend is a centred moving average of width 2·(period/2)+1; positions without a full
     * window keep their raw value. Seasonal is the mean detrended value per phase.
     */
    public static Decomposition decompose(double[] values, int period) {
        int n = values.length;
        int half = period / 2;

        double[] trend = new double[n];
        for (int i = 0; i < n; i++) {
            if (i < half || i >= n - half) {
                trend[i] = values[i];
            } else {
                trend[i] = MathUtils.mean(values, i - half, i + half + 1);
            }
        }

        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < n; i++) {
            sums[i % period] += values[i] - trend[i];
            counts[i % period]++;
        }
        double[] seasonal = new double[period];
        for (int p = 0; p < period; p++) {
            seasonal[p] = counts[p] > 0 ? sums[p] / counts[p] : 0.0;
        }

        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = values[i] - trend[i] - seasonal[i % period];
        }
        return new Decomposition(period, trend, seasonal, residual);
    }

    // ======================== STRENGTH & PHASES ========================

    /**
     * Mean raw value per phase (index % period).
     */
    public static double[] phaseMeans(double[] values, int period) {
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < values.length; i++) {
            sums[i % period] += values[i];
            counts[i % period]++;
        }
        double[] means = new double[period];
        for (int p = 0; p < period; p++) {
            means[p] = counts[p] > 0 ? sums[p] / counts[p] : 0.0;
        }
        return means;
    }

    /**
     * Variance of the phase means over the variance of the series, capped at 1.
     * 0 when fewer than two full periods are available or the series is constant.
     */
    public static double seasonalStrength(double[] values, int period) {
        if (values.length < period * 2) {
            return 0.0;
        }
        double overallMean = MathUtils.mean(values);
        double[] means = phaseMeans(values, period);
        double seasonalVariance = 0.0;
        for (double mean : means) {
            seasonalVariance += (mean - overallMean) * (mean - overallMean);
        }
        seasonalVariance /= period;
        double totalVariance = MathUtils.variance(values);
        return Math.min(1.0, MathUtils.safeDivide(seasonalVariance, totalVariance, 0.0));
    }
}
