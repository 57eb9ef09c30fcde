package com.kotsin.predictive.trend;

import com.kotsin.predictive.util.MathUtils;
import lombok.Value;

/**
 * Closed-form ordinary least squares of value against ordinal index (0..n-1).
 */
public final class LinearRegression {

    private LinearRegression() {}

    @Value
    public static class Fit {
        double slope;
        double intercept;
        double rSquared;

        public double predict(double x) {
            return slope * x + intercept;
        }
    }

    public static Fit fit(double[] values) {
        return fit(values, 0, values.length);
    }

    /**
     * Fit values[from, to), re-indexed so that values[from] sits at x = 0.
     *
     * R² is 0 when the slice has no variance and is clamped to [0, 1].
     */
    public static Fit fit(double[] values, int from, int to) {
        int n = to - from;
        if (n <= 0) {
            return new Fit(0.0, 0.0, 0.0);
        }

        double sumX = 0.0;
        double sumY = 0.0;
        double sumXY = 0.0;
        double sumXX = 0.0;
        for (int i = 0; i < n; i++) {
            double y = values[from + i];
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }

        double slope = MathUtils.safeDivide(n * sumXY - sumX * sumY, n * sumXX - sumX * sumX, 0.0);
        double intercept = (sumY - slope * sumX) / n;

        double yMean = sumY / n;
        double ssTotal = 0.0;
        double ssResidual = 0.0;
        for (int i = 0; i < n; i++) {
            double y = values[from + i];
            double residual = y - (slope * i + intercept);
            ssTotal += (y - yMean) * (y - yMean);
            ssResidual += residual * residual;
        }
        double rSquared = MathUtils.isValidDenominator(ssTotal) && ssTotal > MathUtils.EPSILON
                ? MathUtils.clampUnit(1.0 - ssResidual / ssTotal)
                : 0.0;

        return new Fit(slope, intercept, rSquared);
    }
}
