package com.kotsin.predictive.util;

import java.util.Locale;

/**
 * MathUtils - Safe numeric helpers shared by the analyzers and forecast models.
 *
 * Every division in the analytics core goes through {@link #safeDivide} so that
 * zero or non-finite denominators never leak NaN/Infinity into results.
 *
 * USAGE:
 * Instead of: double result = a / b;
 * Use: double result = MathUtils.safeDivide(a, b, 0.0);
 */
public final class MathUtils {

    private MathUtils() {} // Prevent instantiation

    public static final double EPSILON = 1e-10;

    // ======================== SAFE DIVISION ========================

    /**
     * Safe division that returns defaultValue if denominator is 0, NaN, or Infinity
     *
     * @param numerator    The numerator
     * @param denominator  The denominator
     * @param defaultValue Value to return if division is unsafe
     * @return Result of division or defaultValue
     */
    public static double safeDivide(double numerator, double denominator, double defaultValue) {
        if (!isValidDenominator(denominator)) {
            return defaultValue;
        }
        double result = numerator / denominator;
        if (!isValidNumber(result)) {
            return defaultValue;
        }
        return result;
    }

    public static boolean isValidDenominator(double value) {
        return value != 0 && !Double.isNaN(value) && !Double.isInfinite(value);
    }

    // ======================== NUMBER VALIDATION ========================

    public static boolean isValidNumber(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    /**
     * Safe percentage change: ((new - old) / old) * 100
     */
    public static double safePercentageChange(double newValue, double oldValue, double defaultValue) {
        if (!isValidDenominator(oldValue)) {
            return defaultValue;
        }
        double change = (newValue - oldValue) / oldValue * 100.0;
        return isValidNumber(change) ? change : defaultValue;
    }

    // ======================== FLOATING POINT COMPARISON ========================

    public static boolean equals(double a, double b) {
        return Math.abs(a - b) < EPSILON;
    }

    // ======================== CLAMPING ========================

    /**
     * Clamp value to range [min, max] with NaN protection
     */
    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? max : min;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Clamp confidence (or accuracy, or r²) to [0, 1]
     */
    public static double clampUnit(double value) {
        return clamp(value, 0.0, 1.0);
    }

    // ======================== STATISTICAL ========================

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Mean of values[from, to). Empty range yields 0.
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /**
     * Population variance (divides by n, not n - 1). Empty input yields 0.
     */
    public static double variance(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        return variance(values, 0, values.length);
    }

    /**
     * Population variance of values[from, to).
     */
    public static double variance(double[] values, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double mean = mean(values, from, to);
        double sumSquaredDiff = 0.0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / (to - from);
    }

    public static double populationStdDev(double[] values, int from, int to) {
        return Math.sqrt(variance(values, from, to));
    }

    /**
     * First differences: out[i] = values[i + 1] - values[i].
     */
    public static double[] difference(double[] values) {
        if (values == null || values.length < 2) {
            return new double[0];
        }
        double[] out = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            out[i - 1] = values[i] - values[i - 1];
        }
        return out;
    }

    /**
     * Round to a fixed number of decimals, for descriptions only.
     */
    public static String format2(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public static String format1(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
