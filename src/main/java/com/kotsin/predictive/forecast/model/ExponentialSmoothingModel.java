package com.kotsin.predictive.forecast.model;

import com.kotsin.predictive.model.ForecastModelType;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.util.MathUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple exponential smoothing of the level, compounded by the growth rate of
 * the most recent observations.
 *
 * FORMULAS:
 * - level_t = α·x_t + (1 - α)·level_(t-1), α = 0.3
 * - growth  = (x_last / x_first)^(1/(k-1)) - 1 over the last k ≤ 5 points (0 when the ratio is not positive)
 * - p_step  = level · (1 + growth)^step
 * - confidence = max(0.2, 0.8·e^(-0.1·step))
 */
@Component
public class ExponentialSmoothingModel extends AbstractForecastModel {

    static final double ALPHA = 0.3;
    private static final int GROWTH_WINDOW = 5;
    private static final double CONFIDENCE_FLOOR = 0.2;
    private static final double INTERVAL_SCALE = 0.6;

    @Override
    public ForecastModelType type() {
        return ForecastModelType.EXPONENTIAL;
    }

    @Override
    protected ModelFit forecast(double[] values, int horizon, StepClock clock) {
        double level = values[0];
        for (int i = 1; i < values.length; i++) {
            level = ALPHA * values[i] + (1 - ALPHA) * level;
        }
        double growth = growthRate(values);

        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            double predicted = level * Math.pow(1 + growth, step);
            double confidence = Math.max(CONFIDENCE_FLOOR, 0.8 * Math.exp(-step * 0.1));
            double halfWidth = Math.abs(predicted) * (1 - confidence) * INTERVAL_SCALE;
            points.add(point(clock, step, predicted, confidence, halfWidth));
        }
        return result(points, oneStepAccuracy(values));
    }

    static double growthRate(double[] values) {
        int from = Math.max(0, values.length - GROWTH_WINDOW);
        int k = values.length - from;
        if (k < 2) {
            return 0.0;
        }
        double ratio = MathUtils.safeDivide(values[values.length - 1], values[from], 0.0);
        if (ratio <= 0) {
            return 0.0;
        }
        double growth = Math.pow(ratio, 1.0 / (k - 1)) - 1;
        return MathUtils.isValidNumber(growth) ? growth : 0.0;
    }

    /**
     * 1 - mean relative error of one-step-ahead smoothed predictions, floored at 0.
     */
    static double oneStepAccuracy(double[] values) {
        if (values.length < 3) {
            return 0.5;
        }
        double smoothed = values[0];
        double totalError = 0.0;
        for (int i = 1; i < values.length; i++) {
            double actual = values[i];
            totalError += Math.abs(actual - smoothed) / Math.max(actual, 1.0);
            smoothed = ALPHA * actual + (1 - ALPHA) * smoothed;
        }
        return Math.max(0.0, 1.0 - totalError / (values.length - 1));
    }
}
