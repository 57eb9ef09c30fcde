package com.kotsin.predictive.forecast.model;

import com.kotsin.predictive.model.ForecastModelType;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.trend.LinearRegression;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extends the OLS trend line from the last observed value.
 *
 * confidence = max(0.3, R²·(1 - 0.1·step)), accuracy = R².
 */
@Component
public class LinearForecastModel extends AbstractForecastModel {

    private static final double CONFIDENCE_FLOOR = 0.3;
    private static final double DECAY_PER_STEP = 0.1;
    private static final double INTERVAL_SCALE = 0.5;

    @Override
    public ForecastModelType type() {
        return ForecastModelType.LINEAR;
    }

    @Override
    protected ModelFit forecast(double[] values, int horizon, StepClock clock) {
        LinearRegression.Fit trend = LinearRegression.fit(values);
        double last = values[values.length - 1];

        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            double predicted = last + trend.getSlope() * step;
            double confidence = Math.max(CONFIDENCE_FLOOR, trend.getRSquared() * (1 - step * DECAY_PER_STEP));
            double halfWidth = Math.abs(predicted) * (1 - confidence) * INTERVAL_SCALE;
            points.add(point(clock, step, predicted, confidence, halfWidth));
        }
        return result(points, trend.getRSquared());
    }
}
