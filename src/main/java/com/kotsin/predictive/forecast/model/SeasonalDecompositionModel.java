package com.kotsin.predictive.forecast.model;

import com.kotsin.predictive.forecast.SeasonalityAnalyzer;
import com.kotsin.predictive.model.ForecastModelType;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.trend.LinearRegression;
import com.kotsin.predictive.util.MathUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Additive decomposition forecast: extrapolated trend plus the seasonal offset of
 * the target phase.
 *
 * The period comes from an autocorrelation search over lags 2..min(n/3, 12).
 * Confidence shrinks with the step and with the share of variance left in the residual.
 */
@Component
public class SeasonalDecompositionModel extends AbstractForecastModel {

    static final int MAX_LAG = 12;
    private static final int TREND_TAIL = 5;
    private static final double CONFIDENCE_FLOOR = 0.2;
    private static final double DEFAULT_ACCURACY = 0.5;

    @Override
    public ForecastModelType type() {
        return ForecastModelType.SEASONAL;
    }

    @Override
    protected ModelFit forecast(double[] values, int horizon, StepClock clock) {
        int n = values.length;
        int period = SeasonalityAnalyzer.detectPeriod(values, MAX_LAG);
        SeasonalityAnalyzer.Decomposition decomposition = SeasonalityAnalyzer.decompose(values, period);

        double[] trend = decomposition.getTrend();
        int tailStart = Math.max(0, n - TREND_TAIL);
        LinearRegression.Fit trendLine = LinearRegression.fit(trend, tailStart, n);
        int tailLength = n - tailStart;

        double residualVariance = MathUtils.variance(decomposition.getResidual());
        double totalVariance = MathUtils.variance(values);
        double normalizedResidual = MathUtils.safeDivide(residualVariance, totalVariance, 0.0);
        double halfWidth = 2 * Math.sqrt(residualVariance);

        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            double trendValue = trendLine.predict(tailLength - 1 + step);
            double seasonalValue = decomposition.getSeasonal()[(n - 1 + step) % period];
            double confidence = Math.max(CONFIDENCE_FLOOR,
                    0.9 * Math.exp(-step * 0.05) * Math.exp(-normalizedResidual * 0.1));
            points.add(point(clock, step, trendValue + seasonalValue, confidence, halfWidth));
        }

        double accuracy = n < period * 2 || !MathUtils.isValidDenominator(totalVariance)
                ? DEFAULT_ACCURACY
                : Math.max(0.0, 1 - residualVariance / totalVariance);
        return result(points, accuracy);
    }
}
