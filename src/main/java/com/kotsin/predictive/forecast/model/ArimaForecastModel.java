package com.kotsin.predictive.forecast.model;

import com.kotsin.predictive.model.ForecastModelType;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.util.MathUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * First-order ARIMA(1,1,1) approximation on the differenced series.
 *
 * FIT:
 * - ar: least squares of d_t on d_(t-1), clamped to [-0.9, 0.9]
 * - ma: fixed 0.3
 * - accuracy: max(0.2, 1 - var(residual) / var(d))
 *
 * FORECAST (recursive): d' = ar·d + ma·e, x' = x + d', e' = 0.1·d'
 */
@Component
public class ArimaForecastModel extends AbstractForecastModel {

    static final double MA = 0.3;
    private static final double AR_LIMIT = 0.9;
    private static final double FALLBACK_AR = 0.5;
    private static final double FALLBACK_ACCURACY = 0.5;
    private static final double ACCURACY_FLOOR = 0.2;
    private static final double ERROR_FEEDBACK = 0.1;
    private static final double INTERVAL_SCALE = 0.4;

    @Override
    public ForecastModelType type() {
        return ForecastModelType.ARIMA;
    }

    @Override
    protected ModelFit forecast(double[] values, int horizon, StepClock clock) {
        double[] differenced = MathUtils.difference(values);
        double[] params = fitParameters(differenced);
        double ar = params[0];
        double accuracy = params[1];

        double lastDiff = differenced.length > 0 ? differenced[differenced.length - 1] : 0.0;
        double lastValue = values[values.length - 1];
        double lastError = 0.0;

        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            double predictedDiff = ar * lastDiff + MA * lastError;
            double predicted = lastValue + predictedDiff;
            double confidence = Math.max(ACCURACY_FLOOR, accuracy * Math.exp(-step * 0.1));
            points.add(point(clock, step, predicted, confidence, Math.abs(predicted) * (1 - confidence) * INTERVAL_SCALE));

            lastDiff = predictedDiff;
            lastValue = predicted;
            lastError = predictedDiff * ERROR_FEEDBACK;
        }
        return result(points, accuracy);
    }

    /**
     * @return {ar, accuracy}
     */
    static double[] fitParameters(double[] differenced) {
        if (differenced.length < 3) {
            return new double[]{FALLBACK_AR, FALLBACK_ACCURACY};
        }

        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 1; i < differenced.length; i++) {
            numerator += differenced[i] * differenced[i - 1];
            denominator += differenced[i - 1] * differenced[i - 1];
        }
        double ar = MathUtils.isValidDenominator(denominator)
                ? MathUtils.clamp(numerator / denominator, -AR_LIMIT, AR_LIMIT)
                : FALLBACK_AR;

        double[] residuals = new double[differenced.length - 1];
        for (int i = 1; i < differenced.length; i++) {
            residuals[i - 1] = differenced[i] - ar * differenced[i - 1];
        }
        double ratio = MathUtils.safeDivide(MathUtils.variance(residuals), MathUtils.variance(differenced), 0.0);
        return new double[]{ar, Math.max(ACCURACY_FLOOR, 1 - ratio)};
    }
}
