package com.kotsin.predictive.forecast;

import com.kotsin.predictive.exception.AnalyticsException;
import com.kotsin.predictive.exception.ModelFailureException;
import com.kotsin.predictive.forecast.model.ModelFit;
import com.kotsin.predictive.model.EnsembleForecast;
import com.kotsin.predictive.model.ForecastModelType;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.model.MetricHistory;
import com.kotsin.predictive.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EnsembleCombiner - Accuracy-weighted blend of every model that fitted a metric
 *
 * WEIGHTS: w_i = accuracy_i / Σ accuracy (equal weights when Σ accuracy = 0)
 *
 * PER STEP (over the models that predicted that step, weights renormalized):
 * - value      = Σ w·p
 * - confidence = Σ w·c
 * - interval   = value ± 2·sqrt(Σ w·(p - value)²), floored at 0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnsembleCombiner {

    private static final double INTERVAL_SIGMAS = 2.0;

    private final ForecastEngine engine;

    public EnsembleForecast combine(MetricHistory history) {
        return combine(history, engine.runModels(history));
    }

    /**
     * Blend runs already produced by {@link ForecastEngine#runModels} for this history.
     *
     * @throws ModelFailureException when no run succeeded
     */
    public EnsembleForecast combine(MetricHistory history, List<ModelRun> runs) {
        List<ModelFit> fits = new ArrayList<>();
        List<ForecastModelType> failed = new ArrayList<>();
        AnalyticsException lastFailure = null;
        for (ModelRun run : runs) {
            if (run.isSuccess()) {
                fits.add(run.getFit());
            } else {
                failed.add(run.getType());
                lastFailure = run.getFailure();
            }
        }
        if (fits.isEmpty()) {
            throw lastFailure != null ? lastFailure
                    : new ModelFailureException(history.getMetricName(), "ensemble", "no model runs to combine");
        }

        double[] weights = weights(fits);
        List<ForecastPoint> points = blend(fits, weights);

        Map<String, Double> modelWeights = new LinkedHashMap<>();
        List<ForecastModelType> models = new ArrayList<>();
        double confidence = 0.0;
        for (int m = 0; m < fits.size(); m++) {
            ModelFit fit = fits.get(m);
            modelWeights.put(fit.getType().code(), weights[m]);
            models.add(fit.getType());
            confidence += fit.getAccuracy() * weights[m];
        }

        log.debug("[ENSEMBLE] {} | weights={} failed={}", history.getMetricName(), modelWeights, failed);

        return EnsembleForecast.builder()
                .metric(history.getMetricName())
                .points(List.copyOf(points))
                .modelWeights(Collections.unmodifiableMap(modelWeights))
                .confidence(MathUtils.clampUnit(confidence))
                .models(List.copyOf(models))
                .failedModels(List.copyOf(failed))
                .build();
    }

    static double[] weights(List<ModelFit> fits) {
        double total = 0.0;
        for (ModelFit fit : fits) {
            total += fit.getAccuracy();
        }
        double[] weights = new double[fits.size()];
        for (int m = 0; m < weights.length; m++) {
            weights[m] = MathUtils.isValidDenominator(total)
                    ? fits.get(m).getAccuracy() / total
                    : 1.0 / fits.size();
        }
        return weights;
    }

    private static List<ForecastPoint> blend(List<ModelFit> fits, double[] weights) {
        int steps = 0;
        for (ModelFit fit : fits) {
            steps = Math.max(steps, fit.getPoints().size());
        }

        List<ForecastPoint> blended = new ArrayList<>(steps);
        for (int step = 0; step < steps; step++) {
            double weightSum = 0.0;
            double value = 0.0;
            double confidence = 0.0;
            ForecastPoint first = null;
            for (int m = 0; m < fits.size(); m++) {
                List<ForecastPoint> points = fits.get(m).getPoints();
                if (step >= points.size()) {
                    continue;
                }
                ForecastPoint point = points.get(step);
                if (first == null) {
                    first = point;
                }
                weightSum += weights[m];
                value += weights[m] * point.getPredictedValue();
                confidence += weights[m] * point.getConfidence();
            }
            if (first == null) {
                continue;
            }

            double mean = MathUtils.safeDivide(value, weightSum, first.getPredictedValue());
            double meanConfidence = MathUtils.safeDivide(confidence, weightSum, first.getConfidence());

            double variance = 0.0;
            for (int m = 0; m < fits.size(); m++) {
                List<ForecastPoint> points = fits.get(m).getPoints();
                if (step < points.size()) {
                    double diff = points.get(step).getPredictedValue() - mean;
                    variance += weights[m] * diff * diff;
                }
            }
            double stdDev = Math.sqrt(MathUtils.safeDivide(variance, weightSum, 0.0));

            blended.add(ForecastPoint.of(first.getTimestamp(), mean, meanConfidence, INTERVAL_SIGMAS * stdDev));
        }
        return blended;
    }
}
