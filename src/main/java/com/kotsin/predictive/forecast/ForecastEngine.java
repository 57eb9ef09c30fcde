package com.kotsin.predictive.forecast;

import com.kotsin.predictive.config.AnalyticsConfig;
import com.kotsin.predictive.exception.AnalyticsException;
import com.kotsin.predictive.exception.InsufficientDataException;
import com.kotsin.predictive.exception.ModelFailureException;
import com.kotsin.predictive.forecast.model.ForecastModel;
import com.kotsin.predictive.forecast.model.ModelFit;
import com.kotsin.predictive.metrics.AnalyticsMetrics;
import com.kotsin.predictive.model.Forecast;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.model.MetricHistory;
import com.kotsin.predictive.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * ForecastEngine - Best-model forecast per metric
 *
 * FLOW:
 * 1. Run every configured model (a failing model is logged and skipped)
 * 2. Keep the highest self-reported accuracy (ties: first in configured order)
 * 3. Measure MAPE/RMSE of the chosen model against held-out recent history
 *
 * Fails with {@link InsufficientDataException} below five observations and with the
 * last model's failure when no model succeeds.
 */
@Slf4j
@Component
public class ForecastEngine {

    private static final int MAX_BACKTEST_POINTS = 10;

    private final List<ForecastModel> models;
    private final AnalyticsConfig.Forecasting settings;
    private final AnalyticsMetrics metrics;
    private final Clock clock;

    @Autowired
    public ForecastEngine(AnalyticsConfig config, ForecastModelRegistry registry, AnalyticsMetrics metrics, Clock clock) {
        this.settings = config.getForecasting().copy();
        this.models = List.copyOf(registry.resolveAll(settings.resolveModels()));
        this.metrics = metrics;
        this.clock = clock;
    }

    public ForecastEngine(AnalyticsConfig config) {
        this(config, ForecastModelRegistry.withDefaults(), new AnalyticsMetrics(), Clock.systemUTC());
    }

    public List<ForecastModel> getModels() {
        return models;
    }

    public int getHorizon() {
        return settings.getHorizon();
    }

    /**
     * @throws InsufficientDataException below five observations
     * @throws ModelFailureException     when every configured model fails
     */
    public Forecast forecast(MetricHistory history) {
        return selectBest(history, runModels(history));
    }

    /**
     * Pick the best of runs already produced by {@link #runModels} for the same history.
     *
     * @throws ModelFailureException when none of the runs succeeded
     */
    public Forecast selectBest(MetricHistory history, List<ModelRun> runs) {
        ModelRun best = null;
        AnalyticsException lastFailure = null;
        for (ModelRun run : runs) {
            if (!run.isSuccess()) {
                lastFailure = run.getFailure();
                continue;
            }
            if (best == null || run.getFit().getAccuracy() > best.getFit().getAccuracy()) {
                best = run;
            }
        }
        if (best == null) {
            throw lastFailure != null ? lastFailure
                    : new ModelFailureException(history.getMetricName(), "all", "no forecast models configured");
        }

        ModelFit fit = best.getFit();
        double[] errors = measureErrors(history, models.get(indexOf(fit)), fit);
        Instant generatedAt = clock.instant();

        log.debug("[FORECAST] {} | model={} accuracy={} mape={} rmse={}", history.getMetricName(),
                fit.getType().code(), MathUtils.format2(fit.getAccuracy()),
                MathUtils.format2(errors[0]), MathUtils.format2(errors[1]));

        return Forecast.builder()
                .metric(history.getMetricName())
                .model(fit.getType())
                .points(fit.getPoints())
                .accuracy(fit.getAccuracy())
                .mape(errors[0])
                .rmse(errors[1])
                .generatedAt(generatedAt)
                .validUntil(generatedAt.plus(Duration.ofHours(settings.getUpdateFrequency())))
                .build();
    }

    /**
     * Run every configured model on the history, in configured order.
     *
     * @throws InsufficientDataException below five observations
     */
    public List<ModelRun> runModels(MetricHistory history) {
        if (history.size() < ForecastModel.MIN_OBSERVATIONS) {
            throw new InsufficientDataException(history.getMetricName(), "forecasting",
                    ForecastModel.MIN_OBSERVATIONS, history.size());
        }
        List<ModelRun> runs = new ArrayList<>(models.size());
        for (ForecastModel model : models) {
            runs.add(run(model, history, settings.getHorizon()));
        }
        return runs;
    }

    private ModelRun run(ForecastModel model, MetricHistory history, int horizon) {
        String code = model.type().code();
        metrics.incModelRun(code);
        try {
            return ModelRun.success(model.fit(history, horizon));
        } catch (AnalyticsException e) {
            metrics.incModelFailure(code);
            log.warn("[FORECAST] Model {} failed for {}: {}", code, history.getMetricName(), e.getMessage());
            return ModelRun.failure(model.type(), e);
        } catch (RuntimeException e) {
            metrics.incModelFailure(code);
            log.warn("[FORECAST] Model {} failed for {}", code, history.getMetricName(), e);
            return ModelRun.failure(model.type(), new ModelFailureException(history.getMetricName(), code, e));
        }
    }

    private int indexOf(ModelFit fit) {
        for (int i = 0; i < models.size(); i++) {
            if (models.get(i).type() == fit.getType()) {
                return i;
            }
        }
        throw new IllegalStateException("Fit from unconfigured model " + fit.getType());
    }

    /**
     * Backtest: refit on the history minus its last k = min(10, n - 5) points and compare the
     * k predictions with the held-out actuals. When nothing can be held out, compare the most
     * recent min(10, n) actuals index-wise with the first predictions of the full fit.
     *
     * @return {mape, rmse}
     */
    private double[] measureErrors(MetricHistory history, ForecastModel model, ModelFit fullFit) {
        double[] values = history.values();
        int n = values.length;
        int holdout = Math.min(MAX_BACKTEST_POINTS, n - ForecastModel.MIN_OBSERVATIONS);

        if (holdout >= 1) {
            try {
                ModelFit backtest = model.fit(history.head(n - holdout), holdout);
                double[] actual = Arrays.copyOfRange(values, n - holdout, n);
                return new double[]{
                        ForecastErrorMetrics.mape(actual, backtest.getPoints()),
                        ForecastErrorMetrics.rmse(actual, backtest.getPoints())};
            } catch (AnalyticsException e) {
                log.warn("[FORECAST] Backtest of {} failed for {}, comparing recent history instead: {}",
                        model.type().code(), history.getMetricName(), e.getMessage());
            }
        }

        int recent = Math.min(MAX_BACKTEST_POINTS, n);
        double[] actual = Arrays.copyOfRange(values, n - recent, n);
        List<ForecastPoint> predicted = fullFit.getPoints();
        return new double[]{
                ForecastErrorMetrics.mape(actual, predicted),
                ForecastErrorMetrics.rmse(actual, predicted)};
    }
}
