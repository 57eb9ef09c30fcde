package com.kotsin.predictive.forecast.model;

import com.kotsin.predictive.exception.InsufficientDataException;
import com.kotsin.predictive.exception.ModelFailureException;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.model.MetricHistory;
import com.kotsin.predictive.util.MathUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Shared guard rails for the model family: minimum sample size, future timestamps
 * and a finite accuracy. Subclasses only supply the numeric method.
 */
public abstract class AbstractForecastModel implements ForecastModel {

    @Override
    public final ModelFit fit(MetricHistory history, int horizon) {
        if (history.size() < MIN_OBSERVATIONS) {
            throw new InsufficientDataException(history.getMetricName(), type().code() + " forecast",
                    MIN_OBSERVATIONS, history.size());
        }
        if (horizon < 1) {
            throw new ModelFailureException(history.getMetricName(), type().code(),
                    "horizon must be >= 1, got " + horizon);
        }

        ModelFit fit;
        try {
            fit = forecast(history.values(), horizon,
                    new StepClock(history.getEndTime(), history.getMeanInterval()));
        } catch (ArithmeticException | IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new ModelFailureException(history.getMetricName(), type().code(), e);
        }

        if (!MathUtils.isValidNumber(fit.getAccuracy())) {
            throw new ModelFailureException(history.getMetricName(), type().code(),
                    "accuracy is not a finite number");
        }
        return new ModelFit(type(), List.copyOf(fit.getPoints()), MathUtils.clampUnit(fit.getAccuracy()));
    }

    /**
     * @param values observation values in timestamp order, at least {@link #MIN_OBSERVATIONS} long
     * @param clock  maps a horizon step (1-based) to its timestamp
     */
    protected abstract ModelFit forecast(double[] values, int horizon, StepClock clock);

    protected ModelFit result(List<ForecastPoint> points, double accuracy) {
        return new ModelFit(type(), points, accuracy);
    }

    /**
     * Timestamps of future steps: last observation + step × mean spacing.
     */
    protected static final class StepClock {
        private final Instant last;
        private final Duration interval;

        StepClock(Instant last, Duration interval) {
            this.last = last;
            this.interval = interval;
        }

        public Instant at(int step) {
            return last.plus(interval.multipliedBy(step));
        }
    }

    protected static ForecastPoint point(StepClock clock, int step, double predicted, double confidence, double halfWidth) {
        return ForecastPoint.of(clock.at(step), predicted, confidence, halfWidth);
    }
}
