package com.kotsin.predictive.trend;

import com.kotsin.predictive.exception.InsufficientDataException;
import com.kotsin.predictive.model.MetricHistory;
import com.kotsin.predictive.model.TrendAnalysis;
import com.kotsin.predictive.model.TrendAnalysis.TrendDirection;
import com.kotsin.predictive.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * TrendAnalyzer - Classifies the direction and strength of a metric's trend
 *
 * METHOD:
 * - OLS of value against observation index (0..n-1), not wall-clock time
 * - strength = min(R², 1)
 *
 * CLASSIFICATION (first match wins):
 * - |slope| < 0.1         → STABLE
 * - R² < 0.3              → VOLATILE
 * - slope > 0             → INCREASING
 * - otherwise             → DECREASING
 */
@Slf4j
@Component
public class TrendAnalyzer {

    public static final int MIN_OBSERVATIONS = 2;

    private static final double STABLE_SLOPE_THRESHOLD = 0.1;
    private static final double VOLATILE_R_SQUARED_THRESHOLD = 0.3;

    /**
     * @throws InsufficientDataException when the history has fewer than two observations
     */
    public TrendAnalysis analyze(MetricHistory history) {
        if (history.size() < MIN_OBSERVATIONS) {
            throw new InsufficientDataException(history.getMetricName(), "trend analysis",
                    MIN_OBSERVATIONS, history.size());
        }

        LinearRegression.Fit fit = LinearRegression.fit(history.values());
        TrendDirection direction = classify(fit.getSlope(), fit.getRSquared());

        log.debug("[TREND] {} | slope={} r2={} → {}", history.getMetricName(),
                MathUtils.format2(fit.getSlope()), MathUtils.format2(fit.getRSquared()), direction);

        return TrendAnalysis.builder()
                .metric(history.getMetricName())
                .direction(direction)
                .strength(Math.min(fit.getRSquared(), 1.0))
                .slope(fit.getSlope())
                .intercept(fit.getIntercept())
                .rSquared(fit.getRSquared())
                .period(history.getAggregationPeriod())
                .sampleCount(history.size())
                .startDate(history.getStartTime())
                .endDate(history.getEndTime())
                .build();
    }

    static TrendDirection classify(double slope, double rSquared) {
        if (Math.abs(slope) < STABLE_SLOPE_THRESHOLD) {
            return TrendDirection.STABLE;
        }
        if (rSquared < VOLATILE_R_SQUARED_THRESHOLD) {
            return TrendDirection.VOLATILE;
        }
        return slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }
}
