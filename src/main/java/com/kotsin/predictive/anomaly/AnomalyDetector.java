package com.kotsin.predictive.anomaly;

import com.kotsin.predictive.config.AnalyticsConfig;
import com.kotsin.predictive.model.AnomalyRecord;
import com.kotsin.predictive.model.AnomalyRecord.AnomalyKind;
import com.kotsin.predictive.model.AnomalyRecord.Severity;
import com.kotsin.predictive.model.MetricHistory;
import com.kotsin.predictive.model.MetricObservation;
import com.kotsin.predictive.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * AnomalyDetector - Rolling-window z-score scoring of metric observations
 *
 * For each observation after the first window, the preceding window gives a local
 * baseline: z = |value - mean| / max(std, 1). Observations above the sensitivity
 * threshold are reported.
 *
 * SEVERITY (by z):  > 3 CRITICAL, > 2.5 HIGH, > 2 MEDIUM, else LOW
 * KIND:             above mean + 2σ SPIKE, below mean - 2σ DROP, else OUTLIER
 *
 * The whole history is scored whatever its aggregation period. Thin data (below
 * min-data-points) is not an error: it yields an empty result.
 */
@Slf4j
@Component
public class AnomalyDetector {

    private static final int MAX_WINDOW = 7;
    private static final double CRITICAL_Z = 3.0;
    private static final double HIGH_Z = 2.5;
    private static final double MEDIUM_Z = 2.0;
    private static final double BAND_SIGMAS = 2.0;

    private final AnalyticsConfig.AnomalyDetection settings;

    public AnomalyDetector(AnalyticsConfig config) {
        this.settings = config.getAnomalyDetection().copy();
    }

    public List<AnomalyRecord> detect(MetricHistory history) {
        if (!settings.isEnabled() || history.isEmpty()) {
            return List.of();
        }

        if (history.size() < settings.getMinDataPoints()) {
            log.debug("[ANOMALY] {} | {} points, need {} → skipped",
                    history.getMetricName(), history.size(), settings.getMinDataPoints());
            return List.of();
        }

        double[] values = history.values();
        int window = Math.min(MAX_WINDOW, values.length / 3);
        if (window < 1) {
            return List.of();
        }

        double threshold = settings.getSensitivity().zThreshold();
        List<AnomalyRecord> anomalies = new ArrayList<>();

        for (int i = window; i < values.length; i++) {
            double windowMean = MathUtils.mean(values, i - window, i);
            double windowStd = MathUtils.populationStdDev(values, i - window, i);
            double value = values[i];
            double zScore = Math.abs(value - windowMean) / Math.max(windowStd, 1.0);

            if (zScore > threshold) {
                AnomalyKind kind = classifyKind(value, windowMean, windowStd);
                MetricObservation observation = history.getObservations().get(i);
                anomalies.add(AnomalyRecord.builder()
                        .metric(history.getMetricName())
                        .index(i)
                        .timestamp(observation.getTimestamp())
                        .observedValue(value)
                        .expectedValue(windowMean)
                        .deviation(Math.abs(value - windowMean))
                        .zScore(zScore)
                        .severity(classifySeverity(zScore))
                        .confidence(Math.min(zScore / CRITICAL_Z, 1.0))
                        .kind(kind)
                        .description(String.format("%s detected: %s vs expected %s",
                                kind.code(), MathUtils.format2(value), MathUtils.format2(windowMean)))
                        .build());
            }
        }

        log.debug("[ANOMALY] {} | window={} threshold={} → {} anomalies",
                history.getMetricName(), window, threshold, anomalies.size());
        return anomalies;
    }

    static Severity classifySeverity(double zScore) {
        if (zScore > CRITICAL_Z) return Severity.CRITICAL;
        if (zScore > HIGH_Z) return Severity.HIGH;
        if (zScore > MEDIUM_Z) return Severity.MEDIUM;
        return Severity.LOW;
    }

    static AnomalyKind classifyKind(double value, double mean, double std) {
        if (value > mean + BAND_SIGMAS * std) return AnomalyKind.SPIKE;
        if (value < mean - BAND_SIGMAS * std) return AnomalyKind.DROP;
        return AnomalyKind.OUTLIER;
    }
}
