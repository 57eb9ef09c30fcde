package com.kotsin.predictive.config;

import com.kotsin.predictive.exception.ConfigurationException;
import com.kotsin.predictive.model.ForecastModelType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for trend, anomaly, forecast and recommendation analytics.
 *
 * Defaults are resolved here once; components read the typed values and never merge
 * partial settings per call. {@code new AnalyticsConfig()} gives the same defaults as
 * an empty application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsConfig {

    // ========== ANOMALY DETECTION ==========
    private AnomalyDetection anomalyDetection = new AnomalyDetection();

    @Data
    public static class AnomalyDetection {
        private boolean enabled = true;
        private Sensitivity sensitivity = Sensitivity.MEDIUM;
        /** Validated and carried with the settings; detection scores the whole history. */
        private int lookbackPeriod = 30;
        private int minDataPoints = 10;

        public AnomalyDetection copy() {
            AnomalyDetection copy = new AnomalyDetection();
            copy.setEnabled(enabled);
            copy.setSensitivity(sensitivity);
            copy.setLookbackPeriod(lookbackPeriod);
            copy.setMinDataPoints(minDataPoints);
            return copy;
        }
    }

    /**
     * z-score threshold an observation must exceed to be flagged.
     */
    public enum Sensitivity {
        LOW(2.0),
        MEDIUM(1.5),
        HIGH(1.0);

        private final double zThreshold;

        Sensitivity(double zThreshold) {
            this.zThreshold = zThreshold;
        }

        public double zThreshold() {
            return zThreshold;
        }
    }

    // ========== FORECASTING ==========
    private Forecasting forecasting = new Forecasting();

    @Data
    public static class Forecasting {
        private boolean enabled = true;
        private int horizon = 14;
        /** Hours a forecast stays valid. */
        private int updateFrequency = 24;
        private List<String> models = new ArrayList<>(List.of("linear", "exponential", "seasonal", "arima"));

        /**
         * Model tags as types, in configured order.
         *
         * @throws ConfigurationException on an unknown tag
         */
        public List<ForecastModelType> resolveModels() {
            List<ForecastModelType> types = new ArrayList<>();
            for (String code : models) {
                ForecastModelType type = ForecastModelType.fromCode(code);
                if (!types.contains(type)) {
                    types.add(type);
                }
            }
            return types;
        }

        public Forecasting copy() {
            Forecasting copy = new Forecasting();
            copy.setEnabled(enabled);
            copy.setHorizon(horizon);
            copy.setUpdateFrequency(updateFrequency);
            copy.setModels(models != null ? new ArrayList<>(models) : null);
            return copy;
        }
    }

    // ========== RECOMMENDATIONS ==========
    private Recommendations recommendations = new Recommendations();

    @Data
    public static class Recommendations {
        private boolean enabled = true;
        private int maxRecommendations = 10;
        private double minConfidence = 0.6;

        public Recommendations copy() {
            Recommendations copy = new Recommendations();
            copy.setEnabled(enabled);
            copy.setMaxRecommendations(maxRecommendations);
            copy.setMinConfidence(minConfidence);
            return copy;
        }
    }

    // ========== EXECUTION ==========
    private Execution execution = new Execution();

    @Data
    public static class Execution {
        private int parallelism = 4;
        private int queueCapacity = 100;
        private Duration timeout = Duration.ofSeconds(30);

        public Execution copy() {
            Execution copy = new Execution();
            copy.setParallelism(parallelism);
            copy.setQueueCapacity(queueCapacity);
            copy.setTimeout(timeout);
            return copy;
        }
    }

    // ========== DASHBOARD CACHE ==========
    private Cache cache = new Cache();

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(5);
        private long maximumSize = 256;

        public Cache copy() {
            Cache copy = new Cache();
            copy.setEnabled(enabled);
            copy.setTtl(ttl);
            copy.setMaximumSize(maximumSize);
            return copy;
        }
    }

    /**
     * Detached deep copy. Components take one at construction so that later edits to
     * the bound config never change a pass already wired.
     */
    public AnalyticsConfig snapshot() {
        AnalyticsConfig copy = new AnalyticsConfig();
        copy.setAnomalyDetection(anomalyDetection.copy());
        copy.setForecasting(forecasting.copy());
        copy.setRecommendations(recommendations.copy());
        copy.setExecution(execution.copy());
        copy.setCache(cache.copy());
        return copy;
    }

    /**
     * Collect every invalid setting. Empty list means the config is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (anomalyDetection.getSensitivity() == null) {
            errors.add("analytics.anomaly-detection.sensitivity must be one of low, medium, high");
        }
        if (anomalyDetection.getMinDataPoints() < 1) {
            errors.add("analytics.anomaly-detection.min-data-points must be >= 1, got " + anomalyDetection.getMinDataPoints());
        }
        if (anomalyDetection.getLookbackPeriod() < 1) {
            errors.add("analytics.anomaly-detection.lookback-period must be >= 1, got " + anomalyDetection.getLookbackPeriod());
        }

        if (forecasting.getHorizon() < 1) {
            errors.add("analytics.forecasting.horizon must be >= 1, got " + forecasting.getHorizon());
        }
        if (forecasting.getUpdateFrequency() < 1) {
            errors.add("analytics.forecasting.update-frequency must be >= 1, got " + forecasting.getUpdateFrequency());
        }
        if (forecasting.getModels() == null || forecasting.getModels().isEmpty()) {
            errors.add("analytics.forecasting.models must name at least one model");
        } else {
            for (String code : forecasting.getModels()) {
                try {
                    ForecastModelType.fromCode(code);
                } catch (ConfigurationException e) {
                    errors.add("analytics.forecasting.models: " + e.getMessage());
                }
            }
        }

        if (recommendations.getMaxRecommendations() < 0) {
            errors.add("analytics.recommendations.max-recommendations must be >= 0, got "
                    + recommendations.getMaxRecommendations());
        }
        double minConfidence = recommendations.getMinConfidence();
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            errors.add("analytics.recommendations.min-confidence must be within [0, 1], got " + minConfidence);
        }

        if (execution.getParallelism() < 1) {
            errors.add("analytics.execution.parallelism must be >= 1, got " + execution.getParallelism());
        }
        if (execution.getTimeout() == null || execution.getTimeout().isNegative() || execution.getTimeout().isZero()) {
            errors.add("analytics.execution.timeout must be positive");
        }
        if (cache.isEnabled() && (cache.getTtl() == null || cache.getTtl().isNegative() || cache.getTtl().isZero())) {
            errors.add("analytics.cache.ttl must be positive when the cache is enabled");
        }
        return errors;
    }

    /**
     * @throws ConfigurationException listing every invalid setting
     */
    public AnalyticsConfig validated() {
        List<String> errors = validate();
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid analytics configuration: " + String.join("; ", errors));
        }
        return this;
    }
}
