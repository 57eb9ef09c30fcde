package com.kotsin.predictive.recommendation;

import com.kotsin.predictive.config.AnalyticsConfig;
import com.kotsin.predictive.model.AnomalyRecord;
import com.kotsin.predictive.model.Forecast;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.model.Recommendation;
import com.kotsin.predictive.model.Recommendation.Category;
import com.kotsin.predictive.model.Recommendation.Level;
import com.kotsin.predictive.model.Recommendation.Priority;
import com.kotsin.predictive.model.TrendAnalysis;
import com.kotsin.predictive.model.TrendAnalysis.TrendDirection;
import com.kotsin.predictive.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * RecommendationGenerator - Turns trends, anomalies and forecasts into action items.
 *
 * Rules:
 * - Strong decline (strength > 0.7, slope < -0.5) → HIGH risk mitigation
 * - Strong growth (strength > 0.7, slope > 0.5) → MEDIUM opportunity
 * - Any critical/high anomaly → one CRITICAL risk mitigation covering all of them
 * - Confident near-term forecast moving more than 10% → opportunity or risk mitigation
 *
 * Output is filtered by min-confidence, ordered by (priority, confidence) descending
 * and truncated to max-recommendations.
 */
@Service
@Slf4j
public class RecommendationGenerator {

    private static final double STRONG_TREND_STRENGTH = 0.7;
    private static final double STRONG_SLOPE = 0.5;
    private static final int NEAR_TERM_POINTS = 3;
    private static final double FORECAST_CONFIDENCE_THRESHOLD = 0.7;
    private static final double SIGNIFICANT_CHANGE_PERCENT = 10.0;
    private static final double LARGE_CHANGE_PERCENT = 20.0;

    static final Comparator<Recommendation> PRIORITY_ORDER = Comparator
            .comparingInt((Recommendation r) -> r.getPriority().rank()).reversed()
            .thenComparing(Comparator.comparingDouble(Recommendation::getConfidence).reversed());

    private final AnalyticsConfig.Recommendations settings;
    private final Clock clock;

    @Autowired
    public RecommendationGenerator(AnalyticsConfig config, Clock clock) {
        this.settings = config.getRecommendations().copy();
        this.clock = clock;
    }

    public RecommendationGenerator(AnalyticsConfig config) {
        this(config, Clock.systemUTC());
    }

    public List<Recommendation> generate(List<TrendAnalysis> trends, List<AnomalyRecord> anomalies,
                                         List<Forecast> forecasts) {
        if (!settings.isEnabled()) {
            return List.of();
        }

        Instant now = clock.instant();
        List<Recommendation> candidates = new ArrayList<>();

        for (TrendAnalysis trend : trends) {
            if (trend.getStrength() <= STRONG_TREND_STRENGTH) {
                continue;
            }
            if (trend.getDirection() == TrendDirection.DECREASING && trend.getSlope() < -STRONG_SLOPE) {
                candidates.add(buildDeclineRecommendation(trend, now));
            } else if (trend.getDirection() == TrendDirection.INCREASING && trend.getSlope() > STRONG_SLOPE) {
                candidates.add(buildGrowthRecommendation(trend, now));
            }
        }

        List<AnomalyRecord> severe = anomalies.stream()
                .filter(AnomalyRecord::isSevere)
                .collect(Collectors.toList());
        if (!severe.isEmpty()) {
            candidates.add(buildAnomalyRecommendation(severe, now));
        }

        for (Forecast forecast : forecasts) {
            Recommendation recommendation = buildForecastRecommendation(forecast, now);
            if (recommendation != null) {
                candidates.add(recommendation);
            }
        }

        List<Recommendation> result = candidates.stream()
                .filter(r -> r.getConfidence() >= settings.getMinConfidence())
                .sorted(PRIORITY_ORDER)
                .limit(settings.getMaxRecommendations())
                .collect(Collectors.toList());

        log.debug("[RECOMMEND] candidates={} kept={}", candidates.size(), result.size());
        return List.copyOf(result);
    }

    // ======================== TRENDS ========================

    private Recommendation buildDeclineRecommendation(TrendAnalysis trend, Instant now) {
        String metric = trend.getMetric();
        return Recommendation.builder()
                .id("trend-" + metric + "-decline")
                .title("Declining " + metric + " Trend Detected")
                .description(metric + " has been declining with high confidence ("
                        + MathUtils.format1(trend.getStrength() * 100) + "%). Immediate action may be required.")
                .priority(Priority.HIGH)
                .category(Category.RISK_MITIGATION)
                .confidence(trend.getStrength())
                .impact(Level.HIGH)
                .effort(Level.MEDIUM)
                .suggestedActions(List.of(
                        "Investigate root causes of " + metric + " decline",
                        "Review recent changes in processes or market conditions",
                        "Implement corrective measures based on findings",
                        "Monitor closely for improvement"))
                .relatedMetrics(List.of(metric))
                .timeframe("1-2 weeks")
                .createdAt(now)
                .build();
    }

    private Recommendation buildGrowthRecommendation(TrendAnalysis trend, Instant now) {
        String metric = trend.getMetric();
        return Recommendation.builder()
                .id("trend-" + metric + "-growth")
                .title("Strong Growth in " + metric)
                .description(metric + " shows strong positive trend. Consider scaling successful strategies.")
                .priority(Priority.MEDIUM)
                .category(Category.OPPORTUNITY)
                .confidence(trend.getStrength())
                .impact(Level.MEDIUM)
                .effort(Level.LOW)
                .suggestedActions(List.of(
                        "Analyze factors contributing to growth",
                        "Scale successful strategies",
                        "Allocate additional resources to maintain momentum",
                        "Document best practices for replication"))
                .relatedMetrics(List.of(metric))
                .timeframe("2-4 weeks")
                .createdAt(now)
                .build();
    }

    // ======================== ANOMALIES ========================

    private Recommendation buildAnomalyRecommendation(List<AnomalyRecord> severe, Instant now) {
        double confidence = severe.stream().mapToDouble(AnomalyRecord::getConfidence).max().orElse(0.0);
        List<String> metrics = severe.stream()
                .map(AnomalyRecord::getMetric)
                .distinct()
                .collect(Collectors.toList());
        return Recommendation.builder()
                .id("anomalies-critical")
                .title("Critical Anomalies Detected")
                .description(severe.size() + " critical anomalies detected across metrics. Immediate investigation recommended.")
                .priority(Priority.CRITICAL)
                .category(Category.RISK_MITIGATION)
                .confidence(confidence)
                .impact(Level.HIGH)
                .effort(Level.HIGH)
                .suggestedActions(List.of(
                        "Investigate all critical anomalies immediately",
                        "Check for system issues or data quality problems",
                        "Implement monitoring alerts for similar patterns",
                        "Review and update anomaly detection thresholds"))
                .relatedMetrics(List.copyOf(metrics))
                .timeframe("Immediate")
                .createdAt(now)
                .build();
    }

    // ======================== FORECASTS ========================

    /**
     * @return recommendation, or null when the near-term forecast is not confident or not moving enough
     */
    private Recommendation buildForecastRecommendation(Forecast forecast, Instant now) {
        List<ForecastPoint> nearTerm = forecast.nearTerm(NEAR_TERM_POINTS);
        if (nearTerm.isEmpty()) {
            return null;
        }
        double avgConfidence = nearTerm.stream().mapToDouble(ForecastPoint::getConfidence).average().orElse(0.0);
        if (avgConfidence <= FORECAST_CONFIDENCE_THRESHOLD) {
            return null;
        }

        double current = nearTerm.get(0).getPredictedValue();
        double future = nearTerm.get(nearTerm.size() - 1).getPredictedValue();
        double changePercent = MathUtils.safePercentageChange(future, current, 0.0);
        double magnitude = Math.abs(changePercent);
        if (magnitude <= SIGNIFICANT_CHANGE_PERCENT) {
            return null;
        }

        String metric = forecast.getMetric();
        boolean growth = changePercent > 0;
        boolean large = magnitude > LARGE_CHANGE_PERCENT;
        return Recommendation.builder()
                .id("forecast-" + metric + "-change")
                .title("Significant " + metric + " Change Predicted")
                .description("Forecast indicates " + (growth ? "increase" : "decrease") + " of "
                        + MathUtils.format1(magnitude) + "% in " + metric + " over next few periods.")
                .priority(large ? Priority.HIGH : Priority.MEDIUM)
                .category(growth ? Category.OPPORTUNITY : Category.RISK_MITIGATION)
                .confidence(avgConfidence)
                .impact(large ? Level.HIGH : Level.MEDIUM)
                .effort(Level.MEDIUM)
                .suggestedActions(List.of(
                        growth ? "Prepare to capitalize on predicted growth"
                                : "Prepare mitigation strategies for predicted decline",
                        "Adjust resource allocation based on forecast",
                        "Monitor actual vs predicted values closely",
                        "Update forecasting models with new data"))
                .relatedMetrics(List.of(metric))
                .estimatedValue(magnitude)
                .timeframe("1-3 weeks")
                .createdAt(now)
                .build();
    }
}
