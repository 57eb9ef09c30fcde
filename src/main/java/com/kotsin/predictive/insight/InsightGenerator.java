package com.kotsin.predictive.insight;

import com.kotsin.predictive.model.AnalyticsInsight;
import com.kotsin.predictive.model.AnalyticsInsight.InsightType;
import com.kotsin.predictive.model.AnomalyRecord;
import com.kotsin.predictive.model.Forecast;
import com.kotsin.predictive.model.Recommendation;
import com.kotsin.predictive.model.TrendAnalysis;
import com.kotsin.predictive.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks trends, anomalies, forecasts and recommendations into dashboard headlines.
 *
 * Relevance is the artifact's own confidence measure (trend strength, anomaly
 * confidence, forecast accuracy, recommendation confidence).
 */
@Slf4j
@Component
public class InsightGenerator {

    private static final double MIN_TREND_STRENGTH = 0.5;
    private static final double MIN_ANOMALY_CONFIDENCE = 0.6;
    private static final double MIN_FORECAST_ACCURACY = 0.5;
    private static final Duration ANOMALY_TTL = Duration.ofDays(7);
    private static final Duration RECOMMENDATION_TTL = Duration.ofDays(30);

    private final Clock clock;

    @Autowired
    public InsightGenerator(Clock clock) {
        this.clock = clock;
    }

    public InsightGenerator() {
        this(Clock.systemUTC());
    }

    public List<AnalyticsInsight> generate(List<TrendAnalysis> trends, List<AnomalyRecord> anomalies,
                                           List<Forecast> forecasts, List<Recommendation> recommendations) {
        Instant now = clock.instant();
        long stamp = now.toEpochMilli();
        List<AnalyticsInsight> insights = new ArrayList<>();

        for (TrendAnalysis trend : trends) {
            if (trend.getStrength() > MIN_TREND_STRENGTH) {
                insights.add(AnalyticsInsight.builder()
                        .id("trend-" + trend.getMetric() + "-" + stamp)
                        .type(InsightType.TREND)
                        .title(trend.getMetric() + " Trend Analysis")
                        .summary(trend.getMetric() + " shows " + trend.getDirection().code() + " trend with "
                                + MathUtils.format1(trend.getStrength() * 100) + "% confidence")
                        .subject(trend)
                        .relevanceScore(trend.getStrength())
                        .createdAt(now)
                        .build());
            }
        }

        for (AnomalyRecord anomaly : anomalies) {
            if (anomaly.getConfidence() > MIN_ANOMALY_CONFIDENCE) {
                insights.add(AnalyticsInsight.builder()
                        .id("anomaly-" + anomaly.getMetric() + "-" + anomaly.getIndex() + "-" + stamp)
                        .type(InsightType.ANOMALY)
                        .title("Anomaly Detected")
                        .summary(anomaly.getKind().code() + " detected with " + anomaly.getSeverity().code() + " severity")
                        .subject(anomaly)
                        .relevanceScore(anomaly.getConfidence())
                        .createdAt(now)
                        .expiresAt(now.plus(ANOMALY_TTL))
                        .build());
            }
        }

        for (Forecast forecast : forecasts) {
            if (forecast.getAccuracy() > MIN_FORECAST_ACCURACY) {
                insights.add(AnalyticsInsight.builder()
                        .id("forecast-" + forecast.getMetric() + "-" + stamp)
                        .type(InsightType.FORECAST)
                        .title(forecast.getMetric() + " Forecast")
                        .summary(forecast.getPoints().size() + " step forecast with "
                                + MathUtils.format1(forecast.getAccuracy() * 100) + "% accuracy")
                        .subject(forecast)
                        .relevanceScore(forecast.getAccuracy())
                        .createdAt(now)
                        .expiresAt(forecast.getValidUntil())
                        .build());
            }
        }

        for (Recommendation recommendation : recommendations) {
            insights.add(AnalyticsInsight.builder()
                    .id(recommendation.getId())
                    .type(InsightType.RECOMMENDATION)
                    .title(recommendation.getTitle())
                    .summary(recommendation.getDescription())
                    .subject(recommendation)
                    .relevanceScore(recommendation.getConfidence())
                    .createdAt(now)
                    .expiresAt(now.plus(RECOMMENDATION_TTL))
                    .build());
        }

        insights.sort(Comparator.comparingDouble(AnalyticsInsight::getRelevanceScore).reversed());
        log.debug("[INSIGHT] generated={}", insights.size());
        return List.copyOf(insights);
    }
}
