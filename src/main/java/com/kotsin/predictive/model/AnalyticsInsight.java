package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;

/**
 * Relevance-ranked headline about a trend, anomaly, forecast or recommendation.
 * subject holds the artifact the insight is about.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalyticsInsight {

    String id;
    InsightType type;
    String title;
    String summary;
    Object subject;
    double relevanceScore;
    Instant createdAt;
    Instant expiresAt;

    public enum InsightType {
        TREND,
        ANOMALY,
        FORECAST,
        RECOMMENDATION;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
