package com.kotsin.predictive.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wire shape of result objects under the snake_case mapper used by the application.
 */
class AnalyticsJsonTest {

    private final JsonMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    @Test
    @DisplayName("Trend: snake_case keys, lowercase direction, ISO dates")
    void testTrendAnalysisJson() {
        TrendAnalysis trend = TrendAnalysis.builder()
                .metric("revenue")
                .direction(TrendAnalysis.TrendDirection.INCREASING)
                .strength(0.95)
                .slope(2.0)
                .rSquared(0.95)
                .period(AggregationPeriod.DAILY)
                .sampleCount(30)
                .startDate(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        JsonNode json = mapper.valueToTree(trend);

        assertEquals(0.95, json.get("r_squared").asDouble());
        assertFalse(json.has("rsquared"));
        assertEquals("increasing", json.get("direction").asText());
        assertEquals(30, json.get("sample_count").asInt());
        assertEquals("2024-01-01T00:00:00Z", json.get("start_date").asText());
    }

    @Test
    @DisplayName("Recommendation: enum codes and no null estimated value")
    void testRecommendationJson() {
        Recommendation recommendation = Recommendation.builder()
                .id("trend-revenue-decline")
                .priority(Recommendation.Priority.HIGH)
                .category(Recommendation.Category.RISK_MITIGATION)
                .impact(Recommendation.Level.HIGH)
                .effort(Recommendation.Level.MEDIUM)
                .confidence(0.9)
                .suggestedActions(List.of("Investigate"))
                .build();

        JsonNode json = mapper.valueToTree(recommendation);

        assertEquals("risk_mitigation", json.get("category").asText());
        assertEquals("high", json.get("priority").asText());
        assertEquals("medium", json.get("effort").asText());
        assertEquals("Investigate", json.get("suggested_actions").get(0).asText());
        assertFalse(json.has("estimated_value"));
    }

    @Test
    @DisplayName("Seasonal insight: has_seasonality flag, optional fields omitted when absent")
    void testSeasonalInsightJson() {
        JsonNode none = mapper.valueToTree(SeasonalInsight.none("revenue"));
        assertFalse(none.get("has_seasonality").asBoolean());
        assertFalse(none.has("period"));

        JsonNode weekly = mapper.valueToTree(SeasonalInsight.builder()
                .metric("sessions")
                .hasSeasonality(true)
                .period(7)
                .strength(0.98)
                .build());
        assertTrue(weekly.get("has_seasonality").asBoolean());
        assertEquals(7, weekly.get("period").asInt());
    }

    @Test
    @DisplayName("Ensemble: model weights keyed by model code, models as codes")
    void testEnsembleJson() {
        EnsembleForecast ensemble = EnsembleForecast.builder()
                .metric("revenue")
                .points(List.of())
                .modelWeights(Map.of("linear", 1.0))
                .models(List.of(ForecastModelType.LINEAR))
                .failedModels(List.of(ForecastModelType.ARIMA))
                .build();

        JsonNode json = mapper.valueToTree(ensemble);

        assertEquals(1.0, json.get("model_weights").get("linear").asDouble());
        assertEquals("linear", json.get("models").get(0).asText());
        assertEquals("arima", json.get("failed_models").get(0).asText());
    }
}
