package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Prioritized action item derived from trends, anomalies and forecasts.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Recommendation {

    String id;
    String title;
    String description;
    Priority priority;
    Category category;
    double confidence;
    Level impact;
    Level effort;
    List<String> suggestedActions;
    List<String> relatedMetrics;
    Double estimatedValue;
    String timeframe;
    Instant createdAt;

    public enum Priority {
        LOW(1),
        MEDIUM(2),
        HIGH(3),
        CRITICAL(4);

        private final int rank;

        Priority(int rank) {
            this.rank = rank;
        }

        public int rank() {
            return rank;
        }

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Category {
        OPPORTUNITY,
        RISK_MITIGATION,
        OPTIMIZATION,
        MAINTENANCE;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Impact / effort scale.
     */
    public enum Level {
        LOW(1),
        MEDIUM(2),
        HIGH(3);

        private final int multiplier;

        Level(int multiplier) {
            this.multiplier = multiplier;
        }

        public int multiplier() {
            return multiplier;
        }

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
