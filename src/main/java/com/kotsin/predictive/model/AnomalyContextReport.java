package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Anomalies across all metrics with summary, follow-up advice and an alert level.
 */
@Value
@Builder
public class AnomalyContextReport {

    List<AnomalyRecord> anomalies;
    AnomalySummary summary;
    List<String> recommendations;
    AlertLevel alertLevel;

    public enum AlertLevel {
        NORMAL,
        WARNING,
        CRITICAL;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
