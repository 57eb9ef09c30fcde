package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;

/**
 * One observation flagged by the rolling z-score detector.
 */
@Value
@Builder
public class AnomalyRecord {

    String metric;
    int index;
    Instant timestamp;
    double observedValue;
    double expectedValue;
    double deviation;
    double zScore;
    Severity severity;
    double confidence;
    AnomalyKind kind;
    String description;

    public boolean isSevere() {
        return severity == Severity.CRITICAL || severity == Severity.HIGH;
    }

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum AnomalyKind {
        SPIKE,
        DROP,
        OUTLIER,
        PATTERN_BREAK;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
