package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Portfolio-level risk derived from strong decreasing and volatile trends.
 */
@Value
@Builder
public class RiskAssessment {

    RiskLevel level;
    List<String> factors;
    List<String> mitigation;

    public static RiskAssessment low() {
        return new RiskAssessment(RiskLevel.LOW, List.of(), List.of());
    }

    public enum RiskLevel {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
