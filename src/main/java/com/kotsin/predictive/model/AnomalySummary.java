package com.kotsin.predictive.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Counts of anomalies by severity and kind code, plus mean confidence.
 */
@Value
@Builder
public class AnomalySummary {

    int total;
    Map<String, Integer> bySeverity;
    Map<String, Integer> byKind;
    double averageConfidence;

    public int countSeverity(AnomalyRecord.Severity severity) {
        return bySeverity.getOrDefault(severity.code(), 0);
    }

    public int countKind(AnomalyRecord.AnomalyKind kind) {
        return byKind.getOrDefault(kind.code(), 0);
    }
}
