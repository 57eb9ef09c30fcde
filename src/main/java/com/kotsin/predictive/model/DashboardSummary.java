package com.kotsin.predictive.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DashboardSummary {

    int totalMetrics;
    int trendsAnalyzed;
    int anomaliesDetected;
    int forecastsGenerated;
    int recommendationsCount;
}
