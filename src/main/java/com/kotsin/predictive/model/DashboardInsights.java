package com.kotsin.predictive.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * DashboardInsights - Consolidated payload combining every analytics stage.
 *
 * Safe to share between callers: all collections are immutable.
 */
@Value
@Builder
public class DashboardInsights {

    DashboardSummary summary;
    List<TrendAnalysis> trends;
    List<AnomalyRecord> anomalies;
    List<Forecast> forecasts;
    List<EnsembleForecast> ensembles;
    List<Recommendation> recommendations;
    MarketOutlook marketOutlook;
    RiskAssessment riskAssessment;
    AnomalyContextReport.AlertLevel alertLevel;
    List<AnalyticsInsight> insights;
    Instant generatedAt;
}
