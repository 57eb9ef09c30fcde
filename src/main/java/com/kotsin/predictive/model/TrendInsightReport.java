package com.kotsin.predictive.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of a batch trend analysis: per-metric trends plus narrative and risk.
 */
@Value
@Builder
public class TrendInsightReport {

    List<TrendAnalysis> trends;
    List<String> insights;
    List<String> actionableSteps;
    RiskAssessment riskAssessment;
}
