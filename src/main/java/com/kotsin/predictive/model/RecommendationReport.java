package com.kotsin.predictive.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RecommendationReport {

    List<Recommendation> recommendations;
    List<String> priorityActions;
    BusinessImpact businessImpact;
    ActionTimeline timeline;
}
