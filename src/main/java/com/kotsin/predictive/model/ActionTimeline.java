package com.kotsin.predictive.model;

import lombok.Value;

import java.util.List;

/**
 * Recommendation titles bucketed by urgency.
 */
@Value
public class ActionTimeline {
    List<String> immediate;
    List<String> shortTerm;
    List<String> longTerm;
}
