package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Detected repeating pattern of one metric. Period, strength and the next
 * peak/trough are present only when hasSeasonality is true.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SeasonalInsight {

    String metric;
    boolean hasSeasonality;
    Integer period;
    Double strength;
    Instant nextPeak;
    Instant nextTrough;

    public static SeasonalInsight none(String metric) {
        return SeasonalInsight.builder().metric(metric).hasSeasonality(false).build();
    }
}
