package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;

/**
 * TrendAnalysis - OLS trend of one metric over observation index.
 *
 * strength is min(r², 1); slope is per observation, not per unit of wall-clock time.
 */
@Value
@Builder
public class TrendAnalysis {

    String metric;
    TrendDirection direction;
    double strength;
    double slope;
    double intercept;
    double rSquared;
    AggregationPeriod period;
    int sampleCount;
    Instant startDate;
    Instant endDate;

    @JsonProperty("r_squared")
    public double getRSquared() {
        return rSquared;
    }

    public boolean isStrong(double threshold) {
        return strength > threshold;
    }

    public enum TrendDirection {
        INCREASING,
        DECREASING,
        STABLE,
        VOLATILE;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
