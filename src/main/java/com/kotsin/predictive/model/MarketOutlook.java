package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Direction of near-term forecasts aggregated across metrics.
 */
@Value
@Builder
public class MarketOutlook {

    Outlook outlook;
    double confidence;
    List<String> factors;

    public static MarketOutlook neutral() {
        return new MarketOutlook(Outlook.NEUTRAL, 0.0, List.of());
    }

    public enum Outlook {
        POSITIVE,
        NEUTRAL,
        NEGATIVE;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
