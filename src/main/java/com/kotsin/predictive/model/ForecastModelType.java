package com.kotsin.predictive.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.kotsin.predictive.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Tags of the forecast model family.
 */
public enum ForecastModelType {
    LINEAR,
    EXPONENTIAL,
    SEASONAL,
    ARIMA;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a configured model tag (case-insensitive).
     *
     * @throws ConfigurationException for unknown tags
     */
    public static ForecastModelType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toUpperCase(Locale.ROOT);
            for (ForecastModelType type : values()) {
                if (type.name().equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ConfigurationException(String.format("Unknown forecast model '%s' (supported: %s)",
                code, Arrays.stream(values()).map(ForecastModelType::code).collect(Collectors.joining(", "))));
    }
}
