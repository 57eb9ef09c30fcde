package com.kotsin.predictive.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fails startup when the analytics settings cannot be used.
 *
 * Unknown forecast model tags, a non-positive horizon or a min-confidence outside [0, 1]
 * would otherwise surface only on the first request.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final AnalyticsConfig config;

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        log.info("Validating analytics configuration...");

        List<String> errors = config.validate();

        if (!errors.isEmpty()) {
            log.error("Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        log.info("Configuration validation passed: models={}, horizon={}, sensitivity={}",
                config.getForecasting().getModels(),
                config.getForecasting().getHorizon(),
                config.getAnomalyDetection().getSensitivity());
    }
}
