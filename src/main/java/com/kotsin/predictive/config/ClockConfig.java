package com.kotsin.predictive.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * UTC clock for generated_at / valid_until / created_at stamps. Tests replace it
 * with a fixed clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }
}
