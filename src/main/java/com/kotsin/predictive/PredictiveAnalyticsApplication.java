package com.kotsin.predictive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application hosting the predictive analytics core.
 */
@SpringBootApplication
public class PredictiveAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PredictiveAnalyticsApplication.class, args);
    }
}
