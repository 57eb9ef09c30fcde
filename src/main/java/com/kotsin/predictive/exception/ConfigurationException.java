package com.kotsin.predictive.exception;

/**
 * Invalid analytics configuration, e.g. an unknown forecast model tag.
 */
public class ConfigurationException extends AnalyticsException {

    public ConfigurationException(String message) {
        super(message);
    }
}
