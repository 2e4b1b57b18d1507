package com.fleet.anomaly.exception;

/**
 * An analysis parameter is out of range. Raised before any computation starts.
 */
public class ConfigurationException extends AnalysisException {

    public ConfigurationException(String message) {
        super(message);
    }
}
