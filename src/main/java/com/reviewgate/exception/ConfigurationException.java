package com.reviewgate.exception;

/**
 * Exception thrown when the review policy is invalid.
 * Evaluation never proceeds past one of these: no verdict is produced.
 */
public class ConfigurationException extends ReviewGateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
