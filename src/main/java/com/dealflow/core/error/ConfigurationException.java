package com.dealflow.core.error;

/**
 * Thrown when the decision rule catalog is malformed or used before initialization.
 */
public class ConfigurationException extends SupervisorException {

    public ConfigurationException(String message) {
        super(message);
    }
}
