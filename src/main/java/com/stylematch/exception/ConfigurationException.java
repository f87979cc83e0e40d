package com.stylematch.exception;

/**
 * Exception thrown when the property catalog cannot be loaded.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends StyleMatchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
