package com.raidxp.api.exceptions;

/**
 * Exception thrown when process configuration holds an invalid value.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
