package com.provider.linkage.config;

/**
 * Runtime exception thrown when the priority table, scoring rules or pipeline configuration
 * is unreadable or references an unknown metric or source. Fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
