package com.groundwave.zettelkasten.error;

/**
 * Missing or malformed zettelkasten configuration.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
