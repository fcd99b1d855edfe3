package com.stg2va.core.error;

/**
 * A configuration file exists but cannot be read or parsed.
 */
public class ConfigurationException extends StgCompilationException {

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
