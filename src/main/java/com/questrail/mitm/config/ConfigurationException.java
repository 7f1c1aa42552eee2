package com.questrail.mitm.config;

/**
 * Raised when textual configuration cannot be turned into a valid
 * {@link SimulationConfig}. The message names the offending option.
 */
public final class ConfigurationException extends RuntimeException
{
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
