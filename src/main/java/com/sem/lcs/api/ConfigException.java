package com.sem.lcs.api;

/**
 * Malformed or contradictory structural configuration.
 *
 * <p>
 * Raised before any registry is populated, so a failed build never leaves a
 * partially assembled specification behind.
 */
public class ConfigException extends LcsException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
