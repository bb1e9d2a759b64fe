package de.bsommerfeld.patchfetcher.core.config;

/**
 * Thrown when the configuration or a patch list cannot be read or fails
 * validation. Always fatal for the run.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
