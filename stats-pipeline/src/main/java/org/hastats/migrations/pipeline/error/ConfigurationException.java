package org.hastats.migrations.pipeline.error;

/** Invalid or missing configuration. */
public class ConfigurationException extends MigrationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
