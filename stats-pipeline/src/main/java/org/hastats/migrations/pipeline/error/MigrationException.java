package org.hastats.migrations.pipeline.error;

/**
 * Base type for all failures raised by the migration pipeline and its adapters.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
