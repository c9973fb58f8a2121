package org.hastats.migrations.pipeline.error;

/** A read from the statistics source failed. Treated as transient and retried. */
public class SourceReadException extends MigrationException {

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
