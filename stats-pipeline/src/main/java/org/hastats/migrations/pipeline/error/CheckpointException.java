package org.hastats.migrations.pipeline.error;

/** The checkpoint file could not be read or written. */
public class CheckpointException extends MigrationException {

    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
