package org.hastats.migrations.pipeline.error;

/** The sink rejected our credentials. Never retried; aborts the run. */
public class SinkAuthenticationException extends MigrationException {

    public SinkAuthenticationException(String message) {
        super(message);
    }
}
