package org.hastats.migrations.pipeline.error;

import lombok.Getter;

/** A batch write to the sink failed in a way that may succeed on retry. */
public class SinkWriteException extends MigrationException {

    /** HTTP-style status of the failed write, or -1 when no response was received. */
    @Getter
    private final int statusCode;

    public SinkWriteException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** Connection failures, throttling and server errors are worth retrying; other rejections are not. */
    public boolean isRetryable() {
        return statusCode == -1 || statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
