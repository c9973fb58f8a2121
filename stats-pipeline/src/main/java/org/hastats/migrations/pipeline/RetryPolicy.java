package org.hastats.migrations.pipeline;

import java.time.Duration;

import org.hastats.migrations.pipeline.error.SinkAuthenticationException;
import org.hastats.migrations.pipeline.error.SinkWriteException;

import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Bounded exponential backoff applied to batch-level reads and writes.
 */
public record RetryPolicy(int maxRetries, Duration minBackoff, Duration maxBackoff) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(30));

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
    }

    /**
     * Backoff spec that retries everything except failures known to be permanent, and rethrows
     * the last failure unchanged once retries are exhausted.
     */
    public RetryBackoffSpec toSpec() {
        return Retry.backoff(maxRetries, minBackoff)
            .maxBackoff(maxBackoff)
            .filter(RetryPolicy::isRetryable)
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public static boolean isRetryable(Throwable t) {
        if (t instanceof SinkAuthenticationException) {
            return false;
        }
        if (t instanceof SinkWriteException writeFailure) {
            return writeFailure.isRetryable();
        }
        return true;
    }
}
