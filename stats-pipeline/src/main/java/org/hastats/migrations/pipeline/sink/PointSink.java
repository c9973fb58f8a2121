package org.hastats.migrations.pipeline.sink;

import java.util.List;

import org.hastats.migrations.pipeline.ir.SeriesTier;
import org.hastats.migrations.pipeline.ir.SinkPoint;

import reactor.core.publisher.Mono;

/**
 * Port for writing points to any time-series target (InfluxDB, test collector).
 *
 * Writes are keyed by {@code (measurement, tags, timestamp)} and overwrite on a duplicate key,
 * so re-sending a batch after a crash does not duplicate data.
 */
public interface PointSink extends AutoCloseable {

    /**
     * Write a batch as one unit. The returned Mono is cold: every subscription performs the
     * write again, which is what batch-level retries rely on.
     */
    Mono<WriteResult> writeBatch(SeriesTier tier, List<SinkPoint> batch);

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
