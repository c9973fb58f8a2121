package org.hastats.migrations.pipeline.sink;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.hastats.migrations.pipeline.ir.SeriesTier;
import org.hastats.migrations.pipeline.ir.SinkPoint;

import reactor.core.publisher.Mono;

/**
 * A PointSink that keeps everything in memory, for exercising the pipeline without a real
 * time-series database and for asserting on what would have been written.
 */
public class CollectingPointSink implements PointSink {

    private final List<SinkPoint> points = new CopyOnWriteArrayList<>();
    private final List<Integer> batchSizes = new CopyOnWriteArrayList<>();

    @Override
    public Mono<WriteResult> writeBatch(SeriesTier tier, List<SinkPoint> batch) {
        return Mono.fromCallable(() -> {
            points.addAll(batch);
            batchSizes.add(batch.size());
            return new WriteResult(tier, batch.size(), Duration.ZERO);
        });
    }

    public List<SinkPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public List<Integer> getBatchSizes() {
        return Collections.unmodifiableList(batchSizes);
    }

    public int getLargestBatch() {
        return batchSizes.stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}
