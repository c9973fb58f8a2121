package org.hastats.migrations.pipeline.sink;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;

import org.hastats.migrations.pipeline.ir.SeriesTier;
import org.hastats.migrations.pipeline.ir.SinkPoint;

import reactor.core.publisher.Mono;

/**
 * Delegates to a CollectingPointSink until a condition says a write should fail.
 */
public class FailingPointSink implements PointSink {

    private final CollectingPointSink delegate = new CollectingPointSink();
    private final AtomicInteger attempts = new AtomicInteger();
    private final Predicate<List<SinkPoint>> shouldFail;
    private final Function<List<SinkPoint>, RuntimeException> failure;

    public FailingPointSink(Predicate<List<SinkPoint>> shouldFail, Function<List<SinkPoint>, RuntimeException> failure) {
        this.shouldFail = shouldFail;
        this.failure = failure;
    }

    /** Accept {@code successfulWrites} batches, then fail every later one. */
    public static FailingPointSink afterWrites(int successfulWrites, RuntimeException failure) {
        var written = new AtomicInteger();
        return new FailingPointSink(batch -> written.getAndIncrement() >= successfulWrites, batch -> failure);
    }

    @Override
    public Mono<WriteResult> writeBatch(SeriesTier tier, List<SinkPoint> batch) {
        return Mono.defer(() -> {
            attempts.incrementAndGet();
            if (shouldFail.test(batch)) {
                return Mono.error(failure.apply(batch));
            }
            return delegate.writeBatch(tier, batch);
        });
    }

    public List<SinkPoint> getPoints() {
        return delegate.getPoints();
    }

    public int getAttempts() {
        return attempts.get();
    }
}
