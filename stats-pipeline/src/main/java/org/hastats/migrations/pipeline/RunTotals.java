package org.hastats.migrations.pipeline;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.hastats.migrations.pipeline.classify.ClassificationSummary;

/**
 * Counters for the current run only. Checkpoint counters cover all runs of a migration.
 */
public class RunTotals {

    private final AtomicLong recordsProcessed = new AtomicLong();
    private final AtomicLong recordsCorrected = new AtomicLong();
    private final AtomicLong recordsDropped = new AtomicLong();
    private final AtomicLong pointsWritten = new AtomicLong();
    private final AtomicLong entitiesCompleted = new AtomicLong();
    private final AtomicLong entitiesFailed = new AtomicLong();
    private final AtomicLong entitiesSkipped = new AtomicLong();
    private final AtomicReference<ClassificationSummary> classification =
        new AtomicReference<>(ClassificationSummary.EMPTY);

    void addBatch(long processed, long corrected, long dropped, long written) {
        recordsProcessed.addAndGet(processed);
        recordsCorrected.addAndGet(corrected);
        recordsDropped.addAndGet(dropped);
        pointsWritten.addAndGet(written);
    }

    void addClassification(ClassificationSummary page) {
        classification.accumulateAndGet(page, ClassificationSummary::plus);
    }

    void entityCompleted() {
        entitiesCompleted.incrementAndGet();
    }

    void entityFailed() {
        entitiesFailed.incrementAndGet();
    }

    void entitySkipped() {
        entitiesSkipped.incrementAndGet();
    }

    public long recordsProcessed() {
        return recordsProcessed.get();
    }

    public long recordsCorrected() {
        return recordsCorrected.get();
    }

    public long recordsDropped() {
        return recordsDropped.get();
    }

    public long pointsWritten() {
        return pointsWritten.get();
    }

    public long entitiesCompleted() {
        return entitiesCompleted.get();
    }

    public long entitiesFailed() {
        return entitiesFailed.get();
    }

    public long entitiesSkipped() {
        return entitiesSkipped.get();
    }

    public ClassificationSummary classification() {
        return classification.get();
    }
}
