package org.hastats.migrations.pipeline.progress;

import org.hastats.migrations.pipeline.ir.SeriesTier;

import lombok.Builder;

/**
 * A unit of observable progress. Counts prefixed with {@code batch} describe the step that
 * produced the event; {@code total*} counts are run-wide as of this event.
 *
 * @param externalId null for {@link Phase#METADATA_PAGE}
 * @param tier null unless the phase is {@link Phase#RECORD_BATCH}
 * @param estimatedEntities -1 when the source could not estimate it
 */
@Builder
public record ProgressEvent(
    Phase phase,
    String externalId,
    SeriesTier tier,
    long batchProcessed,
    long batchAccepted,
    long batchCorrected,
    long batchDropped,
    long batchWritten,
    long totalProcessed,
    long totalWritten,
    long totalCorrected,
    long totalDropped,
    long entitiesCompleted,
    long entitiesFailed,
    long entitiesSkipped,
    long estimatedEntities,
    boolean dryRun,
    String message
) {

    public enum Phase {
        METADATA_PAGE,
        RECORD_BATCH,
        ENTITY_COMPLETED,
        ENTITY_FAILED
    }

    /**
     * Share of estimated entities that are finished, or -1 when there is no estimate. Entities an
     * earlier run already completed count as finished.
     */
    public double percentComplete() {
        if (estimatedEntities <= 0) {
            return -1;
        }
        long finished = entitiesCompleted + entitiesFailed + entitiesSkipped;
        return Math.min(100.0, 100.0 * finished / estimatedEntities);
    }
}
