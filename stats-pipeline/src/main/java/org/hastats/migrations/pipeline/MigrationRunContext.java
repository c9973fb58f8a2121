package org.hastats.migrations.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.hastats.migrations.pipeline.checkpoint.CheckpointState;
import org.hastats.migrations.pipeline.checkpoint.CheckpointStore;
import org.hastats.migrations.pipeline.classify.ClassificationSummary;
import org.hastats.migrations.pipeline.ir.ClassifiedEntity;
import org.hastats.migrations.pipeline.ir.ResumePoint;
import org.hastats.migrations.pipeline.ir.SeriesTier;
import org.hastats.migrations.pipeline.progress.ProgressEvent;
import org.hastats.migrations.pipeline.progress.ProgressListener;
import org.hastats.migrations.pipeline.quality.QualityReport;
import org.hastats.migrations.pipeline.quality.ScreenedBatch;
import org.hastats.migrations.pipeline.source.MetadataPage;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Everything one run needs and accumulates, passed explicitly to every stage.
 *
 * The checkpoint is loaded when the context is built. All checkpoint mutations go through this
 * class, and none happen in a dry run.
 */
@Slf4j
@Getter
public class MigrationRunContext {

    private final String runId;
    private final PipelineSettings settings;
    private final boolean dryRun;
    private final CheckpointStore checkpointStore;
    private final CheckpointState checkpoint;
    private final ProgressListener listener;
    private final Clock clock;
    private final Instant startedAt;
    private final QualityReport qualityReport = new QualityReport();
    private final RunTotals totals = new RunTotals();
    private final Map<String, String> failedThisRun = Collections.synchronizedMap(new LinkedHashMap<>());

    private volatile long estimatedEntities = -1;

    /** Set once any entity fails, so the pages holding failed entities are read again next run. */
    private volatile boolean cursorBlocked;

    @Builder
    private MigrationRunContext(String runId,
                                PipelineSettings settings,
                                boolean dryRun,
                                CheckpointStore checkpointStore,
                                ProgressListener listener,
                                Clock clock) {
        this.runId = runId != null ? runId : UUID.randomUUID().toString();
        this.settings = settings != null ? settings : PipelineSettings.defaults();
        this.dryRun = dryRun;
        this.checkpointStore = checkpointStore;
        this.listener = listener != null ? listener : ProgressListener.NONE;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.startedAt = this.clock.instant();
        this.checkpoint = checkpointStore.load()
            .orElseGet(() -> CheckpointState.fresh(this.runId, startedAt));
        // A filtered run skips entities on purpose; the page cursor must not move past them.
        this.cursorBlocked = this.settings.entityIdFilter() != null;
    }

    void setEstimatedEntities(long estimatedEntities) {
        this.estimatedEntities = estimatedEntities;
    }

    boolean shouldExport(ClassifiedEntity entity) {
        if (!settings.matchesFilter(entity.externalId())) {
            return false;
        }
        if (checkpoint.isCompleted(entity.externalId())) {
            totals.entitySkipped();
            return false;
        }
        return true;
    }

    ResumePoint resumePointFor(ClassifiedEntity entity, SeriesTier tier) {
        var last = checkpoint.lastWritten(entity.externalId(), tier);
        return last.isPresent() ? new ResumePoint(entity.entityKey(), last.getAsDouble()) : null;
    }

    ProgressEvent pageClassified(MetadataPage page, ClassificationSummary summary) {
        totals.addClassification(summary);
        return event(ProgressEvent.Phase.METADATA_PAGE)
            .batchProcessed(summary.total())
            .batchAccepted(summary.accepted())
            .message("offset " + page.offset() + ": " + summary.accepted() + " of " + summary.total()
                + " entities accepted, rejected " + summary.rejectedByReason())
            .build();
    }

    /**
     * Account for a batch whose write has been confirmed (or, in a dry run, would have been made).
     *
     * @param lastTimestamp largest source timestamp of the raw batch, dropped records included
     */
    ProgressEvent batchWritten(ClassifiedEntity entity, SeriesTier tier, int processed, ScreenedBatch screened,
                               long written, double lastTimestamp) {
        totals.addBatch(processed, screened.corrected(), screened.dropped(), written);
        if (!dryRun) {
            checkpoint.markWritten(entity.externalId(), tier, lastTimestamp, processed, written);
            persist();
        }
        return event(ProgressEvent.Phase.RECORD_BATCH)
            .externalId(entity.externalId())
            .tier(tier)
            .batchProcessed(processed)
            .batchAccepted(screened.survivors().size())
            .batchCorrected(screened.corrected())
            .batchDropped(screened.dropped())
            .batchWritten(written)
            .build();
    }

    ProgressEvent entityCompleted(ClassifiedEntity entity) {
        totals.entityCompleted();
        failedThisRun.remove(entity.externalId());
        if (!dryRun) {
            checkpoint.markCompleted(entity.externalId());
            persist();
        }
        return event(ProgressEvent.Phase.ENTITY_COMPLETED).externalId(entity.externalId()).build();
    }

    ProgressEvent entityFailed(ClassifiedEntity entity, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        totals.entityFailed();
        failedThisRun.put(entity.externalId(), message);
        cursorBlocked = true;
        if (!dryRun) {
            checkpoint.markFailed(entity.externalId(), message);
            persist();
        }
        return event(ProgressEvent.Phase.ENTITY_FAILED).externalId(entity.externalId()).message(message).build();
    }

    void pageFinished(MetadataPage page) {
        if (dryRun || cursorBlocked) {
            return;
        }
        checkpoint.setMetadataCursor(page.nextOffset());
        persist();
    }

    void persist() {
        if (!dryRun) {
            checkpointStore.save(checkpoint);
        }
    }

    /** Fully succeeded means nothing is left failed, including failures carried over from earlier runs. */
    boolean isFullySucceeded() {
        return failedThisRun.isEmpty() && (dryRun || checkpoint.getEntitiesFailed().isEmpty());
    }

    RunSummary summarize() {
        Map<String, String> failed;
        synchronized (failedThisRun) {
            failed = Collections.unmodifiableMap(new LinkedHashMap<>(failedThisRun));
        }
        return RunSummary.builder()
            .runId(runId)
            .dryRun(dryRun)
            .elapsed(Duration.between(startedAt, clock.instant()))
            .entitiesCompleted(totals.entitiesCompleted())
            .entitiesSkipped(totals.entitiesSkipped())
            .failedEntities(failed)
            .recordsRead(totals.recordsProcessed())
            .pointsWritten(totals.pointsWritten())
            .classification(totals.classification())
            .quality(qualityReport)
            .fullySucceeded(isFullySucceeded())
            .build();
    }

    private ProgressEvent.ProgressEventBuilder event(ProgressEvent.Phase phase) {
        return ProgressEvent.builder()
            .phase(phase)
            .totalProcessed(totals.recordsProcessed())
            .totalWritten(totals.pointsWritten())
            .totalCorrected(totals.recordsCorrected())
            .totalDropped(totals.recordsDropped())
            .entitiesCompleted(totals.entitiesCompleted())
            .entitiesFailed(totals.entitiesFailed())
            .entitiesSkipped(totals.entitiesSkipped())
            .estimatedEntities(estimatedEntities)
            .dryRun(dryRun);
    }
}
