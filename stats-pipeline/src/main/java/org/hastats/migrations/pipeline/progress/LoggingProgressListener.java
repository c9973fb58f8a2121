package org.hastats.migrations.pipeline.progress;

import java.util.Locale;

import org.hastats.migrations.pipeline.RunSummary;

import lombok.extern.slf4j.Slf4j;

/**
 * Reports progress through the log: every {@code interval}-th record batch at INFO, entity
 * failures at WARN and the end-of-run summary at INFO.
 */
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    private final int interval;
    private long batches;

    public LoggingProgressListener(int interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.interval = interval;
    }

    @Override
    public void onEvent(ProgressEvent event) {
        switch (event.phase()) {
            case METADATA_PAGE -> log.atDebug().setMessage("Metadata page: {}")
                .addArgument(event::message)
                .log();
            case RECORD_BATCH -> {
                if (++batches % interval == 0) {
                    log.info("{}Progress: {} records processed, {} written, {} corrected, {} dropped, "
                            + "{} entities done{}",
                        prefix(event), event.totalProcessed(), event.totalWritten(), event.totalCorrected(),
                        event.totalDropped(), event.entitiesCompleted(), percentage(event));
                }
            }
            case ENTITY_COMPLETED -> log.debug("{}Completed {}", prefix(event), event.externalId());
            case ENTITY_FAILED -> log.warn("{}Failed {}: {}", prefix(event), event.externalId(), event.message());
        }
    }

    @Override
    public void onSummary(RunSummary summary) {
        log.info("{}Run {} finished in {}: {} entities completed, {} failed, {} records read, {} points written "
                + "({} points/s), {} corrected, {} dropped, success rate {}%",
            summary.dryRun() ? "[dry run] " : "",
            summary.runId(),
            summary.elapsed(),
            summary.entitiesCompleted(),
            summary.failedEntities().size(),
            summary.recordsRead(),
            summary.pointsWritten(),
            String.format(Locale.ROOT, "%.1f", summary.pointsPerSecond()),
            summary.quality().totalCorrected(),
            summary.quality().totalDropped(),
            String.format(Locale.ROOT, "%.1f", summary.successRate()));
        summary.failedEntities().forEach((id, reason) -> log.warn("Not migrated: {} ({})", id, reason));
        summary.quality().entitiesWithIssues().forEach((id, quality) ->
            log.info("Quality {}: {} corrected, dropped {}", id, quality.getCorrected(), quality.getDropped()));
    }

    private static String prefix(ProgressEvent event) {
        return event.dryRun() ? "[dry run] " : "";
    }

    private static String percentage(ProgressEvent event) {
        double percent = event.percentComplete();
        return percent < 0 ? "" : String.format(Locale.ROOT, " (%.1f%%)", percent);
    }
}
