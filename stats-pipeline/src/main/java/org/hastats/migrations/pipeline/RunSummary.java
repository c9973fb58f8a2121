package org.hastats.migrations.pipeline;

import java.time.Duration;
import java.util.Map;

import org.hastats.migrations.pipeline.classify.ClassificationSummary;
import org.hastats.migrations.pipeline.quality.QualityReport;

import lombok.Builder;

/**
 * End-of-run report.
 *
 * @param failedEntities entities that failed during this run, with the last error message
 * @param fullySucceeded true when every accepted entity has been exported by this or earlier runs
 */
@Builder
public record RunSummary(
    String runId,
    boolean dryRun,
    Duration elapsed,
    long entitiesCompleted,
    long entitiesSkipped,
    Map<String, String> failedEntities,
    long recordsRead,
    long pointsWritten,
    ClassificationSummary classification,
    QualityReport quality,
    boolean fullySucceeded
) {

    public double pointsPerSecond() {
        double seconds = elapsed.toMillis() / 1000.0;
        return seconds <= 0 ? pointsWritten : pointsWritten / seconds;
    }

    /** Percentage of entities attempted in this run that completed. */
    public double successRate() {
        long attempted = entitiesCompleted + failedEntities.size();
        return attempted == 0 ? 100.0 : 100.0 * entitiesCompleted / attempted;
    }
}
