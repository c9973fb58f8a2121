package org.hastats.migrations.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;

import org.hastats.migrations.pipeline.PipelineSettings;
import org.hastats.migrations.pipeline.RetryPolicy;
import org.hastats.migrations.pipeline.error.ConfigurationException;

import lombok.Builder;

/**
 * Everything a migration run can be told. Every key has a default; see
 * {@link MigrationConfigLoader} for how files and environment variables are layered on top.
 *
 * @param resume when false, any existing checkpoint is discarded before the run starts
 */
@Builder(toBuilder = true)
public record MigrationConfig(
    String databasePath,
    InfluxConfig influx,
    int metadataPageSize,
    int recordBatchSize,
    int maxInClauseValues,
    int maxRetries,
    long retryBackoffMillis,
    int progressInterval,
    String checkpointFile,
    boolean archiveCheckpointOnSuccess,
    boolean resume,
    String entityIdFilter,
    ClassifierConfig classifier,
    QualityConfig quality
) {

    public static final String DEFAULT_DATABASE_PATH = "./home-assistant_v2.db";
    public static final String DEFAULT_CHECKPOINT_FILE = "./export_checkpoint.json";

    public static MigrationConfig defaults() {
        return new MigrationConfig(
            DEFAULT_DATABASE_PATH,
            InfluxConfig.defaults(),
            5000,
            1000,
            999,
            3,
            500,
            10,
            DEFAULT_CHECKPOINT_FILE,
            true,
            true,
            null,
            ClassifierConfig.defaults(),
            QualityConfig.defaults()
        );
    }

    /**
     * Check the settings a run depends on. Sink credentials are only required when the run
     * actually writes.
     *
     * @throws ConfigurationException listing every problem found
     */
    public void validate(boolean dryRun) {
        var problems = new ArrayList<String>();
        if (isBlank(databasePath)) {
            problems.add("databasePath is required");
        }
        if (metadataPageSize <= 0) {
            problems.add("metadataPageSize must be positive");
        }
        if (recordBatchSize <= 0) {
            problems.add("recordBatchSize must be positive");
        }
        if (maxInClauseValues <= 0) {
            problems.add("maxInClauseValues must be positive");
        }
        if (maxRetries < 0) {
            problems.add("maxRetries must not be negative");
        }
        if (retryBackoffMillis <= 0) {
            problems.add("retryBackoffMillis must be positive");
        }
        if (progressInterval <= 0) {
            problems.add("progressInterval must be positive");
        }
        if (isBlank(checkpointFile)) {
            problems.add("checkpointFile is required");
        }
        if (!dryRun) {
            validateInflux(problems);
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    private void validateInflux(ArrayList<String> problems) {
        if (influx == null) {
            problems.add("influx section is required");
            return;
        }
        if (isBlank(influx.token())) {
            problems.add("influx.token is required (or set INFLUX_TOKEN)");
        }
        if (isBlank(influx.org())) {
            problems.add("influx.org is required (or set INFLUX_ORG)");
        }
        if (isBlank(influx.recentBucket()) || isBlank(influx.historicalBucket())) {
            problems.add("influx.recentBucket and influx.historicalBucket are required");
        }
        if (influx.timeoutSeconds() <= 0) {
            problems.add("influx.timeoutSeconds must be positive");
        }
        if (isBlank(influx.url())) {
            problems.add("influx.url is required (or set INFLUX_URL)");
            return;
        }
        try {
            var uri = URI.create(influx.url());
            if (uri.getScheme() == null || uri.getHost() == null) {
                problems.add("influx.url must be an absolute http(s) URL");
            }
        } catch (IllegalArgumentException e) {
            problems.add("influx.url is not a valid URL: " + influx.url());
        }
    }

    public PipelineSettings toPipelineSettings() {
        var backoff = Duration.ofMillis(retryBackoffMillis);
        var maxBackoff = backoff.compareTo(RetryPolicy.DEFAULT.maxBackoff()) > 0 ? backoff : RetryPolicy.DEFAULT.maxBackoff();
        return PipelineSettings.builder()
            .metadataPageSize(metadataPageSize)
            .recordBatchSize(recordBatchSize)
            .maxInClauseValues(maxInClauseValues)
            .retryPolicy(new RetryPolicy(maxRetries, backoff, maxBackoff))
            .entityIdFilter(entityIdFilter)
            .build();
    }

    public Path databaseFile() {
        return Path.of(databasePath);
    }

    public Path checkpointPath() {
        return Path.of(checkpointFile);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
