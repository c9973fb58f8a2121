package org.hastats.migrations.pipeline;

import java.util.Locale;

import org.hastats.migrations.pipeline.source.MetadataStream;
import org.hastats.migrations.pipeline.source.RecordStream;

import lombok.Builder;

/**
 * Tuning knobs of a pipeline run.
 *
 * @param entityIdFilter optional case-insensitive substring; when set only accepted entities
 *        whose external id contains it are exported
 */
@Builder(toBuilder = true)
public record PipelineSettings(
    int metadataPageSize,
    int recordBatchSize,
    int maxInClauseValues,
    RetryPolicy retryPolicy,
    String entityIdFilter
) {

    public PipelineSettings {
        if (metadataPageSize <= 0) {
            throw new IllegalArgumentException("metadataPageSize must be positive");
        }
        if (recordBatchSize <= 0) {
            throw new IllegalArgumentException("recordBatchSize must be positive");
        }
        if (maxInClauseValues <= 0) {
            throw new IllegalArgumentException("maxInClauseValues must be positive");
        }
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.DEFAULT;
        }
        if (entityIdFilter != null && entityIdFilter.isBlank()) {
            entityIdFilter = null;
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(
            MetadataStream.DEFAULT_PAGE_SIZE,
            RecordStream.DEFAULT_BATCH_SIZE,
            RecordStream.DEFAULT_MAX_IN_CLAUSE_VALUES,
            RetryPolicy.DEFAULT,
            null
        );
    }

    public boolean matchesFilter(String externalId) {
        return entityIdFilter == null
            || externalId.toLowerCase(Locale.ROOT).contains(entityIdFilter.toLowerCase(Locale.ROOT));
    }
}
