package org.hastats.migrations.pipeline.source;

import java.util.Set;

import org.hastats.migrations.pipeline.ir.ResumePoint;

/**
 * A keyset page request over statistic rows.
 *
 * @param entityKeys keys to push into the query predicate, or null to scan every entity
 * @param after      exclusive lower bound in {@code (entityKey, timestamp)} order, or null to start at the beginning
 * @param limit      maximum number of rows to return
 */
public record RecordPageRequest(
    Set<Integer> entityKeys,
    ResumePoint after,
    int limit
) {

    public RecordPageRequest {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        entityKeys = entityKeys == null ? null : Set.copyOf(entityKeys);
    }

    public boolean isFiltered() {
        return entityKeys != null;
    }

    public RecordPageRequest continueAfter(ResumePoint next) {
        return new RecordPageRequest(entityKeys, next, limit);
    }
}
