package org.hastats.migrations.pipeline.quality;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-entity tally of everything the quality gate did during one run.
 */
public class QualityReport {

    private final Map<String, EntityQuality> byEntity = new ConcurrentHashMap<>();

    public void record(String externalId, QualityOutcome outcome) {
        byEntity.computeIfAbsent(externalId, id -> new EntityQuality()).record(outcome);
    }

    public EntityQuality forEntity(String externalId) {
        return byEntity.getOrDefault(externalId, new EntityQuality());
    }

    public long totalCorrected() {
        return byEntity.values().stream().mapToLong(EntityQuality::getCorrected).sum();
    }

    public long totalDropped() {
        return byEntity.values().stream().mapToLong(EntityQuality::totalDropped).sum();
    }

    /** Entities with at least one correction or drop, sorted by external id. */
    public Map<String, EntityQuality> entitiesWithIssues() {
        var result = new TreeMap<String, EntityQuality>();
        byEntity.forEach((id, quality) -> {
            if (quality.hasIssues()) {
                result.put(id, quality);
            }
        });
        return Collections.unmodifiableMap(result);
    }
}
