package org.hastats.migrations.pipeline.quality;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import lombok.Getter;

/**
 * Quality counters for one entity.
 */
@Getter
public class EntityQuality {

    private long passed;
    private long corrected;
    private final Map<DropReason, Long> dropped = new EnumMap<>(DropReason.class);

    synchronized void record(QualityOutcome outcome) {
        if (outcome instanceof QualityOutcome.Pass) {
            passed++;
        } else if (outcome instanceof QualityOutcome.Corrected) {
            corrected++;
        } else if (outcome instanceof QualityOutcome.Drop drop) {
            dropped.merge(drop.reason(), 1L, Long::sum);
        }
    }

    public synchronized long totalDropped() {
        return dropped.values().stream().mapToLong(Long::longValue).sum();
    }

    public synchronized Map<DropReason, Long> getDropped() {
        return Collections.unmodifiableMap(new EnumMap<>(dropped));
    }

    public synchronized boolean hasIssues() {
        return corrected > 0 || !dropped.isEmpty();
    }
}
