package org.hastats.migrations.pipeline.checkpoint;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.hastats.migrations.pipeline.ir.SeriesTier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted progress of a migration run.
 *
 * Mutated only by the pipeline after a batch write has been confirmed, and saved right after
 * every mutation, so the file on disk is always a consistent resume point. Unknown properties
 * are ignored so files written by a newer minor revision stay readable.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckpointState {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private String runId;
    private Instant startedAt;
    private Instant updatedAt;

    /** Offset of the first metadata page whose entities are not all completed. */
    private long metadataCursor;

    private Set<String> entitiesCompleted = new TreeSet<>();

    /** externalId -> tier wire name -> last written timestamp. */
    private Map<String, Map<String, Double>> inProgress = new TreeMap<>();

    /** externalId -> failure message of the last attempt. */
    private Map<String, String> entitiesFailed = new TreeMap<>();

    private long recordsRead;
    private long pointsWritten;

    public static CheckpointState fresh(String runId, Instant now) {
        var state = new CheckpointState();
        state.setRunId(runId);
        state.setStartedAt(now);
        state.setUpdatedAt(now);
        return state;
    }

    public boolean isCompleted(String externalId) {
        return entitiesCompleted.contains(externalId);
    }

    public OptionalDouble lastWritten(String externalId, SeriesTier tier) {
        var tiers = inProgress.get(externalId);
        if (tiers == null || !tiers.containsKey(tier.wireName())) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(tiers.get(tier.wireName()));
    }

    public void markWritten(String externalId, SeriesTier tier, double timestamp, long records, long points) {
        inProgress.computeIfAbsent(externalId, id -> new TreeMap<>())
            .merge(tier.wireName(), timestamp, Math::max);
        recordsRead += records;
        pointsWritten += points;
    }

    public void markCompleted(String externalId) {
        inProgress.remove(externalId);
        entitiesFailed.remove(externalId);
        entitiesCompleted.add(externalId);
    }

    public void markFailed(String externalId, String message) {
        entitiesFailed.put(externalId, message == null ? "unknown error" : message);
    }
}
