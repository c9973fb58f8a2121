package org.hastats.migrations.pipeline.checkpoint;

import java.util.Optional;

/**
 * Durable storage for {@link CheckpointState}.
 */
public interface CheckpointStore {

    /**
     * Load the saved state. Empty when there is nothing usable to resume from.
     *
     * @throws org.hastats.migrations.pipeline.error.CheckpointException when a checkpoint exists
     *         but cannot be used safely
     */
    Optional<CheckpointState> load();

    /** Replace the saved state atomically. */
    void save(CheckpointState state);

    /** Retire the saved state after a fully successful run. */
    void archive();

    /** Discard the saved state so the next run starts fresh. */
    void reset();

    /** Human-readable location, used in resume instructions. */
    String describe();
}
