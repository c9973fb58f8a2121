package org.hastats.migrations.pipeline.progress;

import org.hastats.migrations.pipeline.RunSummary;

/**
 * Observer of a run. Called on the pipeline's thread, so implementations must be quick.
 */
public interface ProgressListener {

    ProgressListener NONE = event -> {};

    void onEvent(ProgressEvent event);

    default void onSummary(RunSummary summary) {
        // Default no-op
    }
}
