package org.hastats.migrations.pipeline.quality;

import java.util.List;

import org.hastats.migrations.pipeline.ir.ValidatedRecord;

/**
 * A raw batch after the quality gate: the surviving records plus what happened to the rest.
 */
public record ScreenedBatch(
    List<ValidatedRecord> survivors,
    int corrected,
    int dropped
) {}
