package org.hastats.migrations.pipeline.sink;

import java.time.Duration;

import org.hastats.migrations.pipeline.ir.SeriesTier;

/**
 * Confirmation of a successful batch write.
 */
public record WriteResult(
    SeriesTier tier,
    int pointsWritten,
    Duration elapsed
) {}
