package org.hastats.migrations.pipeline.quality;

/**
 * Verdict of the quality gate for a single record.
 */
public sealed interface QualityOutcome permits QualityOutcome.Pass, QualityOutcome.Corrected, QualityOutcome.Drop {

    /** Value unchanged. */
    record Pass(double value) implements QualityOutcome {}

    /** Value clamped to the nearest bound. */
    record Corrected(double original, double value) implements QualityOutcome {}

    /** Record removed from the pipeline. */
    record Drop(DropReason reason) implements QualityOutcome {}
}
