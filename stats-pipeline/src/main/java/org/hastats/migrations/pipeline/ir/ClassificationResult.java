package org.hastats.migrations.pipeline.ir;

/**
 * Outcome of classifying one entity. {@code reason} is null for accepted entities.
 */
public record ClassificationResult(
    boolean accepted,
    EntityCategory category,
    AggregationHint aggregationHint,
    RejectionReason reason
) {

    public static ClassificationResult accept(EntityCategory category, AggregationHint hint) {
        return new ClassificationResult(true, category, hint, null);
    }

    public static ClassificationResult reject(RejectionReason reason) {
        return new ClassificationResult(false, EntityCategory.NONE, AggregationHint.NONE, reason);
    }
}
