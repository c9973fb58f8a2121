package org.hastats.migrations.pipeline.classify;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.hastats.migrations.pipeline.ir.EntityCategory;
import org.hastats.migrations.pipeline.ir.RejectionReason;

/**
 * Counts produced by classifying a set of entities.
 */
public record ClassificationSummary(
    int total,
    int accepted,
    Map<RejectionReason, Integer> rejectedByReason,
    Map<EntityCategory, Integer> acceptedByCategory
) {

    public static final ClassificationSummary EMPTY =
        new ClassificationSummary(0, 0, Map.of(), Map.of());

    public int rejected() {
        return total - accepted;
    }

    public ClassificationSummary plus(ClassificationSummary other) {
        var reasons = new EnumMap<RejectionReason, Integer>(RejectionReason.class);
        reasons.putAll(rejectedByReason);
        other.rejectedByReason.forEach((k, v) -> reasons.merge(k, v, Integer::sum));
        var categories = new EnumMap<EntityCategory, Integer>(EntityCategory.class);
        categories.putAll(acceptedByCategory);
        other.acceptedByCategory.forEach((k, v) -> categories.merge(k, v, Integer::sum));
        return new ClassificationSummary(
            total + other.total,
            accepted + other.accepted,
            Collections.unmodifiableMap(reasons),
            Collections.unmodifiableMap(categories)
        );
    }
}
