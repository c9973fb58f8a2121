package org.hastats.migrations.pipeline.classify;

import java.util.List;

import org.hastats.migrations.pipeline.ir.ClassifiedEntity;

/**
 * Result of classifying one metadata page: the accepted entities, and separately the
 * counts over the whole page.
 */
public record ClassifiedPage(
    List<ClassifiedEntity> accepted,
    ClassificationSummary summary
) {}
