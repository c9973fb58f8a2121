package org.hastats.migrations.pipeline.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;

import org.hastats.migrations.pipeline.ir.ClassificationResult;
import org.hastats.migrations.pipeline.ir.ClassifiedEntity;
import org.hastats.migrations.pipeline.ir.EntityCategory;
import org.hastats.migrations.pipeline.ir.EntityDescriptor;
import org.hastats.migrations.pipeline.ir.RejectionReason;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides which entities are migrated and under which category.
 *
 * Classification is a pure function of the descriptor: rerunning it after a resume
 * yields the same decisions. Rules are evaluated in a fixed order and the first match wins:
 * <ol>
 *   <li>domain outside the allow-set</li>
 *   <li>timestamp-only state class</li>
 *   <li>external id or friendly name matching an exclusion pattern</li>
 *   <li>special source, or allowed unit: accepted</li>
 *   <li>anything else: no matching unit</li>
 * </ol>
 */
@Slf4j
public class EntityClassifier {

    private final ClassifierRules rules;
    private final List<GlobPattern> exclusions;

    public EntityClassifier(ClassifierRules rules) {
        this.rules = rules;
        this.exclusions = rules.excludePatterns().stream()
            .map(GlobPattern::compile)
            .toList();
    }

    public ClassificationResult classify(EntityDescriptor entity) {
        if (!rules.includeDomains().contains(entity.domain())) {
            return ClassificationResult.reject(RejectionReason.DOMAIN);
        }
        if (entity.isTimestampOnly()) {
            return ClassificationResult.reject(RejectionReason.TIMESTAMP_ONLY);
        }
        if (matchesExclusion(entity)) {
            return ClassificationResult.reject(RejectionReason.STATUS_PATTERN);
        }
        if (isSpecialSource(entity)) {
            return accept(EntityCategory.SPECIAL_SOURCE, entity);
        }
        if (entity.unit() != null && rules.includeUnits().contains(entity.unit())) {
            return accept(UnitCategoryTable.categoryOf(entity.unit()), entity);
        }
        return ClassificationResult.reject(RejectionReason.NO_MATCHING_UNIT);
    }

    /**
     * Classify every entity of a page.
     */
    public ClassifiedPage classifyPage(List<EntityDescriptor> page) {
        var accepted = new ArrayList<ClassifiedEntity>();
        var rejected = new EnumMap<RejectionReason, Integer>(RejectionReason.class);
        var byCategory = new EnumMap<EntityCategory, Integer>(EntityCategory.class);

        for (EntityDescriptor entity : page) {
            var result = classify(entity);
            if (result.accepted()) {
                accepted.add(new ClassifiedEntity(entity, result));
                byCategory.merge(result.category(), 1, Integer::sum);
            } else {
                rejected.merge(result.reason(), 1, Integer::sum);
                log.atDebug().setMessage("Excluded {}: {}")
                    .addArgument(entity::externalId)
                    .addArgument(() -> result.reason().code())
                    .log();
            }
        }

        var summary = new ClassificationSummary(
            page.size(),
            accepted.size(),
            Collections.unmodifiableMap(rejected),
            Collections.unmodifiableMap(byCategory)
        );
        return new ClassifiedPage(Collections.unmodifiableList(accepted), summary);
    }

    private ClassificationResult accept(EntityCategory category, EntityDescriptor entity) {
        return ClassificationResult.accept(category,
            UnitCategoryTable.aggregationHintFor(category, entity.unit(), entity.domain()));
    }

    private boolean matchesExclusion(EntityDescriptor entity) {
        for (GlobPattern pattern : exclusions) {
            if (pattern.matches(entity.externalId()) || pattern.matches(entity.friendlyName())) {
                return true;
            }
        }
        return false;
    }

    private boolean isSpecialSource(EntityDescriptor entity) {
        var specials = rules.specialSources();
        return specials.contains(entity.domain())
            || (entity.source() != null && specials.contains(entity.source().toLowerCase(Locale.ROOT)));
    }
}
