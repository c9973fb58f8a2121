package org.hastats.migrations.config;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.hastats.migrations.pipeline.error.ConfigurationException;
import org.hastats.migrations.pipeline.ir.EntityCategory;
import org.hastats.migrations.pipeline.quality.Bounds;
import org.hastats.migrations.pipeline.quality.QualityRules;

import lombok.Builder;

/**
 * Quality gate settings. Bound overrides are laid over the built-in bounds; category keys may
 * be written as enum names ({@code TEMPERATURE}) or tag values ({@code air-quality}).
 */
@Builder(toBuilder = true)
public record QualityConfig(
    boolean autoCorrect,
    List<Double> sentinelValues,
    Map<String, BoundsConfig> unitBounds,
    Map<String, BoundsConfig> categoryBounds
) {

    /** One side may be left out for a half-open range. */
    public record BoundsConfig(Double min, Double max) {}

    public static QualityConfig defaults() {
        return new QualityConfig(true, List.of(), Map.of(), Map.of());
    }

    public QualityRules toRules() {
        var builtIn = QualityRules.defaults();

        var categories = new EnumMap<EntityCategory, Bounds>(EntityCategory.class);
        categories.putAll(builtIn.categoryBounds());
        if (categoryBounds != null) {
            categoryBounds.forEach((key, bounds) -> categories.put(categoryOf(key), toBounds(key, bounds)));
        }

        var units = new HashMap<>(builtIn.unitBounds());
        if (unitBounds != null) {
            unitBounds.forEach((unit, bounds) -> units.put(unit, toBounds(unit, bounds)));
        }

        return QualityRules.builder()
            .autoCorrect(autoCorrect)
            .categoryBounds(categories)
            .unitBounds(units)
            .sentinelValues(sentinelValues == null ? Set.of() : new HashSet<>(sentinelValues))
            .build();
    }

    private static EntityCategory categoryOf(String key) {
        for (EntityCategory category : EntityCategory.values()) {
            if (category.name().equalsIgnoreCase(key) || category.tagValue().equalsIgnoreCase(key)) {
                return category;
            }
        }
        throw new ConfigurationException("Unknown category '" + key + "' in quality.categoryBounds");
    }

    private static Bounds toBounds(String key, BoundsConfig bounds) {
        if (bounds == null) {
            throw new ConfigurationException("Missing bounds for '" + key + "'");
        }
        try {
            return Bounds.between(bounds.min(), bounds.max());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid bounds for '" + key + "': "
                + e.getMessage(), e);
        }
    }
}
