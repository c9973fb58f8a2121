package org.hastats.migrations.pipeline.quality;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.hastats.migrations.pipeline.ir.EntityCategory;

import lombok.Builder;

/**
 * Bounds and correction behavior of the quality gate. Unit-specific bounds take precedence
 * over the category's bounds, so a percentage sensor gets [0, 100] regardless of category.
 */
@Builder(toBuilder = true)
public record QualityRules(
    boolean autoCorrect,
    Map<EntityCategory, Bounds> categoryBounds,
    Map<String, Bounds> unitBounds,
    Set<Double> sentinelValues
) {

    public QualityRules {
        categoryBounds = categoryBounds == null || categoryBounds.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(categoryBounds));
        unitBounds = unitBounds == null ? Map.of() : Map.copyOf(unitBounds);
        sentinelValues = sentinelValues == null ? Set.of() : Set.copyOf(sentinelValues);
    }

    public static QualityRules defaults() {
        var categories = new EnumMap<EntityCategory, Bounds>(EntityCategory.class);
        categories.put(EntityCategory.TEMPERATURE, Bounds.of(-50, 80));
        categories.put(EntityCategory.ENERGY, Bounds.atLeast(0));
        categories.put(EntityCategory.POWER, Bounds.of(-100_000, 100_000));

        var units = new HashMap<String, Bounds>();
        units.put("%", Bounds.of(0, 100));
        units.put("°F", Bounds.of(-58, 176));
        units.put("K", Bounds.of(223.15, 353.15));
        units.put("V", Bounds.of(0, 500));
        units.put("A", Bounds.of(0, 1000));
        units.put("hPa", Bounds.of(800, 1200));
        units.put("kWh", Bounds.atLeast(0));

        return new QualityRules(true, categories, units, Set.of());
    }

    public Optional<Bounds> boundsFor(String unit, EntityCategory category) {
        if (unit != null) {
            var byUnit = unitBounds.get(unit);
            if (byUnit != null) {
                return Optional.of(byUnit);
            }
        }
        return Optional.ofNullable(categoryBounds.get(category));
    }
}
