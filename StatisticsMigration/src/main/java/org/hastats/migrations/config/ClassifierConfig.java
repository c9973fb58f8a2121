package org.hastats.migrations.config;

import java.util.LinkedHashSet;
import java.util.List;

import org.hastats.migrations.pipeline.classify.ClassifierRules;

import lombok.Builder;

@Builder(toBuilder = true)
public record ClassifierConfig(
    List<String> includeDomains,
    List<String> includeUnits,
    List<String> specialSources,
    List<String> excludePatterns
) {

    public static ClassifierConfig defaults() {
        return new ClassifierConfig(
            ClassifierRules.DEFAULT_DOMAINS,
            ClassifierRules.DEFAULT_UNITS,
            ClassifierRules.DEFAULT_SPECIAL_SOURCES,
            ClassifierRules.DEFAULT_EXCLUDE_PATTERNS
        );
    }

    public ClassifierRules toRules() {
        return new ClassifierRules(
            new LinkedHashSet<>(nonNull(includeDomains)),
            new LinkedHashSet<>(nonNull(includeUnits)),
            new LinkedHashSet<>(nonNull(specialSources)),
            nonNull(excludePatterns)
        );
    }

    private static List<String> nonNull(List<String> values) {
        return values == null ? List.of() : values;
    }
}
