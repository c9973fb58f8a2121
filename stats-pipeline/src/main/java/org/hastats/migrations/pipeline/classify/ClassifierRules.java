package org.hastats.migrations.pipeline.classify;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.Builder;

/**
 * Inputs of the classification rules. Domains and special sources are compared
 * case-insensitively; units are compared exactly since {@code mW} and {@code MW} differ.
 */
@Builder(toBuilder = true)
public record ClassifierRules(
    Set<String> includeDomains,
    Set<String> includeUnits,
    Set<String> specialSources,
    List<String> excludePatterns
) {

    public static final List<String> DEFAULT_DOMAINS =
        List.of("sensor", "counter", "weather", "climate", "utility_meter");
    public static final List<String> DEFAULT_UNITS = List.of(
        "kWh", "W", "°C", "°F", "%", "kB/s", "GB", "MB", "A", "V",
        "hPa", "bar", "mbar", "lux", "ppm", "dB", "rpm");
    public static final List<String> DEFAULT_SPECIAL_SOURCES = List.of("tibber");
    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
        "*availability*", "*status*", "*signal*", "*connected*", "*online*", "*rssi*");

    public ClassifierRules {
        includeDomains = lowerCased(includeDomains);
        includeUnits = includeUnits == null ? Set.of() : Set.copyOf(includeUnits);
        specialSources = lowerCased(specialSources);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    public static ClassifierRules defaults() {
        return new ClassifierRules(
            Set.copyOf(DEFAULT_DOMAINS),
            Set.copyOf(DEFAULT_UNITS),
            Set.copyOf(DEFAULT_SPECIAL_SOURCES),
            DEFAULT_EXCLUDE_PATTERNS
        );
    }

    private static Set<String> lowerCased(Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
            .map(v -> v.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }
}
