package org.hastats.migrations.pipeline.classify;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.hastats.migrations.pipeline.ir.AggregationHint;
import org.hastats.migrations.pipeline.ir.EntityCategory;

/**
 * Closed mapping from unit of measurement to category, and from category to rollup hint.
 * Units that are allowed by configuration but unknown here fall into
 * {@link EntityCategory#OTHER_NUMERIC}.
 */
public final class UnitCategoryTable {

    static final Set<String> COUNTER_DOMAINS = Set.of("counter", "utility_meter");
    static final Set<String> DATA_VOLUME_UNITS = Set.of("B", "kB", "KB", "MB", "GB", "TB", "KiB", "MiB", "GiB", "TiB");

    private static final Map<String, EntityCategory> UNIT_CATEGORIES = new HashMap<>();

    static {
        register(EntityCategory.ENERGY, "Wh", "kWh", "MWh", "MJ", "GJ");
        register(EntityCategory.POWER, "W", "kW", "MW");
        register(EntityCategory.TEMPERATURE, "°C", "°F", "K");
        register(EntityCategory.ENVIRONMENTAL,
            "%", "hPa", "Pa", "kPa", "bar", "mbar", "psi", "inHg", "mmHg",
            "mm", "mm/h", "in", "m/s", "km/h", "mph", "g/m³");
        register(EntityCategory.NETWORK,
            "bit/s", "kbit/s", "Mbit/s", "Gbit/s", "B/s", "kB/s", "MB/s", "GB/s");
        register(EntityCategory.NETWORK, DATA_VOLUME_UNITS.toArray(String[]::new));
        register(EntityCategory.ELECTRICAL, "A", "mA", "V", "mV", "VA", "var", "Hz");
        register(EntityCategory.LIGHT, "lx", "lux", "lm");
        register(EntityCategory.AIR_QUALITY, "ppm", "ppb", "µg/m³", "μg/m³", "mg/m³");
        register(EntityCategory.SOUND, "dB", "dBA");
        register(EntityCategory.ROTATIONAL, "rpm");
    }

    private UnitCategoryTable() {}

    private static void register(EntityCategory category, String... units) {
        for (String unit : units) {
            UNIT_CATEGORIES.put(unit, category);
        }
    }

    public static EntityCategory categoryOf(String unit) {
        if (unit == null) {
            return EntityCategory.OTHER_NUMERIC;
        }
        return UNIT_CATEGORIES.getOrDefault(unit, EntityCategory.OTHER_NUMERIC);
    }

    public static AggregationHint aggregationHintFor(EntityCategory category, String unit, String domain) {
        return switch (category) {
            case NONE -> AggregationHint.NONE;
            case ENERGY, SPECIAL_SOURCE -> AggregationHint.LAST;
            case NETWORK -> DATA_VOLUME_UNITS.contains(unit) ? AggregationHint.LAST : AggregationHint.MEAN;
            default -> COUNTER_DOMAINS.contains(domain) ? AggregationHint.MAX : AggregationHint.MEAN;
        };
    }
}
