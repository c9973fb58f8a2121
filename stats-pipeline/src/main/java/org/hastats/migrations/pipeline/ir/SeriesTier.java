package org.hastats.migrations.pipeline.ir;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which of the two historical granularities a record belongs to.
 * The enum order is the order in which tiers are exported for an entity.
 */
public enum SeriesTier {
    SHORT_TERM("short_term", "statistics_short_term"),
    LONG_TERM("long_term", "statistics");

    private final String wireName;
    private final String tableName;

    SeriesTier(String wireName, String tableName) {
        this.wireName = wireName;
        this.tableName = tableName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Source table holding this tier's rows. */
    public String tableName() {
        return tableName;
    }

    public static SeriesTier fromWireName(String wireName) {
        for (SeriesTier tier : values()) {
            if (tier.wireName.equals(wireName)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown series tier: " + wireName);
    }
}
