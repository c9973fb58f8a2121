package org.hastats.migrations.source.jdbc;

import java.util.List;

import org.hastats.migrations.pipeline.ir.SeriesTier;

/**
 * SQL against the recorder schema.
 *
 * The attributes side keeps only the newest {@code states} row per entity before joining, so the
 * paginated relation has exactly one row per {@code statistics_meta} row no matter how many
 * attribute snapshots an entity accumulated.
 */
final class RecorderSchema {

    static final List<String> REQUIRED_TABLES = List.of("statistics_meta", "statistics", "statistics_short_term");
    static final List<String> ATTRIBUTE_TABLES = List.of("states_meta", "states", "state_attributes");

    static final String APPROXIMATE_COUNT = "SELECT MAX(id) FROM statistics_meta";

    private RecorderSchema() {}

    static String metadataWithAttributes(boolean hasNameColumn) {
        return "SELECT sm.id, sm.statistic_id, sm.source, sm.unit_of_measurement, "
            + nameColumn(hasNameColumn, "sm.") + " AS name, "
            + "json_extract(sa.shared_attrs, '$.friendly_name') AS friendly_name, "
            + "json_extract(sa.shared_attrs, '$.device_class') AS device_class, "
            + "json_extract(sa.shared_attrs, '$.state_class') AS state_class "
            + "FROM statistics_meta sm "
            + "LEFT JOIN states_meta stm ON stm.entity_id = sm.statistic_id "
            + "LEFT JOIN ("
            + "SELECT metadata_id, MAX(state_id) AS state_id FROM states "
            + "WHERE attributes_id IS NOT NULL GROUP BY metadata_id"
            + ") latest ON latest.metadata_id = stm.metadata_id "
            + "LEFT JOIN states s ON s.state_id = latest.state_id "
            + "LEFT JOIN state_attributes sa ON sa.attributes_id = s.attributes_id "
            + "ORDER BY sm.statistic_id, sm.id "
            + "LIMIT ? OFFSET ?";
    }

    static String metadataOnly(boolean hasNameColumn) {
        return "SELECT id, statistic_id, source, unit_of_measurement, "
            + nameColumn(hasNameColumn, "") + " AS name, "
            + "NULL AS friendly_name, NULL AS device_class, NULL AS state_class "
            + "FROM statistics_meta "
            + "ORDER BY statistic_id, id "
            + "LIMIT ? OFFSET ?";
    }

    /**
     * Keyset page over one statistics table. Parameters, in order: the {@code keyCount} entity
     * keys, then (when {@code resuming}) key, key, timestamp, then the limit.
     */
    static String recordPage(SeriesTier tier, int keyCount, boolean resuming) {
        var sql = new StringBuilder("SELECT metadata_id, start_ts, state, mean FROM ")
            .append(tier.tableName());
        var conditions = new StringBuilder();
        if (keyCount > 0) {
            conditions.append("metadata_id IN (")
                .append("?,".repeat(keyCount - 1))
                .append("?)");
        }
        if (resuming) {
            if (conditions.length() > 0) {
                conditions.append(" AND ");
            }
            conditions.append("(metadata_id > ? OR (metadata_id = ? AND start_ts > ?))");
        }
        if (conditions.length() > 0) {
            sql.append(" WHERE ").append(conditions);
        }
        return sql.append(" ORDER BY metadata_id, start_ts LIMIT ?").toString();
    }

    private static String nameColumn(boolean present, String alias) {
        return present ? alias + "name" : "NULL";
    }
}
