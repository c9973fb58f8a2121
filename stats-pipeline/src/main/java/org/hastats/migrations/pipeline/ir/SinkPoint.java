package org.hastats.migrations.pipeline.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The unit written to the sink: one timestamped, tagged value. Points are named by the
 * entity's physical unit so migrated series share a schema with live-ingested ones.
 *
 * Points are built and discarded within a single batch.
 */
public record SinkPoint(
    String measurement,
    Map<String, String> tags,
    Map<String, Double> fields,
    double timestamp,
    SeriesTier tier
) {

    public static final String VALUE_FIELD = "value";
    public static final String MIGRATION_SOURCE = "migration";

    public static final String TAG_ENTITY_ID = "entity_id";
    public static final String TAG_DOMAIN = "domain";
    public static final String TAG_CATEGORY = "category";
    public static final String TAG_UNIT = "unit";
    public static final String TAG_SOURCE = "source";
    public static final String TAG_FRIENDLY_NAME = "friendly_name";
    public static final String TAG_DEVICE_CLASS = "device_class";

    public static SinkPoint from(ValidatedRecord record, ClassifiedEntity entity) {
        var descriptor = entity.descriptor();
        var tags = new LinkedHashMap<String, String>();
        tags.put(TAG_ENTITY_ID, descriptor.objectId());
        tags.put(TAG_DOMAIN, descriptor.domain());
        tags.put(TAG_CATEGORY, entity.category().tagValue());
        putIfPresent(tags, TAG_UNIT, descriptor.unit());
        tags.put(TAG_SOURCE, MIGRATION_SOURCE);
        putIfPresent(tags, TAG_FRIENDLY_NAME, descriptor.friendlyName());
        putIfPresent(tags, TAG_DEVICE_CLASS, descriptor.deviceClass());

        return new SinkPoint(
            measurementFor(descriptor),
            Collections.unmodifiableMap(tags),
            Map.of(VALUE_FIELD, record.value()),
            record.timestamp(),
            record.tier()
        );
    }

    /** The entity's unit, or {@code <domain>_data} for unit-less entities. */
    public static String measurementFor(EntityDescriptor descriptor) {
        if (descriptor.unit() != null) {
            return descriptor.unit();
        }
        return descriptor.domain() + "_data";
    }

    public double value() {
        return fields.get(VALUE_FIELD);
    }

    private static void putIfPresent(Map<String, String> tags, String key, String value) {
        if (value != null && !value.isEmpty()) {
            tags.put(key, value);
        }
    }
}
