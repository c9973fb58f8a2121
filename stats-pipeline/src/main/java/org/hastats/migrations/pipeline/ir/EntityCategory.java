package org.hastats.migrations.pipeline.ir;

/**
 * Semantic grouping of an entity. Drives both filtering and the rollup hint written
 * alongside migrated series. {@link #NONE} is the category of every rejected entity.
 */
public enum EntityCategory {
    ENERGY("energy"),
    POWER("power"),
    TEMPERATURE("temperature"),
    ENVIRONMENTAL("environmental"),
    NETWORK("network"),
    ELECTRICAL("electrical"),
    LIGHT("light"),
    AIR_QUALITY("air-quality"),
    SOUND("sound"),
    ROTATIONAL("rotational"),
    SPECIAL_SOURCE("special-source"),
    OTHER_NUMERIC("other-numeric"),
    NONE("none");

    private final String tagValue;

    EntityCategory(String tagValue) {
        this.tagValue = tagValue;
    }

    /** Value used for the {@code category} tag on sink points. */
    public String tagValue() {
        return tagValue;
    }
}
