package org.hastats.migrations.pipeline.ir;

/**
 * A record that passed the quality gate, possibly with a clamped value.
 */
public record ValidatedRecord(
    int entityKey,
    double timestamp,
    double value,
    SeriesTier tier
) {

    public static ValidatedRecord of(RawRecord raw, double value) {
        return new ValidatedRecord(raw.entityKey(), raw.timestamp(), value, raw.tier());
    }
}
