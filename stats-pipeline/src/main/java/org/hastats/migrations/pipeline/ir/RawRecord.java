package org.hastats.migrations.pipeline.ir;

/**
 * One source statistic row. {@code timestamp} is epoch seconds exactly as stored at the source;
 * {@code value} is null when the source holds no data for the period.
 */
public record RawRecord(
    int entityKey,
    double timestamp,
    Double value,
    SeriesTier tier
) {}
