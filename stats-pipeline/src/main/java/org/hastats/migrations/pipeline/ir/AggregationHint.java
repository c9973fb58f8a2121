package org.hastats.migrations.pipeline.ir;

/** Sink-side rollup function associated with a category. */
public enum AggregationHint {
    LAST,
    MEAN,
    MAX,
    NONE
}
