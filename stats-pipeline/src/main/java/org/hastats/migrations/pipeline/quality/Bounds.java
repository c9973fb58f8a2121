package org.hastats.migrations.pipeline.quality;

/**
 * Inclusive value range. Either side may be infinite.
 */
public record Bounds(double min, double max) {

    public Bounds {
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new IllegalArgumentException("Invalid bounds [" + min + ", " + max + "]");
        }
    }

    public static Bounds of(double min, double max) {
        return new Bounds(min, max);
    }

    public static Bounds atLeast(double min) {
        return new Bounds(min, Double.POSITIVE_INFINITY);
    }

    /** Build bounds from optional limits, where a missing side is unbounded. */
    public static Bounds between(Double min, Double max) {
        return new Bounds(
            min == null ? Double.NEGATIVE_INFINITY : min,
            max == null ? Double.POSITIVE_INFINITY : max
        );
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }
}
