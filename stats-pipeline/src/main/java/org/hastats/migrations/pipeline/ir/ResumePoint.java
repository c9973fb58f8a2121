package org.hastats.migrations.pipeline.ir;

/**
 * Position in {@code (entityKey, timestamp)} order. Streams resumed from a point yield only
 * rows strictly after it.
 */
public record ResumePoint(int entityKey, double timestamp) {
}
