package org.hastats.migrations.pipeline.ir;

/**
 * An entity paired with its classification.
 */
public record ClassifiedEntity(
    EntityDescriptor descriptor,
    ClassificationResult classification
) {

    public String externalId() {
        return descriptor.externalId();
    }

    public int entityKey() {
        return descriptor.entityKey();
    }

    public EntityCategory category() {
        return classification.category();
    }
}
