package org.hastats.migrations.pipeline.source;

import java.util.List;

import org.hastats.migrations.pipeline.ir.EntityDescriptor;

/**
 * One page of entity metadata and where it sits in the pagination.
 */
public record MetadataPage(
    long offset,
    List<EntityDescriptor> entities,
    boolean last
) {

    public long nextOffset() {
        return offset + entities.size();
    }
}
