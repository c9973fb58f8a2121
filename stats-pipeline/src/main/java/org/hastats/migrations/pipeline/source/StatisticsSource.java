package org.hastats.migrations.pipeline.source;

import java.util.List;

import org.hastats.migrations.pipeline.ir.EntityDescriptor;
import org.hastats.migrations.pipeline.ir.RawRecord;
import org.hastats.migrations.pipeline.ir.SeriesTier;

/**
 * Port for reading entity metadata and statistic rows from the relational source.
 *
 * Calls are blocking; the streams built on top of it move them off the caller's thread.
 * Implementations treat the source as read-only.
 */
public interface StatisticsSource extends AutoCloseable {

    /** Fast, possibly inaccurate count of entity metadata rows. */
    long approximateEntityCount();

    /**
     * One page of entity metadata in a stable order, with the attributes side reduced to
     * at most one row per entity.
     */
    List<EntityDescriptor> readEntityPage(long offset, int limit);

    /**
     * Statistic rows of one tier ordered by {@code (entityKey, timestamp)}, strictly after
     * {@link RecordPageRequest#after()} when set.
     */
    List<RawRecord> readRecordPage(SeriesTier tier, RecordPageRequest request);

    @Override
    default void close() throws Exception {
        // Default no-op for sources that don't hold resources
    }
}
