package org.hastats.migrations.pipeline.source;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.hastats.migrations.pipeline.RetryPolicy;
import org.hastats.migrations.pipeline.error.SourceReadException;
import org.hastats.migrations.pipeline.ir.RawRecord;
import org.hastats.migrations.pipeline.ir.ResumePoint;
import org.hastats.migrations.pipeline.ir.SeriesTier;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Paginated iteration over statistic rows for a set of entities.
 *
 * Rows come back in {@code (entityKey, timestamp)} order, paged by keyset so a resume is
 * simply "rows after the last checkpointed position". Source engines cap how many values an
 * inclusion predicate may hold; up to {@code maxInClauseValues} keys the membership test is
 * pushed down, above it the scan is unfiltered and membership is checked against a hash set.
 */
@Slf4j
public class RecordStream {

    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final int DEFAULT_MAX_IN_CLAUSE_VALUES = 999;

    private final StatisticsSource source;
    private final int batchSize;
    private final int maxInClauseValues;
    private final RetryPolicy retryPolicy;

    public RecordStream(StatisticsSource source, int batchSize, int maxInClauseValues, RetryPolicy retryPolicy) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.source = source;
        this.batchSize = batchSize;
        this.maxInClauseValues = maxInClauseValues;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Stream batches of one tier for the given entities.
     *
     * @param resumeAfter exclusive start position, or null to read from the beginning
     */
    public Flux<List<RawRecord>> batches(SeriesTier tier, Collection<Integer> entityKeys, ResumePoint resumeAfter) {
        if (entityKeys.isEmpty()) {
            return Flux.empty();
        }
        Set<Integer> keys = new HashSet<>(entityKeys);
        boolean pushDown = keys.size() <= maxInClauseValues;
        if (!pushDown) {
            log.debug("{} entities exceed the {}-value predicate limit, filtering {} client-side",
                keys.size(), maxInClauseValues, tier.wireName());
        }
        var firstRequest = new RecordPageRequest(pushDown ? keys : null, resumeAfter, batchSize);

        return fetchPage(tier, firstRequest)
            .expand(page -> page.exhausted() ? Mono.empty() : fetchPage(tier, page.nextRequest()))
            .map(page -> pushDown ? page.rows() : retainMembers(page.rows(), keys))
            .filter(batch -> !batch.isEmpty());
    }

    private Mono<RecordPage> fetchPage(SeriesTier tier, RecordPageRequest request) {
        return Mono.fromCallable(() -> source.readRecordPage(tier, request))
            .subscribeOn(Schedulers.boundedElastic())
            .retryWhen(retryPolicy.toSpec()
                .doBeforeRetry(signal -> log.warn("Retrying {} page after {} (attempt {}): {}",
                    tier.wireName(), request.after(), signal.totalRetries() + 1, signal.failure().getMessage())))
            .onErrorMap(e -> !(e instanceof SourceReadException),
                e -> new SourceReadException("Failed to read " + tier.wireName() + " rows after " + request.after(), e))
            .map(rows -> new RecordPage(request, rows));
    }

    private static List<RawRecord> retainMembers(List<RawRecord> rows, Set<Integer> keys) {
        var members = new ArrayList<RawRecord>(rows.size());
        for (RawRecord row : rows) {
            if (keys.contains(row.entityKey())) {
                members.add(row);
            }
        }
        return members;
    }

    private record RecordPage(RecordPageRequest request, List<RawRecord> rows) {

        boolean exhausted() {
            return rows.size() < request.limit();
        }

        RecordPageRequest nextRequest() {
            var lastRow = rows.get(rows.size() - 1);
            return request.continueAfter(new ResumePoint(lastRow.entityKey(), lastRow.timestamp()));
        }
    }
}
