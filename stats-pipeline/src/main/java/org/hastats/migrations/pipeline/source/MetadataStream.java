package org.hastats.migrations.pipeline.source;

import org.hastats.migrations.pipeline.RetryPolicy;
import org.hastats.migrations.pipeline.error.SourceReadException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Paginated iteration over entity metadata.
 *
 * Pages are fetched lazily with offset pagination. The sequence cannot be restarted
 * mid-page: a restart always begins a fresh sequence from an explicit offset.
 */
@Slf4j
public class MetadataStream {

    public static final int DEFAULT_PAGE_SIZE = 5000;

    private final StatisticsSource source;
    private final int pageSize;
    private final RetryPolicy retryPolicy;

    public MetadataStream(StatisticsSource source, int pageSize, RetryPolicy retryPolicy) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.source = source;
        this.pageSize = pageSize;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Approximate number of entities, for progress percentages only. Returns -1 when the
     * source cannot provide one.
     */
    public long estimateCount() {
        try {
            return source.approximateEntityCount();
        } catch (RuntimeException e) {
            log.warn("Unable to estimate entity count, progress will be reported without a total", e);
            return -1;
        }
    }

    public Flux<MetadataPage> pages(long startOffset) {
        return fetchPage(startOffset)
            .expand(page -> page.last() ? Mono.empty() : fetchPage(page.nextOffset()))
            .filter(page -> !page.entities().isEmpty());
    }

    private Mono<MetadataPage> fetchPage(long offset) {
        return Mono.fromCallable(() -> source.readEntityPage(offset, pageSize))
            .subscribeOn(Schedulers.boundedElastic())
            .retryWhen(retryPolicy.toSpec()
                .doBeforeRetry(signal -> log.warn("Retrying metadata page at offset {} (attempt {}): {}",
                    offset, signal.totalRetries() + 1, signal.failure().getMessage())))
            .onErrorMap(e -> !(e instanceof SourceReadException),
                e -> new SourceReadException("Failed to read metadata page at offset " + offset, e))
            .map(entities -> new MetadataPage(offset, entities, entities.size() < pageSize))
            .doOnNext(page -> log.debug("Read {} metadata rows at offset {}", page.entities().size(), offset));
    }
}
