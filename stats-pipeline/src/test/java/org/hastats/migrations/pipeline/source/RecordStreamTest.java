package org.hastats.migrations.pipeline.source;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.hastats.migrations.pipeline.error.SourceReadException;
import org.hastats.migrations.pipeline.ir.RawRecord;
import org.hastats.migrations.pipeline.ir.ResumePoint;
import org.hastats.migrations.pipeline.ir.SeriesTier;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.hastats.migrations.pipeline.source.MetadataStreamTest.FAST_RETRY;
import static org.junit.jupiter.api.Assertions.*;

class RecordStreamTest {

    private static final int X = 42;

    private static List<RawRecord> drain(RecordStream stream, SeriesTier tier, List<Integer> keys, ResumePoint after) {
        return stream.batches(tier, keys, after)
            .flatMapIterable(batch -> batch)
            .collectList()
            .block();
    }

    @Test
    void resumeYieldsOnlyRowsAfterTheCheckpointedTimestamp() {
        var source = new SyntheticStatisticsSource()
            .withSeries(SeriesTier.LONG_TERM, X, 10, 100, 0)
            .withSeries(SeriesTier.SHORT_TERM, X, 10, 100, 0);
        var stream = new RecordStream(source, 3, 999, FAST_RETRY);

        var rows = drain(stream, SeriesTier.LONG_TERM, List.of(X), new ResumePoint(X, 500));

        assertEquals(List.of(600.0, 700.0, 800.0, 900.0),
            rows.stream().map(RawRecord::timestamp).collect(Collectors.toList()));
        assertTrue(rows.stream().allMatch(r -> r.tier() == SeriesTier.LONG_TERM));
    }

    @Test
    void resumePointOnlyCutsRowsOfItsOwnEntity() {
        var source = new SyntheticStatisticsSource()
            .withSeries(SeriesTier.LONG_TERM, 3, 10, 100, 0)
            .withSeries(SeriesTier.LONG_TERM, 9, 10, 100, 0);
        var stream = new RecordStream(source, 4, 999, FAST_RETRY);

        var rows = drain(stream, SeriesTier.LONG_TERM, List.of(3, 9), new ResumePoint(3, 500));

        assertEquals(14, rows.size());
        assertEquals(new ResumePoint(3, 600), new ResumePoint(rows.get(0).entityKey(), rows.get(0).timestamp()));
        assertEquals(10, rows.stream().filter(r -> r.entityKey() == 9).count());
        assertEquals(0.0, rows.get(4).timestamp());
    }

    @Test
    void batchesRespectTheConfiguredSize() {
        var source = new SyntheticStatisticsSource().withSeries(SeriesTier.SHORT_TERM, X, 10, 1, 0);
        var stream = new RecordStream(source, 4, 999, FAST_RETRY);

        StepVerifier.create(stream.batches(SeriesTier.SHORT_TERM, List.of(X), null))
            .assertNext(batch -> assertEquals(4, batch.size()))
            .assertNext(batch -> assertEquals(4, batch.size()))
            .assertNext(batch -> assertEquals(2, batch.size()))
            .verifyComplete();
    }

    @Test
    void rowsAreOrderedByKeyThenTimestamp() {
        var source = new SyntheticStatisticsSource()
            .withRecord(SeriesTier.LONG_TERM, 2, 10, 1.0)
            .withRecord(SeriesTier.LONG_TERM, 1, 30, 1.0)
            .withRecord(SeriesTier.LONG_TERM, 1, 20, 1.0)
            .withRecord(SeriesTier.LONG_TERM, 2, 5, 1.0);
        var stream = new RecordStream(source, 2, 999, FAST_RETRY);

        var rows = drain(stream, SeriesTier.LONG_TERM, List.of(1, 2), null);

        assertEquals(List.of("1@20.0", "1@30.0", "2@5.0", "2@10.0"),
            rows.stream().map(r -> r.entityKey() + "@" + r.timestamp()).collect(Collectors.toList()));
    }

    @Test
    void clientSideFilteringMatchesPushedDownFiltering() {
        var source = new SyntheticStatisticsSource();
        for (int key = 1; key <= 20; key++) {
            source.withSeries(SeriesTier.LONG_TERM, key, 7, 60, key * 10);
        }
        List<Integer> wanted = List.of(3, 4, 11, 19);

        var pushedDown = drain(new RecordStream(source, 5, 999, FAST_RETRY), SeriesTier.LONG_TERM, wanted, null);
        var clientSide = drain(new RecordStream(source, 5, 2, FAST_RETRY), SeriesTier.LONG_TERM, wanted, null);

        assertEquals(28, pushedDown.size());
        assertEquals(pushedDown, clientSide);
    }

    @Test
    void predicateIsPushedDownOnlyUpToTheLimit() {
        var source = new SyntheticStatisticsSource().withSeries(SeriesTier.LONG_TERM, 1, 3, 1, 0);
        var keys = IntStream.rangeClosed(1, 5).boxed().collect(Collectors.toList());

        drain(new RecordStream(source, 10, 5, FAST_RETRY), SeriesTier.LONG_TERM, keys, null);
        drain(new RecordStream(source, 10, 4, FAST_RETRY), SeriesTier.LONG_TERM, keys, null);

        var requests = source.getRecordRequests();
        assertEquals(Set.of(1, 2, 3, 4, 5), requests.get(0).entityKeys());
        assertFalse(requests.get(1).isFiltered());
    }

    @Test
    void unfilteredScanDoesNotEmitEmptyBatches() {
        var source = new SyntheticStatisticsSource()
            .withSeries(SeriesTier.LONG_TERM, 1, 10, 1, 0)
            .withSeries(SeriesTier.LONG_TERM, 2, 10, 1, 0)
            .withSeries(SeriesTier.LONG_TERM, 3, 2, 1, 0);
        var stream = new RecordStream(source, 5, 1, FAST_RETRY);

        StepVerifier.create(stream.batches(SeriesTier.LONG_TERM, List.of(3, 9), null))
            .assertNext(batch -> assertEquals(2, batch.size()))
            .verifyComplete();
    }

    @Test
    void emptyKeySetReadsNothing() {
        var source = new SyntheticStatisticsSource();

        StepVerifier.create(new RecordStream(source, 5, 999, FAST_RETRY).batches(SeriesTier.LONG_TERM, List.of(), null))
            .verifyComplete();
        assertEquals(0, source.getRecordPageReads());
    }

    @Test
    void failedReadsAreRetriedThenReported() {
        var flaky = new SyntheticStatisticsSource()
            .withSeries(SeriesTier.LONG_TERM, X, 3, 1, 0)
            .failRecordReads(X, 2);
        assertEquals(3, drain(new RecordStream(flaky, 10, 999, FAST_RETRY), SeriesTier.LONG_TERM, List.of(X), null).size());

        var broken = new SyntheticStatisticsSource()
            .withSeries(SeriesTier.LONG_TERM, X, 3, 1, 0)
            .failRecordReads(X, 100);
        StepVerifier.create(new RecordStream(broken, 10, 999, FAST_RETRY).batches(SeriesTier.LONG_TERM, List.of(X), null))
            .expectError(SourceReadException.class)
            .verify();
    }
}
