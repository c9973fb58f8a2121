package org.hastats.migrations.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import org.hastats.migrations.pipeline.checkpoint.CheckpointState;
import org.hastats.migrations.pipeline.checkpoint.FileCheckpointStore;
import org.hastats.migrations.pipeline.classify.ClassifierRules;
import org.hastats.migrations.pipeline.classify.EntityClassifier;
import org.hastats.migrations.pipeline.error.MigrationAbortedException;
import org.hastats.migrations.pipeline.error.SinkAuthenticationException;
import org.hastats.migrations.pipeline.error.SinkWriteException;
import org.hastats.migrations.pipeline.ir.EntityDescriptor;
import org.hastats.migrations.pipeline.ir.SeriesTier;
import org.hastats.migrations.pipeline.ir.SinkPoint;
import org.hastats.migrations.pipeline.progress.ProgressEvent;
import org.hastats.migrations.pipeline.quality.QualityGate;
import org.hastats.migrations.pipeline.quality.QualityRules;
import org.hastats.migrations.pipeline.sink.CollectingPointSink;
import org.hastats.migrations.pipeline.sink.FailingPointSink;
import org.hastats.migrations.pipeline.sink.PointSink;
import org.hastats.migrations.pipeline.sink.WriteResult;
import org.hastats.migrations.pipeline.source.StatisticsSource;
import org.hastats.migrations.pipeline.source.SyntheticStatisticsSource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.hastats.migrations.pipeline.source.SyntheticStatisticsSource.sensor;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Runs the whole pipeline against the synthetic source and in-memory sinks.
 */
@ExtendWith(MockitoExtension.class)
class CheckpointedPipelineTest {

    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5));
    private static final PipelineSettings SETTINGS = PipelineSettings.builder()
        .metadataPageSize(2)
        .recordBatchSize(4)
        .maxInClauseValues(999)
        .retryPolicy(FAST_RETRY)
        .build();

    @TempDir
    Path tempDir;

    @Mock
    private PointSink unusedSink;

    private Path checkpointFile() {
        return tempDir.resolve("export_checkpoint.json");
    }

    private FileCheckpointStore store() {
        return new FileCheckpointStore(checkpointFile());
    }

    private MigrationRunContext context(boolean dryRun, PipelineSettings settings) {
        return MigrationRunContext.builder()
            .runId("test-run")
            .settings(settings)
            .dryRun(dryRun)
            .checkpointStore(store())
            .build();
    }

    private MigrationRunContext context() {
        return context(false, SETTINGS);
    }

    private static CheckpointedPipeline pipeline(StatisticsSource source, PointSink sink) {
        return new CheckpointedPipeline(source, sink,
            new EntityClassifier(ClassifierRules.defaults()),
            new QualityGate(QualityRules.defaults()));
    }

    /** energy, power | temperature, light (rejected); 10 short-term and 7 long-term rows each. */
    private static SyntheticStatisticsSource household() {
        var source = new SyntheticStatisticsSource()
            .withEntity(sensor(1, "energy", "kWh"))
            .withEntity(sensor(2, "power", "W"))
            .withEntity(sensor(3, "temperature", "°C"))
            .withEntity(EntityDescriptor.fromMetadata(4, "light.hall", null, null, null, null, null, null));
        for (int key = 1; key <= 4; key++) {
            source.withSeries(SeriesTier.SHORT_TERM, key, 10, 300, 10);
            source.withSeries(SeriesTier.LONG_TERM, key, 7, 3600, 20);
        }
        return source;
    }

    private static final int HOUSEHOLD_POINTS = 3 * (10 + 7);

    private static Set<String> identities(List<SinkPoint> points) {
        return points.stream()
            .map(p -> p.tags().get(SinkPoint.TAG_ENTITY_ID) + "/" + p.tier().wireName() + "/" + p.timestamp()
                + "=" + p.value())
            .collect(Collectors.toSet());
    }

    @Test
    void temperatureExampleWritesTwoCorrectedPoints() {
        var source = new SyntheticStatisticsSource()
            .withEntity(sensor(1, "temp_1", "°C"))
            .withRecord(SeriesTier.LONG_TERM, 1, 1, 21.0)
            .withRecord(SeriesTier.LONG_TERM, 1, 2, 999.0)
            .withRecord(SeriesTier.LONG_TERM, 1, 3, Double.NaN);
        var sink = new CollectingPointSink();

        var summary = pipeline(source, sink).execute(context()).block();

        var points = sink.getPoints();
        assertEquals(2, points.size());
        assertTrue(points.stream().allMatch(p -> p.measurement().equals("°C")));
        assertTrue(points.stream().allMatch(p -> p.tags().get(SinkPoint.TAG_CATEGORY).equals("temperature")));
        assertEquals(List.of(21.0, 80.0), points.stream().map(SinkPoint::value).collect(Collectors.toList()));
        assertEquals(List.of(1.0, 2.0), points.stream().map(SinkPoint::timestamp).collect(Collectors.toList()));
        assertEquals("temp_1", points.get(0).tags().get(SinkPoint.TAG_ENTITY_ID));
        assertEquals("migration", points.get(0).tags().get(SinkPoint.TAG_SOURCE));

        assertTrue(summary.fullySucceeded());
        assertEquals(1, summary.entitiesCompleted());
        assertEquals(3, summary.recordsRead());
        assertEquals(2, summary.pointsWritten());
        assertEquals(1, summary.quality().totalCorrected());
        assertEquals(1, summary.quality().totalDropped());
        assertFalse(Files.exists(checkpointFile()), "checkpoint is archived after a complete run");
    }

    @Test
    void everyAcceptedRecordReachesTheSink() {
        var sink = new CollectingPointSink();

        var summary = pipeline(household(), sink).execute(context()).block();

        assertEquals(HOUSEHOLD_POINTS, sink.getPoints().size());
        assertEquals(3, summary.entitiesCompleted());
        assertEquals(4, summary.classification().total());
        assertEquals(3, summary.classification().accepted());
        assertTrue(sink.getPoints().stream().noneMatch(p -> p.tags().get(SinkPoint.TAG_DOMAIN).equals("light")));
        assertTrue(sink.getLargestBatch() <= SETTINGS.recordBatchSize());
    }

    @Test
    void eventsFollowPagesEntitiesAndBatches() {
        var source = new SyntheticStatisticsSource()
            .withEntity(sensor(1, "energy", "kWh"))
            .withSeries(SeriesTier.SHORT_TERM, 1, 2, 300, 1);
        var ctx = context();

        StepVerifier.create(pipeline(source, new CollectingPointSink()).run(ctx))
            .assertNext(event -> {
                assertEquals(ProgressEvent.Phase.METADATA_PAGE, event.phase());
                assertEquals(1, event.estimatedEntities());
                assertEquals(1, event.batchAccepted());
            })
            .assertNext(event -> {
                assertEquals(ProgressEvent.Phase.RECORD_BATCH, event.phase());
                assertEquals(SeriesTier.SHORT_TERM, event.tier());
                assertEquals(2, event.batchWritten());
                assertEquals(2, event.totalWritten());
            })
            .assertNext(event -> {
                assertEquals(ProgressEvent.Phase.ENTITY_COMPLETED, event.phase());
                assertEquals("sensor.energy", event.externalId());
                assertEquals(100.0, event.percentComplete());
            })
            .verifyComplete();

        assertTrue(ctx.getCheckpoint().isCompleted("sensor.energy"));
        assertEquals(1, ctx.getCheckpoint().getMetadataCursor());
    }

    @Test
    void entitiesCompletedByAnEarlierRunCountTowardsProgress() {
        var source = new SyntheticStatisticsSource()
            .withEntity(sensor(1, "energy", "kWh"))
            .withEntity(sensor(2, "power", "W"))
            .withSeries(SeriesTier.SHORT_TERM, 1, 2, 300, 1)
            .withSeries(SeriesTier.SHORT_TERM, 2, 2, 300, 1);
        var state = CheckpointState.fresh("earlier-run", Instant.EPOCH);
        state.markCompleted("sensor.energy");
        store().save(state);

        List<ProgressEvent> events = pipeline(source, new CollectingPointSink()).run(context()).collectList().block();

        var completed = events.stream()
            .filter(e -> e.phase() == ProgressEvent.Phase.ENTITY_COMPLETED)
            .collect(Collectors.toList());
        assertEquals(1, completed.size());
        var last = completed.get(0);
        assertEquals("sensor.power", last.externalId());
        assertEquals(1, last.entitiesCompleted());
        assertEquals(1, last.entitiesSkipped());
        assertEquals(100.0, last.percentComplete());
    }

    @Test
    void resumedRunFinishesWhatAnAbortedRunStarted() {
        var reference = new CollectingPointSink();
        pipeline(household(), reference).execute(context(false, SETTINGS)).block();
        var expected = identities(reference.getPoints());

        for (int killAfter : List.of(0, 1, 4, 7, 14)) {
            var dying = FailingPointSink.afterWrites(killAfter, new SinkAuthenticationException("HTTP 401"));
            var aborted = assertThrows(MigrationAbortedException.class,
                () -> pipeline(household(), dying).execute(context()).block());
            assertTrue(aborted.getResumeInstruction().contains(checkpointFile().toString()));
            assertEquals(killAfter > 0, Files.exists(checkpointFile()), "checkpoint survives the abort");

            var resumed = new CollectingPointSink();
            var summary = pipeline(household(), resumed).execute(context()).block();

            assertTrue(summary.fullySucceeded());
            var union = new HashSet<>(identities(dying.getPoints()));
            union.addAll(identities(resumed.getPoints()));
            assertEquals(expected, union, "kill after " + killAfter);
            assertEquals(HOUSEHOLD_POINTS, dying.getPoints().size() + resumed.getPoints().size(),
                "confirmed batches are not re-sent");
            assertFalse(Files.exists(checkpointFile()));
        }
    }

    @Test
    void inProgressTierResumesStrictlyAfterTheCheckpointedTimestamp() {
        var source = new SyntheticStatisticsSource()
            .withEntity(sensor(9, "x", "kWh"))
            .withSeries(SeriesTier.SHORT_TERM, 9, 3, 100, 0)
            .withSeries(SeriesTier.LONG_TERM, 9, 10, 100, 0);
        var state = CheckpointState.fresh("earlier-run", Instant.EPOCH);
        state.markWritten("sensor.x", SeriesTier.SHORT_TERM, 200, 3, 3);
        state.markWritten("sensor.x", SeriesTier.LONG_TERM, 500, 6, 6);
        store().save(state);
        var sink = new CollectingPointSink();

        pipeline(source, sink).execute(context()).block();

        var timestamps = sink.getPoints().stream().map(SinkPoint::timestamp).collect(Collectors.toList());
        assertEquals(List.of(600.0, 700.0, 800.0, 900.0), timestamps);
        assertTrue(sink.getPoints().stream().allMatch(p -> p.tier() == SeriesTier.LONG_TERM));
    }

    @Test
    void completedEntitiesAreSkipped() {
        var state = CheckpointState.fresh("earlier-run", Instant.EPOCH);
        state.markCompleted("sensor.energy");
        state.markCompleted("sensor.power");
        store().save(state);
        var sink = new CollectingPointSink();

        var summary = pipeline(household(), sink).execute(context()).block();

        assertEquals(Set.of("temperature"),
            sink.getPoints().stream().map(p -> p.tags().get(SinkPoint.TAG_ENTITY_ID)).collect(Collectors.toSet()));
        assertEquals(2, summary.entitiesSkipped());
        assertEquals(1, summary.entitiesCompleted());
    }

    @Test
    void dryRunTouchesNeitherSinkNorCheckpoint() {
        var ctx = context(true, SETTINGS);
        List<ProgressEvent> events = pipeline(household(), unusedSink).run(ctx).collectList().block();

        verifyNoInteractions(unusedSink);
        assertFalse(Files.exists(checkpointFile()));
        assertTrue(ctx.getCheckpoint().getEntitiesCompleted().isEmpty());
        assertTrue(ctx.getCheckpoint().getInProgress().isEmpty());
        assertEquals(0, ctx.getCheckpoint().getMetadataCursor());
        assertTrue(events.stream().allMatch(ProgressEvent::dryRun));
        long wouldWrite = events.stream()
            .filter(e -> e.phase() == ProgressEvent.Phase.RECORD_BATCH)
            .mapToLong(ProgressEvent::batchWritten)
            .sum();
        assertEquals(HOUSEHOLD_POINTS, wouldWrite);
    }

    @Test
    void dryRunSummaryDoesNotArchive() throws Exception {
        var state = CheckpointState.fresh("earlier-run", Instant.EPOCH);
        state.markCompleted("sensor.energy");
        store().save(state);
        String before = Files.readString(checkpointFile());

        var summary = pipeline(household(), unusedSink).execute(context(true, SETTINGS)).block();

        assertTrue(summary.dryRun());
        assertEquals(2, summary.entitiesCompleted());
        assertEquals(before, Files.readString(checkpointFile()));
    }

    @Test
    void oneFailingEntityDoesNotStopTheRun() {
        var source = household().failRecordReads(2, 100);
        var sink = new CollectingPointSink();

        var summary = pipeline(source, sink).execute(context()).block();

        assertFalse(summary.fullySucceeded());
        assertEquals(Set.of("sensor.power"), summary.failedEntities().keySet());
        assertEquals(2, summary.entitiesCompleted());
        assertEquals(2 * 17, sink.getPoints().size());

        var saved = store().load().orElseThrow();
        assertTrue(saved.getEntitiesFailed().containsKey("sensor.power"));
        assertEquals(0, saved.getMetadataCursor(), "the page holding a failed entity is read again");
        assertTrue(saved.isCompleted("sensor.energy"));
        assertTrue(saved.isCompleted("sensor.temperature"));

        var retrySink = new CollectingPointSink();
        var retry = pipeline(household(), retrySink).execute(context()).block();

        assertTrue(retry.fullySucceeded());
        assertEquals(2, retry.entitiesSkipped());
        assertEquals(17, retrySink.getPoints().size());
        assertFalse(Files.exists(checkpointFile()));
    }

    @Test
    void permanentlyRejectedBatchFailsOnlyItsEntity() {
        var sink = new FailingPointSink(
            batch -> batch.get(0).tags().get(SinkPoint.TAG_ENTITY_ID).equals("power"),
            batch -> new SinkWriteException("HTTP 400: field type conflict", 400));

        var summary = pipeline(household(), sink).execute(context()).block();

        assertEquals(Set.of("sensor.power"), summary.failedEntities().keySet());
        assertEquals(1, sink.getAttempts() - 2 * 5, "a 400 is not retried");
    }

    @Test
    void unavailableSinkAbortsTheRunAfterRetries() {
        var sink = FailingPointSink.afterWrites(0, new SinkWriteException("HTTP 503", 503));

        var aborted = assertThrows(MigrationAbortedException.class,
            () -> pipeline(household(), sink).execute(context()).block());

        assertEquals(1 + FAST_RETRY.maxRetries(), sink.getAttempts());
        assertTrue(aborted.getResumeInstruction().contains("unavailable"));
    }

    @Test
    void transientWriteFailuresAreRetried() {
        var failures = new AtomicLong(2);
        var sink = new FailingPointSink(batch -> failures.getAndDecrement() > 0,
            batch -> new SinkWriteException("connection reset", new IOException("reset")));

        var summary = pipeline(household(), sink).execute(context()).block();

        assertTrue(summary.fullySucceeded());
        assertEquals(HOUSEHOLD_POINTS, sink.getPoints().size());
    }

    @Test
    void authenticationFailureAbortsWithoutRetry() {
        var sink = FailingPointSink.afterWrites(0, new SinkAuthenticationException("HTTP 401: unauthorized"));

        var aborted = assertThrows(MigrationAbortedException.class,
            () -> pipeline(household(), sink).execute(context()).block());

        assertEquals(1, sink.getAttempts());
        assertInstanceOf(SinkAuthenticationException.class, aborted.getCause());
        assertTrue(aborted.getResumeInstruction().contains("token"));
    }

    @Test
    void metadataFailureAbortsWithTheCursorIntact() {
        var state = CheckpointState.fresh("earlier-run", Instant.EPOCH);
        state.setMetadataCursor(2);
        store().save(state);
        var source = household().failMetadataReads(100);

        var aborted = assertThrows(MigrationAbortedException.class,
            () -> pipeline(source, new CollectingPointSink()).execute(context()).block());

        assertTrue(aborted.getResumeInstruction().contains("metadata offset 2"));
        assertEquals(2, store().load().orElseThrow().getMetadataCursor());
    }

    @Test
    void entityFilterNarrowsTheRunAndKeepsTheCheckpoint() {
        var sink = new CollectingPointSink();
        var settings = SETTINGS.toBuilder().entityIdFilter("TEMP").build();

        var summary = pipeline(household(), sink).execute(context(false, settings)).block();

        assertEquals(1, summary.entitiesCompleted());
        assertEquals(17, sink.getPoints().size());
        var saved = store().load().orElseThrow();
        assertEquals(0, saved.getMetadataCursor());
        assertTrue(saved.isCompleted("sensor.temperature"));
    }

    @Test
    void inFlightRecordsStayBoundedByBatchSize() {
        var source = new SyntheticStatisticsSource();
        for (int key = 1; key <= 5; key++) {
            source.withEntity(sensor(key, "meter_" + key, "kWh"));
            source.withSeries(SeriesTier.SHORT_TERM, key, 300, 300, 1);
            source.withSeries(SeriesTier.LONG_TERM, key, 200, 3600, 1);
        }
        var peak = new AtomicLong();
        var written = new AtomicLong();
        var collecting = new CollectingPointSink();
        PointSink sink = (tier, batch) -> Mono.defer(() -> {
            peak.accumulateAndGet(source.getRowsServed() - written.get(), Math::max);
            written.addAndGet(batch.size());
            return collecting.writeBatch(tier, batch);
        });

        pipeline(source, sink).execute(context()).block();

        assertEquals(5 * 500, written.get());
        assertTrue(peak.get() <= 4L * SETTINGS.recordBatchSize(), "peak in-flight " + peak.get());
    }

    @Test
    void failedEntitiesAreReportedWithTheirCause() {
        var source = household().failRecordReads(3, 100);

        var summary = pipeline(source, new CollectingPointSink()).execute(context()).block();

        Map<String, String> failed = new TreeMap<>(summary.failedEntities());
        assertEquals(1, failed.size());
        assertTrue(failed.get("sensor.temperature").contains("short_term"), failed.toString());
        assertTrue(summary.successRate() > 66 && summary.successRate() < 67);
    }

    @Test
    void writeResultIsCountedFromTheSink() {
        PointSink acknowledging = (tier, batch) -> Mono.just(new WriteResult(tier, batch.size(), Duration.ZERO));
        var summary = pipeline(household(), acknowledging).execute(context()).block();

        assertEquals(HOUSEHOLD_POINTS, summary.pointsWritten());
    }
}
