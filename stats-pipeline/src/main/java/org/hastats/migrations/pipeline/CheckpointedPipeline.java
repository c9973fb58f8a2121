package org.hastats.migrations.pipeline;

import java.util.List;

import org.hastats.migrations.pipeline.classify.EntityClassifier;
import org.hastats.migrations.pipeline.error.CheckpointException;
import org.hastats.migrations.pipeline.error.MigrationAbortedException;
import org.hastats.migrations.pipeline.error.SinkAuthenticationException;
import org.hastats.migrations.pipeline.error.SinkWriteException;
import org.hastats.migrations.pipeline.error.SourceReadException;
import org.hastats.migrations.pipeline.ir.ClassifiedEntity;
import org.hastats.migrations.pipeline.ir.RawRecord;
import org.hastats.migrations.pipeline.ir.SeriesTier;
import org.hastats.migrations.pipeline.ir.SinkPoint;
import org.hastats.migrations.pipeline.progress.ProgressEvent;
import org.hastats.migrations.pipeline.quality.QualityGate;
import org.hastats.migrations.pipeline.quality.ScreenedBatch;
import org.hastats.migrations.pipeline.sink.PointSink;
import org.hastats.migrations.pipeline.sink.WriteResult;
import org.hastats.migrations.pipeline.source.MetadataPage;
import org.hastats.migrations.pipeline.source.MetadataStream;
import org.hastats.migrations.pipeline.source.RecordStream;
import org.hastats.migrations.pipeline.source.StatisticsSource;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Wires a StatisticsSource to a PointSink, one entity and one batch at a time.
 *
 * For every metadata page from the checkpoint's cursor on, entities are classified and each
 * accepted, not yet completed entity is exported tier by tier. A batch moves through the quality
 * gate, becomes points, is written once, and only then advances the checkpoint. The next batch
 * is fetched while the current one is being written, never further ahead.
 */
@Slf4j
public class CheckpointedPipeline {

    private final StatisticsSource source;
    private final PointSink sink;
    private final EntityClassifier classifier;
    private final QualityGate qualityGate;

    public CheckpointedPipeline(StatisticsSource source, PointSink sink, EntityClassifier classifier,
                                QualityGate qualityGate) {
        this.source = source;
        this.sink = sink;
        this.classifier = classifier;
        this.qualityGate = qualityGate;
    }

    /**
     * Export everything the checkpoint does not cover yet. Returns a Flux of progress events; each
     * event is also handed to the context's listener.
     */
    public Flux<ProgressEvent> run(MigrationRunContext ctx) {
        var settings = ctx.getSettings();
        var metadata = new MetadataStream(source, settings.metadataPageSize(), settings.retryPolicy());
        var records = new RecordStream(source, settings.recordBatchSize(), settings.maxInClauseValues(),
            settings.retryPolicy());
        long startOffset = ctx.getCheckpoint().getMetadataCursor();

        return Mono.fromCallable(metadata::estimateCount)
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(count -> {
                ctx.setEstimatedEntities(count);
                log.info("{}Starting run {} at metadata offset {} ({} entities estimated, {} already completed)",
                    ctx.isDryRun() ? "[dry run] " : "", ctx.getRunId(), startOffset, count,
                    ctx.getCheckpoint().getEntitiesCompleted().size());
            })
            .flatMapMany(count -> metadata.pages(startOffset))
            .concatMap(page -> exportPage(page, records, ctx), 1)
            .doOnNext(ctx.getListener()::onEvent);
    }

    /**
     * Run to completion and summarize. Fatal failures surface as {@link MigrationAbortedException};
     * entity-level failures are listed in the summary instead.
     */
    public Mono<RunSummary> execute(MigrationRunContext ctx) {
        return run(ctx)
            .then(Mono.fromCallable(() -> finish(ctx)))
            .onErrorMap(e -> !(e instanceof MigrationAbortedException), e -> abort(ctx, e));
    }

    private Flux<ProgressEvent> exportPage(MetadataPage page, RecordStream records, MigrationRunContext ctx) {
        var classified = classifier.classifyPage(page.entities());
        var pageEvent = ctx.pageClassified(page, classified.summary());
        List<ClassifiedEntity> pending = classified.accepted().stream()
            .filter(ctx::shouldExport)
            .toList();

        return Flux.concat(
            Mono.just(pageEvent),
            Flux.fromIterable(pending).concatMap(entity -> exportEntity(entity, records, ctx), 1),
            Mono.<ProgressEvent>fromRunnable(() -> ctx.pageFinished(page))
        );
    }

    private Flux<ProgressEvent> exportEntity(ClassifiedEntity entity, RecordStream records, MigrationRunContext ctx) {
        return Flux.concat(
                exportTier(entity, SeriesTier.SHORT_TERM, records, ctx),
                exportTier(entity, SeriesTier.LONG_TERM, records, ctx),
                Mono.fromCallable(() -> ctx.entityCompleted(entity))
            )
            .onErrorResume(CheckpointedPipeline::isEntityScoped, e -> {
                log.atWarn().setMessage("Entity {} failed, continuing with the next one")
                    .addArgument(entity::externalId)
                    .setCause(e)
                    .log();
                return Mono.fromCallable(() -> ctx.entityFailed(entity, e));
            });
    }

    private Flux<ProgressEvent> exportTier(ClassifiedEntity entity, SeriesTier tier, RecordStream records,
                                           MigrationRunContext ctx) {
        var resumeAfter = ctx.resumePointFor(entity, tier);
        if (resumeAfter != null) {
            log.debug("Resuming {} {} after timestamp {}", entity.externalId(), tier.wireName(), resumeAfter.timestamp());
        }
        return records.batches(tier, List.of(entity.entityKey()), resumeAfter)
            .concatMap(batch -> processBatch(batch, entity, tier, ctx), 1);
    }

    private Mono<ProgressEvent> processBatch(List<RawRecord> batch, ClassifiedEntity entity, SeriesTier tier,
                                             MigrationRunContext ctx) {
        ScreenedBatch screened = qualityGate.screen(batch, entity, ctx.getQualityReport());
        List<SinkPoint> points = screened.survivors().stream()
            .map(validated -> SinkPoint.from(validated, entity))
            .toList();
        double lastTimestamp = batch.stream().mapToDouble(RawRecord::timestamp).max().orElse(0);

        Mono<Integer> written;
        if (ctx.isDryRun() || points.isEmpty()) {
            written = Mono.just(points.size());
        } else {
            written = sink.writeBatch(tier, points)
                .retryWhen(ctx.getSettings().retryPolicy().toSpec()
                    .doBeforeRetry(signal -> log.warn("Retrying write of {} {} points for {} (attempt {}): {}",
                        points.size(), tier.wireName(), entity.externalId(), signal.totalRetries() + 1,
                        signal.failure().getMessage())))
                .map(WriteResult::pointsWritten);
        }
        return written.map(count -> ctx.batchWritten(entity, tier, batch.size(), screened, count, lastTimestamp));
    }

    private RunSummary finish(MigrationRunContext ctx) {
        var summary = ctx.summarize();
        if (summary.fullySucceeded() && !ctx.isDryRun() && ctx.getSettings().entityIdFilter() == null) {
            ctx.getCheckpointStore().archive();
        } else if (!summary.fullySucceeded()) {
            log.warn("{} entities failed; rerun to retry them from checkpoint {}",
                summary.failedEntities().size(), ctx.getCheckpointStore().describe());
        }
        ctx.getListener().onSummary(summary);
        return summary;
    }

    /**
     * Failures confined to one entity: its statistics could not be read, or the sink refused its
     * points for a reason that retrying cannot fix. Everything else stops the run.
     */
    static boolean isEntityScoped(Throwable e) {
        if (e instanceof SourceReadException) {
            return true;
        }
        return e instanceof SinkWriteException writeFailure && !writeFailure.isRetryable();
    }

    private static MigrationAbortedException abort(MigrationRunContext ctx, Throwable cause) {
        String checkpoint = ctx.getCheckpointStore().describe();
        String instruction;
        if (ctx.isDryRun()) {
            instruction = "Nothing was written; fix the cause and rerun";
        } else if (cause instanceof SinkAuthenticationException) {
            instruction = "Check the sink token and organization, then rerun to resume from checkpoint " + checkpoint;
        } else if (cause instanceof CheckpointException) {
            instruction = "Fix or remove the checkpoint file " + checkpoint + " and rerun";
        } else if (cause instanceof SourceReadException) {
            instruction = "Check the source database, then rerun to resume from metadata offset "
                + ctx.getCheckpoint().getMetadataCursor() + " in checkpoint " + checkpoint;
        } else if (cause instanceof SinkWriteException) {
            instruction = "The sink is unavailable; rerun once it is reachable to resume from checkpoint " + checkpoint;
        } else {
            instruction = "Rerun to resume from checkpoint " + checkpoint;
        }
        log.error("Run {} aborted: {}", ctx.getRunId(), cause.getMessage(), cause);
        return new MigrationAbortedException("Migration aborted: " + cause.getMessage(), instruction, cause);
    }
}
