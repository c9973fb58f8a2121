package org.hastats.migrations;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;

import org.hastats.migrations.config.MigrationConfig;
import org.hastats.migrations.pipeline.CheckpointedPipeline;
import org.hastats.migrations.pipeline.MigrationRunContext;
import org.hastats.migrations.pipeline.RunSummary;
import org.hastats.migrations.pipeline.checkpoint.CheckpointState;
import org.hastats.migrations.pipeline.checkpoint.CheckpointStore;
import org.hastats.migrations.pipeline.checkpoint.FileCheckpointStore;
import org.hastats.migrations.pipeline.classify.EntityClassifier;
import org.hastats.migrations.pipeline.error.CheckpointException;
import org.hastats.migrations.pipeline.error.MigrationAbortedException;
import org.hastats.migrations.pipeline.error.MigrationException;
import org.hastats.migrations.pipeline.error.SourceReadException;
import org.hastats.migrations.pipeline.progress.LoggingProgressListener;
import org.hastats.migrations.pipeline.quality.QualityGate;
import org.hastats.migrations.pipeline.sink.PointSink;
import org.hastats.migrations.pipeline.source.StatisticsSource;
import org.hastats.migrations.sink.influx.InfluxLineProtocolSink;
import org.hastats.migrations.source.jdbc.JdbcStatisticsSource;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Wires the SQLite source, the InfluxDB sink and the checkpoint file around a
 * {@link CheckpointedPipeline} for one configured migration.
 */
@Slf4j
public class StatisticsMigrationRunner {

    private static final PointSink DRY_RUN_SINK =
        (tier, batch) -> Mono.error(new IllegalStateException("A dry run must not write to the sink"));

    private final MigrationConfig config;
    private final Function<MigrationConfig, StatisticsSource> sourceFactory;
    private final Function<MigrationConfig, PointSink> sinkFactory;
    private final Clock clock;

    public StatisticsMigrationRunner(MigrationConfig config) {
        this(config,
            c -> JdbcStatisticsSource.open(c.databaseFile()),
            c -> new InfluxLineProtocolSink(c.influx().toConnectionContext()),
            Clock.systemUTC());
    }

    StatisticsMigrationRunner(MigrationConfig config,
                              Function<MigrationConfig, StatisticsSource> sourceFactory,
                              Function<MigrationConfig, PointSink> sinkFactory,
                              Clock clock) {
        this.config = config;
        this.sourceFactory = sourceFactory;
        this.sinkFactory = sinkFactory;
        this.clock = clock;
    }

    /**
     * Export everything not yet recorded as done in the checkpoint.
     *
     * @throws MigrationAbortedException when a fatal failure stops the run
     */
    public RunSummary run() {
        return execute(false);
    }

    /** Read, classify and screen everything without writing points or touching the checkpoint. */
    public RunSummary dryRun() {
        return execute(true);
    }

    /** Delete the checkpoint so the next run starts from the first entity. */
    public void reset() {
        checkpointStore().reset();
    }

    private RunSummary execute(boolean dryRun) {
        config.validate(dryRun);
        CheckpointStore store = checkpointStore();
        if (!config.resume()) {
            if (dryRun) {
                log.info("Resume disabled; the dry run ignores checkpoint {}", store.describe());
                store = new IgnoredCheckpointStore(store);
            } else {
                log.info("Resume disabled; discarding checkpoint {}", store.describe());
                store.reset();
            }
        }

        var ctx = buildContext(store, dryRun);
        try (var source = openSource(); var sink = dryRun ? DRY_RUN_SINK : sinkFactory.apply(config)) {
            var pipeline = new CheckpointedPipeline(source, sink,
                new EntityClassifier(config.classifier().toRules()),
                new QualityGate(config.quality().toRules()));
            return pipeline.execute(ctx).block();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new MigrationException("Failed to release migration resources", e);
        }
    }

    private MigrationRunContext buildContext(CheckpointStore store, boolean dryRun) {
        try {
            return MigrationRunContext.builder()
                .settings(config.toPipelineSettings())
                .dryRun(dryRun)
                .checkpointStore(store)
                .listener(new LoggingProgressListener(config.progressInterval()))
                .clock(clock)
                .build();
        } catch (CheckpointException e) {
            throw new MigrationAbortedException("Cannot load checkpoint",
                "Fix or remove the checkpoint file " + store.describe() + " and rerun", e);
        }
    }

    private StatisticsSource openSource() {
        try {
            return sourceFactory.apply(config);
        } catch (SourceReadException e) {
            throw new MigrationAbortedException("Cannot open source database " + config.databasePath(),
                "Check databasePath (or HA_DATABASE_PATH) points at a recorder database and rerun", e);
        }
    }

    private FileCheckpointStore checkpointStore() {
        return new FileCheckpointStore(config.checkpointPath(), config.archiveCheckpointOnSuccess(), clock);
    }

    /** Reports no saved state; a dry run never saves, archives or resets. */
    private static final class IgnoredCheckpointStore implements CheckpointStore {
        private final CheckpointStore delegate;

        IgnoredCheckpointStore(CheckpointStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<CheckpointState> load() {
            return Optional.empty();
        }

        @Override
        public void save(CheckpointState state) {
            throw new UnsupportedOperationException("A dry run does not save checkpoints");
        }

        @Override
        public void archive() {
            throw new UnsupportedOperationException("A dry run does not archive checkpoints");
        }

        @Override
        public void reset() {
            throw new UnsupportedOperationException("A dry run does not reset checkpoints");
        }

        @Override
        public String describe() {
            return delegate.describe();
        }
    }
}
