package org.hastats.migrations.pipeline.checkpoint;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.hastats.migrations.pipeline.error.CheckpointException;
import org.hastats.migrations.pipeline.ir.SeriesTier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores the checkpoint as a JSON file.
 *
 * Saves go through a temporary sibling file followed by an atomic rename, so an interrupted
 * save leaves either the previous snapshot or the new one. A file that is not valid JSON, or
 * whose content cannot be resumed from, is moved aside and treated as absent; a file from a
 * newer format version is refused.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final Set<String> WIRE_NAMES = Arrays.stream(SeriesTier.values())
        .map(SeriesTier::wireName)
        .collect(Collectors.toUnmodifiableSet());

    private final Path file;
    private final boolean archiveOnSuccess;
    private final Clock clock;

    public FileCheckpointStore(Path file, boolean archiveOnSuccess, Clock clock) {
        this.file = file.toAbsolutePath();
        this.archiveOnSuccess = archiveOnSuccess;
        this.clock = clock;
    }

    public FileCheckpointStore(Path file) {
        this(file, true, Clock.systemUTC());
    }

    @Override
    public Optional<CheckpointState> load() {
        if (!Files.exists(file)) {
            log.info("No checkpoint at {}, starting fresh", file);
            return Optional.empty();
        }
        CheckpointState state;
        try {
            state = OBJECT_MAPPER.readValue(file.toFile(), CheckpointState.class);
        } catch (JsonProcessingException e) {
            var moved = moveAside("corrupt");
            log.warn("Checkpoint {} is malformed ({}), moved to {} and starting fresh", file, e.getOriginalMessage(), moved);
            return Optional.empty();
        } catch (IOException e) {
            throw new CheckpointException("Unable to read checkpoint " + file, e);
        }
        if (state == null) {
            log.warn("Checkpoint {} is empty, starting fresh", file);
            return Optional.empty();
        }
        if (state.getVersion() > CheckpointState.CURRENT_VERSION) {
            throw new CheckpointException("Checkpoint " + file + " has format version " + state.getVersion()
                + ", this build reads up to version " + CheckpointState.CURRENT_VERSION);
        }
        var problems = problemsOf(state);
        if (!problems.isEmpty()) {
            var moved = moveAside("corrupt");
            log.warn("Checkpoint {} is inconsistent ({}), moved to {} and starting fresh",
                file, String.join("; ", problems), moved);
            return Optional.empty();
        }
        log.info("Loaded checkpoint {}: {} entities completed, {} in progress, metadata offset {}",
            file, state.getEntitiesCompleted().size(), state.getInProgress().size(), state.getMetadataCursor());
        return Optional.of(state);
    }

    @Override
    public void save(CheckpointState state) {
        state.setUpdatedAt(clock.instant());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            OBJECT_MAPPER.writeValue(temp.toFile(), state);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CheckpointException("Unable to save checkpoint " + file, e);
        }
        log.atTrace().setMessage("Saved checkpoint {}").addArgument(file).log();
    }

    @Override
    public void archive() {
        if (!Files.exists(file)) {
            return;
        }
        if (archiveOnSuccess) {
            var archived = moveAside("completed");
            log.info("Checkpoint archived to {}", archived);
        } else {
            reset();
        }
    }

    @Override
    public void reset() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Checkpoint {} deleted", file);
            }
        } catch (IOException e) {
            throw new CheckpointException("Unable to delete checkpoint " + file, e);
        }
    }

    @Override
    public String describe() {
        return file.toString();
    }

    public Path getFile() {
        return file;
    }

    /** Everything in a parsed state that a resumed run could not act on safely. */
    static List<String> problemsOf(CheckpointState state) {
        var problems = new ArrayList<String>();
        if (state.getVersion() < 1) {
            problems.add("version " + state.getVersion());
        }
        if (state.getMetadataCursor() < 0) {
            problems.add("negative metadataCursor " + state.getMetadataCursor());
        }
        if (state.getEntitiesCompleted() == null) {
            problems.add("entitiesCompleted is null");
        }
        if (state.getEntitiesFailed() == null) {
            problems.add("entitiesFailed is null");
        }
        if (state.getInProgress() == null) {
            problems.add("inProgress is null");
        } else {
            state.getInProgress().forEach((externalId, tiers) -> {
                if (tiers == null) {
                    problems.add("inProgress." + externalId + " is null");
                    return;
                }
                tiers.forEach((tier, timestamp) -> {
                    if (!WIRE_NAMES.contains(tier)) {
                        problems.add("inProgress." + externalId + " has unknown tier " + tier);
                    } else if (timestamp == null || !Double.isFinite(timestamp)) {
                        problems.add("inProgress." + externalId + "." + tier + " is " + timestamp);
                    }
                });
            });
        }
        if (state.getRecordsRead() < 0 || state.getPointsWritten() < 0) {
            problems.add("negative counters");
        }
        return problems;
    }

    private Path moveAside(String suffix) {
        Path target = file.resolveSibling(file.getFileName() + "." + suffix + "-" + clock.millis());
        try {
            return Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new CheckpointException("Unable to move checkpoint " + file + " to " + target, e);
        }
    }
}
