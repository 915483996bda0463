package com.formshift.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formshift.core.model.ConversionState;
import com.formshift.core.transaction.FileSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists the {@link ConversionState} of a run so an interrupted run can resume.
 * <p>
 * One JSON document per working directory; last write wins. A missing or corrupt
 * document reads as "no checkpoint". Writes go through a {@link FileSink}, so the
 * conversion engine can route them through its file guard.
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path checkpointFile;
    private final ObjectMapper objectMapper;

    public CheckpointStore(Path workingDirectory, String fileName, ObjectMapper objectMapper) {
        this.checkpointFile = workingDirectory.resolve(fileName);
        this.objectMapper = objectMapper;
    }

    public Path checkpointFile() {
        return checkpointFile;
    }

    public void save(ConversionState state) throws IOException {
        save(state, FileSink.direct());
    }

    public void save(ConversionState state, FileSink sink) throws IOException {
        sink.write(checkpointFile, objectMapper.writeValueAsBytes(state));
        log.debug("Checkpoint saved: {} completed, {} failed, {} in progress",
                state.getCompleted().size(), state.getFailed().size(), state.getInProgress().size());
    }

    public Optional<ConversionState> load() {
        if (!Files.isRegularFile(checkpointFile)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(checkpointFile.toFile(), ConversionState.class));
        } catch (IOException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", checkpointFile, e.getMessage());
            return Optional.empty();
        }
    }

    public void clear() throws IOException {
        if (Files.deleteIfExists(checkpointFile)) {
            log.debug("Checkpoint cleared: {}", checkpointFile);
        }
    }

    public boolean exists() {
        return Files.isRegularFile(checkpointFile);
    }
}
