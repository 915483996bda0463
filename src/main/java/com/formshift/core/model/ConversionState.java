package com.formshift.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checkpoint payload describing the progress of one conversion run.
 * <p>
 * The completed, in-progress and failed sets are kept disjoint: every {@code mark*} method
 * removes the file from the other two before adding it. Not thread-safe; the conversion
 * engine owns the instance and serializes access to it.
 */
public class ConversionState {

    private String sourcePath;
    private String outputPath;
    private Instant startTime;
    private Set<String> completed = new LinkedHashSet<>();
    private Set<String> inProgress = new LinkedHashSet<>();
    private Map<String, String> failed = new LinkedHashMap<>();
    private Map<String, String> fingerprints = new LinkedHashMap<>();
    private List<String> generatedFiles = new ArrayList<>();
    private ConversionStatistics statistics = new ConversionStatistics();

    public ConversionState() {
    }

    public ConversionState(Path sourcePath, Path outputPath, Instant startTime) {
        this.sourcePath = normalize(sourcePath);
        this.outputPath = normalize(outputPath);
        this.startTime = startTime;
    }

    public void markInProgress(String file) {
        completed.remove(file);
        failed.remove(file);
        inProgress.add(file);
    }

    public void markCompleted(String file) {
        inProgress.remove(file);
        failed.remove(file);
        completed.add(file);
    }

    public void markFailed(String file, String reason) {
        inProgress.remove(file);
        completed.remove(file);
        failed.put(file, reason == null ? "" : reason);
    }

    public boolean isCompleted(String file) {
        return completed.contains(file);
    }

    public void recordGeneratedFile(Path file) {
        String normalized = normalize(file);
        if (!generatedFiles.contains(normalized)) {
            generatedFiles.add(normalized);
        }
    }

    /** Whether this checkpoint was taken for the same source and output locations. */
    public boolean matches(Path source, Path output) {
        return normalize(source).equals(sourcePath) && normalize(output).equals(outputPath);
    }

    @JsonIgnore
    public int processedCount() {
        return completed.size() + failed.size();
    }

    private static String normalize(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    public String getSourcePath() { return sourcePath; }
    public void setSourcePath(String sourcePath) { this.sourcePath = sourcePath; }
    public String getOutputPath() { return outputPath; }
    public void setOutputPath(String outputPath) { this.outputPath = outputPath; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Set<String> getCompleted() { return completed; }
    public void setCompleted(Set<String> completed) { this.completed = new LinkedHashSet<>(completed); }
    public Set<String> getInProgress() { return inProgress; }
    public void setInProgress(Set<String> inProgress) { this.inProgress = new LinkedHashSet<>(inProgress); }
    public Map<String, String> getFailed() { return failed; }
    public void setFailed(Map<String, String> failed) { this.failed = new LinkedHashMap<>(failed); }
    public Map<String, String> getFingerprints() { return fingerprints; }
    public void setFingerprints(Map<String, String> fingerprints) { this.fingerprints = new LinkedHashMap<>(fingerprints); }
    public List<String> getGeneratedFiles() { return generatedFiles; }
    public void setGeneratedFiles(List<String> generatedFiles) { this.generatedFiles = new ArrayList<>(generatedFiles); }
    public ConversionStatistics getStatistics() { return statistics; }
    public void setStatistics(ConversionStatistics statistics) { this.statistics = statistics; }
}
