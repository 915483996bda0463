package com.formshift.core.generator;

/**
 * A text file produced by an emitter.
 *
 * @param relativePath path relative to the output directory, {@code /}-separated
 * @param content      file content
 * @param overwrite    {@code false} for user-owned files that are written only when absent
 */
public record GeneratedArtifact(String relativePath, String content, boolean overwrite) {

    public static GeneratedArtifact of(String relativePath, String content) {
        return new GeneratedArtifact(relativePath, content, true);
    }

    public static GeneratedArtifact userOwned(String relativePath, String content) {
        return new GeneratedArtifact(relativePath, content, false);
    }
}
