package com.formshift.core.transaction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Destination for generated files. Implementations decide whether writes are tracked.
 */
@FunctionalInterface
public interface FileSink {

    void write(Path target, byte[] content) throws IOException;

    default void writeString(Path target, String content) throws IOException {
        write(target, content.getBytes(StandardCharsets.UTF_8));
    }

    /** Untracked sink that writes through a sibling temp file. */
    static FileSink direct() {
        return FileSink::replaceAtomically;
    }

    /**
     * Writes {@code content} to a temp file next to {@code target}, then moves it over the
     * target. Falls back to a plain replace where the file system has no atomic move.
     */
    static void replaceAtomically(Path target, byte[] content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
