package com.formshift.core.transaction;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * {@link FileSink} that tracks every write in a {@link TransactionalFileGuard} before
 * performing it. Missing parent directories are created and tracked outermost first, so
 * rollback removes them after their contents.
 */
public class GuardedFileWriter implements FileSink {

    private final TransactionalFileGuard guard;

    public GuardedFileWriter(TransactionalFileGuard guard) {
        this.guard = guard;
    }

    @Override
    public void write(Path target, byte[] content) throws IOException {
        Path file = target.toAbsolutePath().normalize();
        synchronized (guard) {
            createDirectories(file.getParent());
            if (Files.exists(file)) {
                guard.trackModify(file);
            } else {
                guard.trackCreate(file);
            }
        }
        FileSink.replaceAtomically(file, content);
    }

    /** Creates {@code dir} and any missing ancestors, tracking each one created. */
    public void createDirectories(Path dir) throws IOException {
        if (dir == null) {
            return;
        }
        synchronized (guard) {
            Deque<Path> missing = new ArrayDeque<>();
            for (Path p = dir.toAbsolutePath().normalize(); p != null && !Files.exists(p); p = p.getParent()) {
                missing.push(p);
            }
            for (Path p : missing) {
                guard.trackCreate(p);
            }
            Files.createDirectories(dir);
        }
    }
}
