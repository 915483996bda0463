package com.formshift.core.transaction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GuardedFileWriterTest {

    @TempDir
    Path dir;

    private TransactionalFileGuard guard;
    private GuardedFileWriter writer;

    @BeforeEach
    void setUp() {
        guard = new TransactionalFileGuard();
        writer = new GuardedFileWriter(guard);
        guard.begin();
    }

    @Test
    @DisplayName("new files and their new parent directories are undone by rollback")
    void newFilesAndDirectories() throws IOException {
        Path target = dir.resolve("out/Views/Main.axaml");
        writer.writeString(target, "<Window/>");
        assertEquals("<Window/>", Files.readString(target));

        guard.rollback();

        assertFalse(Files.exists(dir.resolve("out")));
        assertTrue(Files.exists(dir));
    }

    @Test
    @DisplayName("overwritten files are restored by rollback")
    void overwrittenFiles() throws IOException {
        Path target = Files.writeString(dir.resolve("App.axaml"), "original");
        writer.writeString(target, "generated");
        assertEquals("generated", Files.readString(target));

        guard.rollback();

        assertEquals("original", Files.readString(target));
    }

    @Test
    @DisplayName("writing without an open transaction fails before touching disk")
    void requiresOpenTransaction() {
        guard.commit();
        Path target = dir.resolve("late.axaml");
        assertThrows(TransactionStateException.class, () -> writer.writeString(target, "x"));
        assertFalse(Files.exists(target));
    }

    @Test
    @DisplayName("replaceAtomically leaves no temp files behind")
    void noTempFiles() throws IOException {
        FileSink.replaceAtomically(dir.resolve("a.txt"), "x".getBytes());
        try (var files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }
}
