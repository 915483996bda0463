package com.formshift.core.transaction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class TransactionalFileGuardTest {

    @TempDir
    Path dir;

    private TransactionalFileGuard guard;

    @BeforeEach
    void setUp() {
        guard = new TransactionalFileGuard();
    }

    private long backupCount() throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().contains(".backup_")).count();
        }
    }

    // -- Lifecycle ------------------------------------------------------------

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("begin twice fails with ALREADY_OPEN")
        void beginTwice() {
            guard.begin();
            var ex = assertThrows(TransactionStateException.class, guard::begin);
            assertEquals(TransactionStateException.ErrorCode.ALREADY_OPEN, ex.getErrorCode());
        }

        @Test
        @DisplayName("tracking, commit or rollback without begin fails with NOT_OPEN")
        void notOpen() {
            var ex = assertThrows(TransactionStateException.class, () -> guard.trackCreate(dir.resolve("a")));
            assertEquals(TransactionStateException.ErrorCode.NOT_OPEN, ex.getErrorCode());
            assertThrows(TransactionStateException.class, guard::commit);
            assertThrows(TransactionStateException.class, guard::rollback);
        }

        @Test
        @DisplayName("the guard is reusable after commit or rollback")
        void reusable() {
            guard.begin();
            guard.commit();
            assertEquals(GuardState.IDLE, guard.state());
            guard.begin();
            guard.rollback();
            assertEquals(GuardState.IDLE, guard.state());
            assertDoesNotThrow(guard::begin);
        }
    }

    // -- Rollback -------------------------------------------------------------

    @Nested
    @DisplayName("rollback")
    class RollbackTests {

        @Test
        @DisplayName("removes a tracked creation")
        void removesCreation() throws IOException {
            Path p = dir.resolve("new.axaml");
            guard.begin();
            guard.trackCreate(p);
            Files.writeString(p, "content");

            var report = guard.rollback();

            assertFalse(Files.exists(p));
            assertTrue(report.deleted().contains(p.toAbsolutePath().normalize()));
            assertTrue(report.isClean());
        }

        @Test
        @DisplayName("restores a modified file's original content")
        void restoresModification() throws IOException {
            Path p = Files.writeString(dir.resolve("App.axaml"), "A");
            guard.begin();
            guard.trackModify(p);
            Files.writeString(p, "B");

            var report = guard.rollback();

            assertEquals("A", Files.readString(p));
            assertEquals(1, report.restored().size());
            assertEquals(0, backupCount());
        }

        @Test
        @DisplayName("only the first modification is backed up")
        void firstBackupWins() throws IOException {
            Path p = Files.writeString(dir.resolve("App.axaml"), "A");
            guard.begin();
            guard.trackModify(p);
            Files.writeString(p, "B");
            guard.trackModify(p);
            Files.writeString(p, "C");

            guard.rollback();
            assertEquals("A", Files.readString(p));
        }

        @Test
        @DisplayName("tracking a missing file as modified treats it as a creation")
        void modifyMissingIsCreate() throws IOException {
            Path p = dir.resolve("late.axaml");
            guard.begin();
            guard.trackModify(p);
            Files.writeString(p, "x");

            assertTrue(guard.manifest().created().contains(p.toAbsolutePath().normalize()));
            guard.rollback();
            assertFalse(Files.exists(p));
        }

        @Test
        @DisplayName("an existing directory tracked as modified survives rollback")
        void modifyExistingDirectory() throws IOException {
            Path existing = Files.createDirectory(dir.resolve("existing"));
            Path normalized = existing.toAbsolutePath().normalize();
            guard.begin();
            guard.trackModify(existing);

            var manifest = guard.manifest();
            assertFalse(manifest.created().contains(normalized));
            assertTrue(manifest.modified().contains(normalized));
            assertFalse(manifest.backups().containsKey(normalized));

            var report = guard.rollback();

            assertTrue(Files.isDirectory(existing));
            assertTrue(report.deleted().isEmpty());
            assertTrue(report.isClean());
            assertEquals(0, backupCount());
        }

        @Test
        @DisplayName("directories are removed after their contents, and only when empty")
        void directories() throws IOException {
            Path views = dir.resolve("Views");
            Path file = views.resolve("Main.axaml");
            Path untracked = dir.resolve("Other").resolve("keep.txt");
            guard.begin();
            guard.trackCreate(views);
            Files.createDirectories(views);
            guard.trackCreate(file);
            Files.writeString(file, "x");
            guard.trackCreate(untracked.getParent());
            Files.createDirectories(untracked.getParent());
            Files.writeString(untracked, "not tracked");

            var report = guard.rollback();

            assertFalse(Files.exists(views));
            assertTrue(Files.exists(untracked));
            assertEquals(1, report.failures().size());
        }
    }

    // -- Commit ---------------------------------------------------------------

    @Nested
    @DisplayName("commit")
    class CommitTests {

        @Test
        @DisplayName("keeps changes and deletes backups")
        void keepsChanges() throws IOException {
            Path p = Files.writeString(dir.resolve("App.axaml"), "A");
            guard.begin();
            guard.trackModify(p);
            assertEquals(1, backupCount());
            Files.writeString(p, "B");

            var report = guard.commit();

            assertEquals("B", Files.readString(p));
            assertEquals(0, backupCount());
            assertEquals(1, report.deleted().size());
        }

        @Test
        @DisplayName("manifest is a snapshot")
        void manifestSnapshot() {
            guard.begin();
            guard.trackCreate(dir.resolve("a"));
            var manifest = guard.manifest();
            guard.trackCreate(dir.resolve("b"));

            assertEquals(1, manifest.created().size());
            assertTrue(guard.isTracked(dir.resolve("b")));
        }
    }
}
