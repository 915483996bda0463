package com.formshift.core.tracking;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formshift.core.config.JsonSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintTrackerTest {

    private static final String CACHE = ".formshift-cache.json";

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = JsonSupport.objectMapper();
    private FingerprintTracker tracker;
    private Path form;

    @BeforeEach
    void setUp() throws IOException {
        tracker = new FingerprintTracker(dir, CACHE, objectMapper);
        form = Files.writeString(dir.resolve("Main.Designer.cs"), "partial class Main {}");
    }

    // -- Change detection -----------------------------------------------------

    @Nested
    @DisplayName("change detection")
    class ChangeDetectionTests {

        @Test
        @DisplayName("a never-seen file has changed")
        void neverSeen() throws IOException {
            assertTrue(tracker.hasChanged(form));
        }

        @Test
        @DisplayName("an updated, unmodified file has not changed")
        void afterUpdate() throws IOException {
            tracker.update(form);
            assertFalse(tracker.hasChanged(form));
        }

        @Test
        @DisplayName("editing the bytes marks the file changed")
        void afterEdit() throws IOException {
            tracker.update(form);
            Files.writeString(form, "partial class Main { int x; }");
            assertTrue(tracker.hasChanged(form));
        }

        @Test
        @DisplayName("fingerprint is upper-case hex SHA-256")
        void fingerprintFormat() throws IOException {
            String hash = tracker.fingerprint(form);
            assertEquals(64, hash.length());
            assertTrue(hash.matches("[0-9A-F]+"));
            assertEquals(hash, tracker.fingerprint(form));
        }

        @Test
        @DisplayName("fingerprinting a missing file fails with NoSuchFileException")
        void missingFile() {
            assertThrows(NoSuchFileException.class, () -> tracker.fingerprint(dir.resolve("missing.cs")));
        }

        @Test
        @DisplayName("changedFiles keeps only changed files in input order")
        void changedFiles() throws IOException {
            Path other = Files.writeString(dir.resolve("Other.Designer.cs"), "x");
            tracker.update(form);
            assertEquals(List.of(other), tracker.changedFiles(List.of(form, other)));
        }
    }

    // -- Persistence ----------------------------------------------------------

    @Nested
    @DisplayName("persistence")
    class PersistenceTests {

        @Test
        @DisplayName("save then load restores entries")
        void roundTrip() throws IOException {
            tracker.update(form);
            tracker.save();

            var reloaded = new FingerprintTracker(dir, CACHE, objectMapper);
            reloaded.load();
            assertEquals(1, reloaded.size());
            assertFalse(reloaded.hasChanged(form));
            assertEquals(tracker.snapshot(), reloaded.snapshot());
        }

        @Test
        @DisplayName("a corrupt cache loads as empty")
        void corruptCache() throws IOException {
            Files.writeString(dir.resolve(CACHE), "{not json");
            tracker.load();
            assertEquals(0, tracker.size());
            assertTrue(tracker.hasChanged(form));
        }

        @Test
        @DisplayName("a missing cache loads as empty")
        void missingCache() {
            tracker.load();
            assertEquals(0, tracker.size());
        }

        @Test
        @DisplayName("clear drops entries and the cache file")
        void clear() throws IOException {
            tracker.update(form);
            tracker.save();
            tracker.clear();
            assertEquals(0, tracker.size());
            assertFalse(Files.exists(tracker.cacheFile()));
        }

        @Test
        @DisplayName("entries are keyed by absolute normalized path")
        void keyedByAbsolutePath() throws IOException {
            tracker.update(dir.resolve("./Main.Designer.cs"));
            assertTrue(tracker.entry(form.toAbsolutePath()).isPresent());
        }
    }
}
