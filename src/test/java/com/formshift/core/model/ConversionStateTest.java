package com.formshift.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ConversionStateTest {

    private final ConversionState state = new ConversionState(Path.of("src"), Path.of("out"), Instant.now());

    @Test
    @DisplayName("mark methods keep completed, in-progress and failed disjoint")
    void setsStayDisjoint() {
        state.markInProgress("a");
        assertTrue(state.getInProgress().contains("a"));

        state.markFailed("a", "boom");
        assertFalse(state.getInProgress().contains("a"));
        assertEquals("boom", state.getFailed().get("a"));

        state.markCompleted("a");
        assertTrue(state.isCompleted("a"));
        assertFalse(state.getFailed().containsKey("a"));
        assertEquals(1, state.processedCount());
    }

    @Test
    @DisplayName("matches compares normalized source and output paths")
    void matches() {
        assertTrue(state.matches(Path.of("src/../src"), Path.of("./out")));
        assertFalse(state.matches(Path.of("other"), Path.of("out")));
    }

    @Test
    @DisplayName("generated files are recorded once")
    void recordGeneratedFileOnce() {
        state.recordGeneratedFile(Path.of("out/Views/Main.axaml"));
        state.recordGeneratedFile(Path.of("out/./Views/Main.axaml"));
        assertEquals(1, state.getGeneratedFiles().size());
    }
}
