package com.formshift.core.config;

import com.formshift.core.layout.LayoutMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    @TempDir
    Path dir;

    private final ConfigurationLoader loader = new ConfigurationLoader(JsonSupport.objectMapper());

    private Path write(String json) throws IOException {
        Path file = dir.resolve(ConfigurationLoader.FILE_NAME);
        Files.writeString(file, json);
        return file;
    }

    // -- Loading --------------------------------------------------------------

    @Nested
    @DisplayName("load")
    class LoadTests {

        @Test
        @DisplayName("file keys override the base, other keys keep base values")
        void overlay() throws IOException {
            Path file = write("""
                    {
                      "layout": { "confidenceThreshold": 80, "mode": "canvas" },
                      "naming": { "namespace": "Shop" }
                    }
                    """);
            var base = new ConverterConfig();
            base.getNaming().setViewModelSuffix("Vm");

            ConverterConfig loaded = loader.load(file, base);

            assertEquals(80, loaded.getLayout().getConfidenceThreshold());
            assertEquals(5, loaded.getLayout().getAlignmentTolerance());
            assertEquals("Shop", loaded.getNaming().getNamespace());
            assertEquals("Vm", loaded.getNaming().getViewModelSuffix());
            assertEquals(LayoutMode.FREE_POSITIONED, loaded.layoutContext().mode());

            assertEquals("ConvertedApp", base.getNaming().getNamespace());
            assertEquals(70, base.getLayout().getConfidenceThreshold());
        }

        @Test
        @DisplayName("unknown keys are ignored")
        void unknownKeys() throws IOException {
            Path file = write("{ \"somethingElse\": true, \"parallel\": { \"enabled\": false } }");
            assertFalse(loader.load(file).getParallel().isEnabled());
        }

        @Test
        @DisplayName("a missing file is a configuration error")
        void missing() {
            var e = assertThrows(ConfigurationException.class, () -> loader.load(dir.resolve("nope.json")));
            assertTrue(e.getMessage().startsWith("Configuration file not found"));
        }

        @Test
        @DisplayName("malformed JSON is a configuration error")
        void malformed() throws IOException {
            Path file = write("{ \"layout\": ");
            var e = assertThrows(ConfigurationException.class, () -> loader.load(file));
            assertTrue(e.getMessage().startsWith("Invalid configuration file"));
            assertNotNull(e.getCause());
        }

        @Test
        @DisplayName("loadOrDefault falls back on any problem")
        void loadOrDefault() throws IOException {
            var fallback = new ConverterConfig();
            assertSame(fallback, loader.loadOrDefault(write("not json"), fallback));
            assertSame(fallback, loader.loadOrDefault(dir.resolve("missing"), fallback));
            assertSame(fallback, loader.loadOrDefault(null, fallback));
        }
    }

    // -- Templates and discovery ----------------------------------------------

    @Test
    @DisplayName("a written template loads back to the defaults")
    void template() throws IOException {
        Path written = loader.writeTemplate(dir);
        assertEquals(dir.resolve(ConfigurationLoader.FILE_NAME), written);

        ConverterConfig loaded = loader.load(written);
        var defaults = new ConverterConfig();
        assertEquals(defaults.getNaming().getNamespace(), loaded.getNaming().getNamespace());
        assertEquals(defaults.getIncremental().getCheckpointFrequency(), loaded.getIncremental().getCheckpointFrequency());
        assertEquals(defaults.getDocumentation().getOutputFileName(), loaded.getDocumentation().getOutputFileName());
        assertFalse(Files.readString(written).contains("layoutContext"));
    }

    @Test
    @DisplayName("finds the configuration file in an ancestor directory")
    void findInAncestor() throws IOException {
        Path file = write("{}");
        Path nested = Files.createDirectories(dir.resolve("a/b"));
        assertEquals(file.toAbsolutePath().normalize(), loader.findConfigurationFile(nested).orElseThrow());
    }

    @Test
    @DisplayName("an invalid layout mode is rejected when the context is built")
    void invalidMode() {
        var config = new ConverterConfig();
        config.getLayout().setMode("diagonal");
        assertThrows(IllegalArgumentException.class, config::layoutContext);
    }
}
