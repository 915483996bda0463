package com.formshift.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes per-project {@code .formshiftconfig} JSON files.
 * <p>
 * A file is overlaid on a base configuration: keys present in the file win, everything
 * else keeps the base value.
 */
@Service
public class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    public static final String FILE_NAME = ".formshiftconfig";

    private final ObjectMapper objectMapper;
    private final ObjectMapper mergingMapper;

    public ConfigurationLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.mergingMapper = objectMapper.copy();
        this.mergingMapper.setDefaultMergeable(Boolean.TRUE);
    }

    /**
     * Loads {@code file} on top of built-in defaults.
     *
     * @throws ConfigurationException if the file is missing or not valid configuration JSON
     */
    public ConverterConfig load(Path file) {
        return load(file, new ConverterConfig());
    }

    /**
     * Loads {@code file} on top of a copy of {@code base}; {@code base} itself is not changed.
     *
     * @throws ConfigurationException if the file is missing or not valid configuration JSON
     */
    public ConverterConfig load(Path file, ConverterConfig base) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        try {
            ConverterConfig target = copy(base);
            mergingMapper.readerForUpdating(target).readValue(file.toFile());
            log.info("Loaded configuration from {}", file);
            return target;
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    /** Like {@link #load(Path, ConverterConfig)}, but falls back to {@code fallback} on any problem. */
    public ConverterConfig loadOrDefault(Path file, ConverterConfig fallback) {
        if (file == null || !Files.isRegularFile(file)) {
            return fallback;
        }
        try {
            return load(file, fallback);
        } catch (ConfigurationException e) {
            log.warn("{}; using defaults", e.getMessage());
            return fallback;
        }
    }

    public void save(Path file, ConverterConfig config) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(file.toFile(), config);
    }

    /**
     * Writes a configuration file holding every default, for users to edit.
     *
     * @return the written file
     */
    public Path writeTemplate(Path target) throws IOException {
        Path file = Files.isDirectory(target) ? target.resolve(FILE_NAME) : target;
        save(file, new ConverterConfig());
        log.info("Wrote configuration template to {}", file);
        return file;
    }

    /** Looks for {@value #FILE_NAME} in {@code startDir} and each of its ancestors. */
    public Optional<Path> findConfigurationFile(Path startDir) {
        for (Path dir = startDir.toAbsolutePath().normalize(); dir != null; dir = dir.getParent()) {
            Path candidate = dir.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private ConverterConfig copy(ConverterConfig base) {
        return objectMapper.convertValue(base, ConverterConfig.class);
    }
}
