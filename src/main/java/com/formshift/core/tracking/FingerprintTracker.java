package com.formshift.core.tracking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formshift.core.model.FingerprintEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persistent map from source file to content fingerprint, used to skip unchanged forms.
 * <p>
 * Fingerprints are upper-case hex SHA-256 digests of the file bytes. Entries are keyed by
 * absolute normalized path. The cache lives in a JSON file inside the working directory;
 * an unreadable or corrupt cache is replaced by an empty one. Safe for concurrent use by
 * parallel form workers.
 */
public class FingerprintTracker {

    private static final Logger log = LoggerFactory.getLogger(FingerprintTracker.class);
    private static final HexFormat HEX = HexFormat.of().withUpperCase();
    private static final TypeReference<Map<String, FingerprintEntry>> CACHE_TYPE = new TypeReference<>() {};

    private final Path cacheFile;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, FingerprintEntry> entries = new ConcurrentHashMap<>();

    public FingerprintTracker(Path workingDirectory, String cacheFileName, ObjectMapper objectMapper) {
        this.cacheFile = workingDirectory.resolve(cacheFileName);
        this.objectMapper = objectMapper;
    }

    public Path cacheFile() {
        return cacheFile;
    }

    /**
     * Replaces the in-memory map with the persisted cache. Never fails: a missing,
     * unreadable or corrupt cache leaves the tracker empty.
     */
    public void load() {
        entries.clear();
        if (!Files.isRegularFile(cacheFile)) {
            log.debug("No fingerprint cache at {}", cacheFile);
            return;
        }
        try {
            Map<String, FingerprintEntry> loaded = objectMapper.readValue(cacheFile.toFile(), CACHE_TYPE);
            if (loaded != null) {
                loaded.forEach((path, entry) -> {
                    if (path != null && entry != null && entry.fingerprint() != null) {
                        entries.put(path, entry);
                    }
                });
            }
            log.debug("Loaded {} fingerprint(s) from {}", entries.size(), cacheFile);
        } catch (IOException e) {
            log.warn("Ignoring unreadable fingerprint cache {}: {}", cacheFile, e.getMessage());
            entries.clear();
        }
    }

    /** Writes the whole map to the cache file, sorted by path. Not atomic. */
    public void save() throws IOException {
        Path parent = cacheFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(cacheFile, toJson());
        log.debug("Saved {} fingerprint(s) to {}", entries.size(), cacheFile);
    }

    /** Serialized cache content, for callers that route the write elsewhere. */
    public byte[] toJson() throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(new TreeMap<>(entries));
    }

    /**
     * Computes the current content fingerprint of {@code file}.
     *
     * @throws NoSuchFileException if the file does not exist
     */
    public String fingerprint(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        MessageDigest digest = sha256();
        byte[] buffer = new byte[8192];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HEX.formatHex(digest.digest());
    }

    /** True when the file was never recorded or its content differs from the recorded fingerprint. */
    public boolean hasChanged(Path file) throws IOException {
        FingerprintEntry entry = entries.get(key(file));
        if (entry == null) {
            return true;
        }
        return !entry.fingerprint().equals(fingerprint(file));
    }

    /** Records the file's current fingerprint and modification time, stamped as converted now. */
    public FingerprintEntry update(Path file) throws IOException {
        String hash = fingerprint(file);
        Instant modified = Files.getLastModifiedTime(file).toInstant();
        var entry = new FingerprintEntry(hash, modified, Instant.now());
        entries.put(key(file), entry);
        return entry;
    }

    /** The subset of {@code files} that {@link #hasChanged(Path)} reports as changed, in input order. */
    public List<Path> changedFiles(Collection<Path> files) throws IOException {
        List<Path> changed = new ArrayList<>();
        for (Path f : files) {
            if (hasChanged(f)) {
                changed.add(f);
            }
        }
        return changed;
    }

    public Optional<FingerprintEntry> entry(Path file) {
        return Optional.ofNullable(entries.get(key(file)));
    }

    /** Path to fingerprint view of the current map, sorted by path. */
    public Map<String, String> snapshot() {
        Map<String, String> result = new LinkedHashMap<>();
        new TreeMap<>(entries).forEach((path, entry) -> result.put(path, entry.fingerprint()));
        return result;
    }

    public int size() {
        return entries.size();
    }

    /** Forgets every entry and deletes the cache file. */
    public void clear() throws IOException {
        entries.clear();
        Files.deleteIfExists(cacheFile);
    }

    static String key(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
