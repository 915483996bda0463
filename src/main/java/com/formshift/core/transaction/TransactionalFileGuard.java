package com.formshift.core.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Tracks file creations and modifications made during a unit of work so they can be
 * committed or undone as a whole.
 * <p>
 * Callers must track every mutation before performing it; untracked side effects are not
 * rolled back. A modified file is backed up once per transaction, on first tracking, to a
 * sibling named {@code <file>.backup_<random-hex>}. Rollback undoes creations in reverse
 * tracking order (files before the directories that hold them) and deletes directories only
 * when they are empty.
 * <p>
 * All methods are synchronized; parallel writers share one guard.
 */
public class TransactionalFileGuard {

    private static final Logger log = LoggerFactory.getLogger(TransactionalFileGuard.class);
    private static final String BACKUP_MARKER = ".backup_";

    private GuardState state = GuardState.IDLE;
    private String transactionId;
    private final Set<Path> created = new LinkedHashSet<>();
    private final Set<Path> modified = new LinkedHashSet<>();
    private final Map<Path, Path> backups = new LinkedHashMap<>();

    /**
     * Opens a transaction.
     *
     * @throws TransactionStateException with {@code ALREADY_OPEN} if one is open
     */
    public synchronized void begin() {
        state = GuardStateMachine.transition(state, GuardState.OPEN);
        clearManifest();
        transactionId = randomHex(6);
        log.debug("Transaction {} opened", transactionId);
    }

    /** Records {@code path} as created in this transaction; rollback deletes it. */
    public synchronized void trackCreate(Path path) {
        requireOpen("trackCreate");
        Path p = normalize(path);
        if (modified.contains(p)) {
            return;
        }
        if (created.add(p)) {
            log.debug("Tracking creation of {}", p);
        }
    }

    /**
     * Records {@code path} as modified in this transaction. The first call for a path that
     * is a regular file copies it to a backup; later calls are no-ops. A path that does not
     * exist yet is tracked as a creation instead, so rollback removes it. Any other existing
     * path (a directory, for one) is recorded as modified without a backup and is left in
     * place by rollback.
     */
    public synchronized void trackModify(Path path) throws IOException {
        requireOpen("trackModify");
        Path p = normalize(path);
        if (created.contains(p) || modified.contains(p)) {
            return;
        }
        if (!Files.exists(p, LinkOption.NOFOLLOW_LINKS)) {
            trackCreate(p);
            return;
        }
        if (!Files.isRegularFile(p)) {
            modified.add(p);
            log.debug("Tracking existing {} without backup", p);
            return;
        }
        Path backup = p.resolveSibling(p.getFileName() + BACKUP_MARKER + randomHex(8));
        Files.copy(p, backup, StandardCopyOption.COPY_ATTRIBUTES);
        modified.add(p);
        backups.put(p, backup);
        log.debug("Backed up {} to {}", p, backup.getFileName());
    }

    /**
     * Keeps every tracked change and deletes the backups. A backup that cannot be deleted is
     * logged and reported, never thrown.
     */
    public synchronized RollbackReport commit() {
        requireOpen("commit");
        state = GuardStateMachine.transition(state, GuardState.COMMITTED);

        List<Path> deleted = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (Path backup : backups.values()) {
            try {
                Files.deleteIfExists(backup);
                deleted.add(backup);
            } catch (IOException e) {
                log.warn("Could not delete backup {}: {}", backup, e.getMessage());
                failures.add("delete backup " + backup + ": " + e.getMessage());
            }
        }
        log.info("Transaction {} committed ({} created, {} modified)",
                transactionId, created.size(), modified.size());
        finish();
        return new RollbackReport(deleted, List.of(), failures);
    }

    /**
     * Restores every tracked path to its pre-transaction content or absence. Continues
     * past individual failures and reports them.
     */
    public synchronized RollbackReport rollback() {
        requireOpen("rollback");
        state = GuardStateMachine.transition(state, GuardState.ROLLED_BACK);

        List<Path> deleted = new ArrayList<>();
        List<Path> restored = new ArrayList<>();
        List<String> failures = new ArrayList<>();

        List<Path> creations = new ArrayList<>(created);
        for (int i = creations.size() - 1; i >= 0; i--) {
            Path p = creations.get(i);
            try {
                if (Files.isDirectory(p)) {
                    if (isEmptyDirectory(p)) {
                        Files.delete(p);
                        deleted.add(p);
                    } else {
                        failures.add("directory not empty, left in place: " + p);
                    }
                } else if (Files.deleteIfExists(p)) {
                    deleted.add(p);
                }
            } catch (IOException e) {
                log.warn("Rollback could not delete {}: {}", p, e.getMessage());
                failures.add("delete " + p + ": " + e.getMessage());
            }
        }

        for (Map.Entry<Path, Path> entry : backups.entrySet()) {
            Path original = entry.getKey();
            Path backup = entry.getValue();
            try {
                Files.copy(backup, original, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                restored.add(original);
            } catch (IOException e) {
                log.warn("Rollback could not restore {}: {}", original, e.getMessage());
                failures.add("restore " + original + ": " + e.getMessage());
                continue;
            }
            try {
                Files.deleteIfExists(backup);
            } catch (IOException e) {
                log.warn("Rollback could not delete backup {}: {}", backup, e.getMessage());
                failures.add("delete backup " + backup + ": " + e.getMessage());
            }
        }

        log.info("Transaction {} rolled back ({} deleted, {} restored, {} failure(s))",
                transactionId, deleted.size(), restored.size(), failures.size());
        finish();
        return new RollbackReport(deleted, restored, failures);
    }

    public synchronized RollbackManifest manifest() {
        return new RollbackManifest(new ArrayList<>(created), new ArrayList<>(modified), backups);
    }

    public synchronized GuardState state() {
        return state;
    }

    public synchronized boolean isOpen() {
        return state == GuardState.OPEN;
    }

    public synchronized boolean isTracked(Path path) {
        Path p = normalize(path);
        return created.contains(p) || modified.contains(p);
    }

    private void requireOpen(String operation) {
        if (state != GuardState.OPEN) {
            throw new TransactionStateException(
                    operation + " requires an open transaction (state " + state + ")",
                    TransactionStateException.ErrorCode.NOT_OPEN);
        }
    }

    private void finish() {
        clearManifest();
        state = GuardStateMachine.transition(state, GuardState.IDLE);
        transactionId = null;
    }

    private void clearManifest() {
        created.clear();
        modified.clear();
        backups.clear();
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            return !entries.iterator().hasNext();
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static String randomHex(int bytes) {
        byte[] b = new byte[bytes];
        ThreadLocalRandom.current().nextBytes(b);
        return HexFormat.of().formatHex(b);
    }
}
