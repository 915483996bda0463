package com.formshift.core.transaction;

import java.nio.file.Path;
import java.util.List;

/**
 * What a commit or rollback did. Individual file failures are collected here instead of
 * being thrown, so one stuck file never blocks the rest.
 *
 * @param deleted  files and directories removed (creations on rollback, backups on commit)
 * @param restored originals copied back from their backups
 * @param failures one message per file that could not be handled
 */
public record RollbackReport(
    List<Path> deleted,
    List<Path> restored,
    List<String> failures
) {

    public RollbackReport {
        deleted = List.copyOf(deleted);
        restored = List.copyOf(restored);
        failures = List.copyOf(failures);
    }

    public static RollbackReport empty() {
        return new RollbackReport(List.of(), List.of(), List.of());
    }

    public boolean isClean() {
        return failures.isEmpty();
    }
}
