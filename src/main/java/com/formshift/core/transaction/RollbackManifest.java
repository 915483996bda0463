package com.formshift.core.transaction;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of what an open transaction would undo.
 *
 * @param created  paths created in the transaction, in tracking order
 * @param modified pre-existing paths changed in the transaction
 * @param backups  original path to backup copy
 */
public record RollbackManifest(
    List<Path> created,
    List<Path> modified,
    Map<Path, Path> backups
) {

    public RollbackManifest {
        created = List.copyOf(created);
        modified = List.copyOf(modified);
        backups = Map.copyOf(backups);
    }

    public static RollbackManifest empty() {
        return new RollbackManifest(List.of(), List.of(), Map.of());
    }

    public boolean isEmpty() {
        return created.isEmpty() && modified.isEmpty();
    }
}
