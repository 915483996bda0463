package com.formshift.core.model;

import com.formshift.core.layout.LayoutMode;

/**
 * Behaviour flags for a single run.
 *
 * @param incremental    skip forms whose source is unchanged since the last run
 * @param force          convert everything, ignoring the fingerprint cache
 * @param resume         continue from a matching checkpoint when one exists
 * @param parallel       process forms concurrently
 * @param maxParallel    upper bound on concurrent forms, 0 for the number of processors
 * @param dryRun         parse and analyze only, write nothing
 * @param migrationGuide write the migration guide document
 * @param layoutMode     layout mode override, {@code null} to use the configured mode
 * @param gitCommit      stage and commit the output when it sits in a git repository
 */
public record ConversionOptions(
    boolean incremental,
    boolean force,
    boolean resume,
    boolean parallel,
    int maxParallel,
    boolean dryRun,
    boolean migrationGuide,
    LayoutMode layoutMode,
    boolean gitCommit
) {

    public ConversionOptions {
        if (maxParallel < 0) {
            throw new IllegalArgumentException("maxParallel must not be negative: " + maxParallel);
        }
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(false, false, false, false, 0, false, true, null, false);
    }

    public ConversionOptions withIncremental(boolean value) {
        return new ConversionOptions(value, force, resume, parallel, maxParallel, dryRun, migrationGuide, layoutMode, gitCommit);
    }

    public ConversionOptions withForce(boolean value) {
        return new ConversionOptions(incremental, value, resume, parallel, maxParallel, dryRun, migrationGuide, layoutMode, gitCommit);
    }

    public ConversionOptions withResume(boolean value) {
        return new ConversionOptions(incremental, force, value, parallel, maxParallel, dryRun, migrationGuide, layoutMode, gitCommit);
    }

    public ConversionOptions withParallel(boolean value, int max) {
        return new ConversionOptions(incremental, force, resume, value, max, dryRun, migrationGuide, layoutMode, gitCommit);
    }

    public ConversionOptions withDryRun(boolean value) {
        return new ConversionOptions(incremental, force, resume, parallel, maxParallel, value, migrationGuide, layoutMode, gitCommit);
    }

    public ConversionOptions withMigrationGuide(boolean value) {
        return new ConversionOptions(incremental, force, resume, parallel, maxParallel, dryRun, value, layoutMode, gitCommit);
    }

    public ConversionOptions withLayoutMode(LayoutMode value) {
        return new ConversionOptions(incremental, force, resume, parallel, maxParallel, dryRun, migrationGuide, value, gitCommit);
    }

    public ConversionOptions withGitCommit(boolean value) {
        return new ConversionOptions(incremental, force, resume, parallel, maxParallel, dryRun, migrationGuide, layoutMode, value);
    }
}
