package com.formshift.core.engine;

import com.formshift.core.model.ConversionOutcome;
import com.formshift.core.model.ConversionReport;
import com.formshift.core.transaction.RollbackReport;

import java.nio.file.Path;
import java.util.Optional;

/**
 * What a conversion run returns.
 *
 * @param outcome    overall outcome
 * @param message    one-line summary for the user
 * @param report     full run report, {@code null} only when the run failed before starting
 * @param outputPath output directory of the run
 * @param rollback   what the guard undid, {@code null} when no rollback happened
 */
public record ConversionResult(
    ConversionOutcome outcome,
    String message,
    ConversionReport report,
    Path outputPath,
    RollbackReport rollback
) {

    public boolean isSuccess() {
        return outcome == ConversionOutcome.SUCCESS || outcome == ConversionOutcome.PARTIAL_SUCCESS;
    }

    public Optional<RollbackReport> rollbackReport() {
        return Optional.ofNullable(rollback);
    }
}
