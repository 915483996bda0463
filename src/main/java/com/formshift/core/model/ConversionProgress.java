package com.formshift.core.model;

import java.time.Duration;

/**
 * Point-in-time snapshot of a running conversion, delivered to progress observers.
 *
 * @param phase          current phase
 * @param subPhase       finer-grained step within the phase, may be empty
 * @param formsProcessed forms finished so far (converted, failed or skipped)
 * @param totalForms     forms discovered
 * @param currentForm    form being worked on, may be empty
 * @param statistics     copy of the aggregate counters
 * @param warnings       warnings so far
 * @param errors         errors so far
 * @param elapsed        wall time since the run started
 */
public record ConversionProgress(
    ConversionPhase phase,
    String subPhase,
    int formsProcessed,
    int totalForms,
    String currentForm,
    ConversionStatistics statistics,
    int warnings,
    int errors,
    Duration elapsed
) {

    public int percentComplete() {
        if (totalForms <= 0) {
            return phase == ConversionPhase.COMPLETE ? 100 : 0;
        }
        return Math.min(100, formsProcessed * 100 / totalForms);
    }
}
