package com.formshift.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Everything the reporting and documentation layers need about a finished run.
 */
public record ConversionReport(
    String sourcePath,
    String outputPath,
    Instant startTime,
    Instant endTime,
    ConversionOutcome outcome,
    ConversionStatistics statistics,
    List<FormReport> forms,
    List<ReportMessage> warnings,
    List<ReportMessage> errors
) {

    public ConversionReport {
        forms = forms == null ? List.of() : List.copyOf(forms);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public Duration elapsed() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    public List<FormReport> formsWithStatus(FormStatus status) {
        return forms.stream().filter(f -> f.status() == status).toList();
    }
}
