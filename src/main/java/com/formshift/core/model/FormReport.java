package com.formshift.core.model;

import java.util.List;

/**
 * Outcome of one form's conversion.
 *
 * @param formName       name of the root control
 * @param sourceFile     absolute path of the designer file
 * @param status         what happened to the form
 * @param layout         layout chosen for the root container, {@code null} unless converted
 * @param generatedFiles output files written for this form
 * @param tally          control, property and event counts, {@code null} unless converted
 * @param placeholders   control kinds with no target mapping
 * @param failureReason  why the form failed, {@code null} otherwise
 */
public record FormReport(
    String formName,
    String sourceFile,
    FormStatus status,
    LayoutAnalysisResult layout,
    List<String> generatedFiles,
    FormTally tally,
    List<String> placeholders,
    String failureReason
) {

    public FormReport {
        generatedFiles = generatedFiles == null ? List.of() : List.copyOf(generatedFiles);
        placeholders = placeholders == null ? List.of() : List.copyOf(placeholders);
    }

    public static FormReport converted(String formName, String sourceFile, LayoutAnalysisResult layout,
                                       List<String> generatedFiles, FormTally tally, List<String> placeholders) {
        return new FormReport(formName, sourceFile, FormStatus.CONVERTED, layout, generatedFiles, tally, placeholders, null);
    }

    public static FormReport failed(String formName, String sourceFile, String reason) {
        return new FormReport(formName, sourceFile, FormStatus.FAILED, null, List.of(), null, List.of(), reason);
    }

    public static FormReport skipped(String formName, String sourceFile, FormStatus status) {
        return new FormReport(formName, sourceFile, status, null, List.of(), null, List.of(), null);
    }
}
