package com.formshift.core.model;

import java.io.Serializable;

/**
 * A warning or error attached to a run, optionally scoped to one form.
 *
 * @param severity how serious the message is
 * @param form     form name, or {@code null} for run-level messages
 * @param message  human-readable text
 */
public record ReportMessage(
    Severity severity,
    String form,
    String message
) implements Serializable {

    public enum Severity { WARNING, ERROR }

    public static ReportMessage warning(String form, String message) {
        return new ReportMessage(Severity.WARNING, form, message);
    }

    public static ReportMessage error(String form, String message) {
        return new ReportMessage(Severity.ERROR, form, message);
    }

    @Override
    public String toString() {
        return form == null ? message : form + ": " + message;
    }
}
