package com.formshift.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing formshift MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String FORM = "form";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setForm(String runId, String form) {
        MDC.put(RUN_ID, runId);
        MDC.put(FORM, form);
    }

    public static void clearForm() {
        MDC.remove(FORM);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(FORM);
    }
}
