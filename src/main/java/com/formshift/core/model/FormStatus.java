package com.formshift.core.model;

/**
 * What happened to a single form during a run.
 */
public enum FormStatus {
    CONVERTED,
    FAILED,
    /** Source unchanged since the last successful conversion. */
    UP_TO_DATE,
    /** Already completed by the run this one resumed. */
    RESUMED
}
