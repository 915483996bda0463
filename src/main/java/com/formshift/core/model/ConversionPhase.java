package com.formshift.core.model;

/**
 * Named phases of a conversion run, in the order a successful run visits them.
 * {@link #CANCELLING}, {@link #ROLLED_BACK} and {@link #FAILED} are reachable from any phase.
 */
public enum ConversionPhase {
    INIT,
    PARSE,
    ANALYZE,
    GENERATE,
    PROJECT_FILES,
    DOCUMENTATION,
    COMMIT,
    COMPLETE,
    CANCELLING,
    ROLLED_BACK,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ROLLED_BACK || this == FAILED;
    }
}
