package com.formshift.core.transaction;

/**
 * Lifecycle of a {@link TransactionalFileGuard}.
 */
public enum GuardState {
    IDLE,
    OPEN,
    COMMITTED,
    ROLLED_BACK
}
