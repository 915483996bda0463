package com.formshift.core.transaction;

/**
 * Thrown when a {@link TransactionalFileGuard} operation is called in the wrong state.
 */
public class TransactionStateException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public enum ErrorCode {
        /** {@code begin()} while a transaction is open. */
        ALREADY_OPEN,
        /** Tracking, commit or rollback without an open transaction. */
        NOT_OPEN
    }

    private final ErrorCode errorCode;

    public TransactionStateException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
