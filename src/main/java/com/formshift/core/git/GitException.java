package com.formshift.core.git;

/**
 * A git command could not be run or exited with a failure status.
 */
public class GitException extends RuntimeException {

    public GitException(String message) {
        super(message);
    }

    public GitException(String message, Throwable cause) {
        super(message, cause);
    }
}
