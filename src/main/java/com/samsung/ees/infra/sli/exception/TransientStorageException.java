package com.samsung.ees.infra.sli.exception;

/**
 * Thrown when a storage statement kept failing with a retryable error after all internal retries.
 * The outcome of the last attempt is unknown; callers may safely resubmit the whole batch.
 */
public class TransientStorageException extends RuntimeException {
    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
