package com.samsung.ees.infra.sli.exception;

/**
 * Thrown when a stored compact blob cannot be decoded. The whole blob is rejected.
 */
public class MalformedEncodingException extends RuntimeException {
    public MalformedEncodingException(String message) {
        super(message);
    }

    public MalformedEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
