package com.samsung.ees.infra.sli.exception;

/**
 * Thrown when a caller hands in a sample batch that cannot be stored:
 * a missing indicator id, a null timestamp or value, a non-finite value or an offset outside the day.
 * Raised before any storage call is made.
 */
public class InvalidSampleException extends IllegalArgumentException {
    public InvalidSampleException(String message) {
        super(message);
    }
}
