package com.example.shortsbot_backend.exception;

/**
 * Raised when no (start, duration) pair inside the platform bounds exists for the source,
 * e.g. a corrupt zero-length file.
 */
public class DurationConstraintException extends ShortBuildException {
    public DurationConstraintException(String message) {
        super(FailureKind.CONSTRAINT_VIOLATION, message);
    }
}
