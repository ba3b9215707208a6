package com.example.shortsbot_backend.exception;

public class MissingInputException extends ShortBuildException {
    public MissingInputException(String message) {
        super(FailureKind.MISSING_INPUT, message);
    }

    public MissingInputException(String message, Throwable cause) {
        super(FailureKind.MISSING_INPUT, message, cause);
    }
}
