package com.example.shortsbot_backend.exception;

/**
 * Base type for expected, data- or tool-driven build failures. Callers that iterate
 * over many videos convert these into per-item outcomes instead of aborting.
 */
public abstract class ShortBuildException extends RuntimeException {
    private final FailureKind kind;

    protected ShortBuildException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ShortBuildException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
