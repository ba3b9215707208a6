package com.example.shortsbot_backend.exception;

import java.nio.file.Path;

/**
 * The media artifact exists on disk but its build record could not be written.
 */
public class PersistenceFailureException extends ShortBuildException {
    private final Path artifact;

    public PersistenceFailureException(String message, Path artifact, Throwable cause) {
        super(FailureKind.PERSISTENCE, message, cause);
        this.artifact = artifact;
    }

    public Path getArtifact() {
        return artifact;
    }
}
