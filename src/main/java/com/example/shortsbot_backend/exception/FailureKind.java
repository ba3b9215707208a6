package com.example.shortsbot_backend.exception;

/**
 * Classifies why a short build did not complete.
 */
public enum FailureKind {
    /** Required upstream artifact absent (transcript, narration, background footage). Not retried within a run. */
    MISSING_INPUT,
    /** Media toolkit exited non-zero or timed out. */
    EXTERNAL_TOOL,
    /** Duration bounds cannot be satisfied for the given inputs. */
    CONSTRAINT_VIOLATION,
    /** The artifact was produced but could not be recorded. */
    PERSISTENCE
}
