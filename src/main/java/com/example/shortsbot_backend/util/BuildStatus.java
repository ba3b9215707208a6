package com.example.shortsbot_backend.util;

public enum BuildStatus {
    BUILT,
    /** A short for the same video and platform is already recorded. */
    SKIPPED,
    NO_MOMENT,
    FAILED
}
