package com.example.shortsbot_backend.engine;

import java.time.Duration;

public record ProcessResult(int exitCode, String stdout, String stderr, Duration elapsed, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
