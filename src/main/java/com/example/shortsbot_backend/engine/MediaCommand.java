package com.example.shortsbot_backend.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured description of one external media tool invocation.
 *
 * @param label   short stage name used in logs and failure messages.
 * @param binary  executable, e.g. {@code ffmpeg}.
 * @param args    arguments following the binary.
 * @param timeout hard limit; exceeding it is treated as a failure.
 */
public record MediaCommand(String label, String binary, List<String> args, Duration timeout) {
    public MediaCommand {
        if (binary == null || binary.isBlank()) {
            throw new IllegalArgumentException("binary is required");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive for " + label);
        }
        args = args == null ? List.of() : List.copyOf(args);
    }

    public List<String> commandLine() {
        List<String> cmd = new ArrayList<>(args.size() + 1);
        cmd.add(binary);
        cmd.addAll(args);
        return cmd;
    }
}
