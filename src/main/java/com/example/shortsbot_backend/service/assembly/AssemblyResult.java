package com.example.shortsbot_backend.service.assembly;

import com.example.shortsbot_backend.timing.NormalizedWindow;

import java.nio.file.Path;
import java.util.List;

/**
 * @param outputPath    finished short in the platform output directory.
 * @param thumbnailPath extracted frame, {@code null} when extraction failed.
 * @param window        normalized source window that was used.
 * @param fileSize      size of {@code outputPath} in bytes.
 * @param stages        stages that ran, in order.
 */
public record AssemblyResult(Path outputPath,
                             Path thumbnailPath,
                             NormalizedWindow window,
                             long fileSize,
                             List<AssemblyStage> stages) {

    public double duration() {
        return window.duration();
    }
}
