package com.example.shortsbot_backend.service.assembly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the temporary files of one build. Everything registered, plus the work directory itself,
 * is deleted on {@link #close()}; deletion failures are logged and never thrown.
 */
public class TempArtifactScope implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(TempArtifactScope.class);

    private final Path workDir;
    private final Deque<Path> artifacts = new ArrayDeque<>();
    private boolean closed;

    public TempArtifactScope(Path workDir) {
        this.workDir = workDir;
    }

    public Path workDir() {
        return workDir;
    }

    /** Registers {@code name} inside the work directory and returns its path. */
    public Path file(String name) {
        return register(workDir.resolve(name));
    }

    public Path register(Path artifact) {
        artifacts.push(artifact);
        return artifact;
    }

    /** Stops tracking a file that has been moved out of the temp area. */
    public void release(Path artifact) {
        artifacts.remove(artifact);
    }

    public int size() {
        return artifacts.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int failures = 0;
        while (!artifacts.isEmpty()) {
            if (!safeDelete(artifacts.pop())) {
                failures++;
            }
        }
        failures += deleteTree(workDir);
        if (failures > 0) {
            LOGGER.warn("TempArtifactScope CLEANUP_INCOMPLETE dir={} failures={}", workDir, failures);
        } else {
            LOGGER.debug("TempArtifactScope CLEANED dir={}", workDir);
        }
    }

    private static int deleteTree(Path root) {
        if (root == null || !Files.exists(root)) {
            return 0;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(root)) {
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            LOGGER.warn("TempArtifactScope cannot list dir={} cause={}", root, e.toString());
            return 1;
        }
        int failures = 0;
        for (Path p : entries) {
            if (!safeDelete(p)) {
                failures++;
            }
        }
        return failures;
    }

    private static boolean safeDelete(Path p) {
        try {
            Files.deleteIfExists(p);
            return true;
        } catch (IOException e) {
            LOGGER.warn("TempArtifactScope delete failed path={} cause={}", p, e.toString());
            return false;
        }
    }
}
