package com.example.shortsbot_backend.service;

import com.example.shortsbot_backend.config.StorageProperties;
import com.example.shortsbot_backend.exception.StorageException;
import com.example.shortsbot_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;
    private final Path tempDir;
    private final Path thumbnailsDir;
    private final Path backgroundsDir;
    private final Clock clock;

    public LocalStorageService(Path baseDir, StorageProperties props, Clock clock) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.tempDir = this.baseDir.resolve(props.getTempPrefix()).normalize();
        this.thumbnailsDir = this.baseDir.resolve(props.getThumbnailsPrefix()).normalize();
        this.backgroundsDir = this.baseDir.resolve(props.getBackgroundsPrefix()).normalize();
        this.clock = clock;

        try {
            Files.createDirectories(tempDir);
            Files.createDirectories(thumbnailsDir);
            Files.createDirectories(backgroundsDir);
            Files.createDirectories(this.baseDir.resolve(props.getPlatformsPrefix()));
            LOGGER.info("LocalStorageService ready. base={}, temp={}, thumbnails={}, backgrounds={}",
                    this.baseDir, tempDir, thumbnailsDir, backgroundsDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path resolve(String objectKey) {
        return safeResolve(baseDir, objectKey);
    }

    @Override
    public Path resolveTemp(String objectKey) {
        return safeResolve(tempDir, objectKey);
    }

    @Override
    public Path resolveThumbnail(String objectKey) {
        return safeResolve(thumbnailsDir, objectKey);
    }

    @Override
    public Path resolveBackground(String theme, String filename) {
        return safeResolve(backgroundsDir, theme + "/" + filename);
    }

    @Override
    public Path newWorkDir(String prefix) {
        Path dir = safeResolve(tempDir, prefix + "-" + UUID.randomUUID());
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create work directory " + dir, e);
        }
    }

    @Override
    public Path moveTo(Path sourceFile, String objectKey) {
        Path target = safeResolve(baseDir, objectKey);
        try {
            Files.createDirectories(target.getParent());
            try {
                Files.move(sourceFile, target, REPLACE_EXISTING, ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(sourceFile, target, REPLACE_EXISTING);
            }
            return target;
        } catch (IOException e) {
            throw new StorageException("Move failed " + sourceFile + " -> " + target, e);
        }
    }

    @Override
    public boolean exists(String objectKey) {
        return Files.exists(safeResolve(baseDir, objectKey));
    }

    @Override
    public int purgeTempOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int deleted = 0;
        List<Path> files;
        try (Stream<Path> walk = Files.walk(tempDir)) {
            files = walk.filter(Files::isRegularFile).collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Cannot list temp area " + tempDir, e);
        }
        for (Path f : files) {
            if (isOlderThan(f, cutoff) && safeDelete(f)) {
                deleted++;
            }
        }
        pruneEmptyDirectories();
        LOGGER.info("LocalStorageService PURGE temp={} cutoff={} deleted={}", tempDir, cutoff, deleted);
        return deleted;
    }

    @Override
    public Path rootBase() {
        return baseDir;
    }

    @Override
    public Path rootTemp() {
        return tempDir;
    }

    private boolean isOlderThan(Path file, Instant cutoff) {
        try {
            FileTime modified = Files.getLastModifiedTime(file);
            return modified.toInstant().isBefore(cutoff);
        } catch (IOException e) {
            LOGGER.warn("LocalStorageService cannot stat file={} cause={}", file, e.toString());
            return false;
        }
    }

    private void pruneEmptyDirectories() {
        List<Path> dirs;
        try (Stream<Path> walk = Files.walk(tempDir)) {
            dirs = walk.filter(Files::isDirectory)
                    .filter(d -> !d.equals(tempDir))
                    .sorted(Comparator.reverseOrder())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOGGER.warn("LocalStorageService cannot list directories temp={} cause={}", tempDir, e.toString());
            return;
        }
        for (Path d : dirs) {
            try (Stream<Path> entries = Files.list(d)) {
                if (entries.findAny().isEmpty()) {
                    Files.deleteIfExists(d);
                }
            } catch (IOException e) {
                LOGGER.warn("LocalStorageService cannot prune dir={} cause={}", d, e.toString());
            }
        }
    }

    private boolean safeDelete(Path p) {
        try {
            return Files.deleteIfExists(p);
        } catch (IOException e) {
            LOGGER.warn("LocalStorageService delete failed path={} cause={}", p, e.toString());
            return false;
        }
    }

    private Path safeResolve(Path root, String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }
}
