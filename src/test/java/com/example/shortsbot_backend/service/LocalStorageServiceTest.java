package com.example.shortsbot_backend.service;

import com.example.shortsbot_backend.config.StorageProperties;
import com.example.shortsbot_backend.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalStorageServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T03:00:00Z");

    @TempDir
    Path tmp;

    private LocalStorageService storage;

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(tmp, new StorageProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void purgeDeletesOnlyOldFilesAndPrunesEmptyDirectories() throws Exception {
        Path oldDir = storage.newWorkDir("old");
        Path oldFile = Files.write(oldDir.resolve("a.mp4"), new byte[]{1});
        Files.setLastModifiedTime(oldFile, FileTime.from(NOW.minus(Duration.ofDays(8))));
        Path freshDir = storage.newWorkDir("fresh");
        Path freshFile = Files.write(freshDir.resolve("b.mp4"), new byte[]{1});
        Files.setLastModifiedTime(freshFile, FileTime.from(NOW.minus(Duration.ofDays(1))));

        int deleted = storage.purgeTempOlderThan(Duration.ofDays(7));

        assertThat(deleted).isEqualTo(1);
        assertThat(oldDir).doesNotExist();
        assertThat(freshFile).exists();
        assertThat(storage.rootTemp()).exists();
    }

    @Test
    void moveToReplacesExistingTarget() throws Exception {
        Path src = Files.write(storage.newWorkDir("w").resolve("final.mp4"), new byte[]{1, 2});
        Path existing = storage.resolve("platforms/tiktok/v_tiktok.mp4");
        Files.createDirectories(existing.getParent());
        Files.write(existing, new byte[]{9});

        Path moved = storage.moveTo(src, "platforms/tiktok/v_tiktok.mp4");

        assertThat(moved).isEqualTo(existing);
        assertThat(Files.readAllBytes(moved)).containsExactly(1, 2);
        assertThat(src).doesNotExist();
    }

    @Test
    void rejectsPathTraversal() {
        assertThatThrownBy(() -> storage.resolve("../../etc/passwd")).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> storage.resolveBackground("..", "../x.mp4")).isInstanceOf(StorageException.class);
    }
}
