package com.example.shortsbot_backend.service.Interfaces;

import java.nio.file.Path;
import java.time.Duration;

public interface StorageService {
    /** Resolves a key relative to the storage base directory (platform outputs, sources). */
    Path resolve(String objectKey);

    Path resolveTemp(String objectKey);

    Path resolveThumbnail(String objectKey);

    Path resolveBackground(String theme, String filename);

    /** Creates a fresh, uniquely named working directory in the temp area. */
    Path newWorkDir(String prefix);

    /**
     * Moves a file to {@code objectKey} under the base directory, replacing any existing file.
     *
     * @return the final location.
     */
    Path moveTo(Path sourceFile, String objectKey);

    boolean exists(String objectKey);

    /**
     * Deletes temp-area files last modified before {@code now - age} and prunes empty directories.
     *
     * @return number of files deleted.
     */
    int purgeTempOlderThan(Duration age);

    Path rootBase();

    Path rootTemp();
}
