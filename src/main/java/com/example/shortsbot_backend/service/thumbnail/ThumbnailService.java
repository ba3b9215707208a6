package com.example.shortsbot_backend.service.thumbnail;

import com.example.shortsbot_backend.config.MediaToolProperties;
import com.example.shortsbot_backend.engine.MediaToolkit;
import com.example.shortsbot_backend.exception.ShortBuildException;
import com.example.shortsbot_backend.exception.StorageException;
import com.example.shortsbot_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Extracts a single-frame thumbnail for a finished short. Best-effort: failures are logged and
 * reported as {@code null}.
 */
@Service
public class ThumbnailService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThumbnailService.class);
    private static final double MIN_THUMB_SEC = 0.0;

    private final MediaToolkit toolkit;
    private final StorageService storageService;
    private final MediaToolProperties props;

    public ThumbnailService(MediaToolkit toolkit, StorageService storageService, MediaToolProperties props) {
        this.toolkit = toolkit;
        this.storageService = storageService;
        this.props = props;
    }

    /**
     * @param video    finished short.
     * @param duration its duration; the frame offset is kept inside it.
     * @param name     thumbnail file name in the thumbnails area.
     * @return the thumbnail, or {@code null} when extraction failed.
     */
    public Path extract(Path video, double duration, String name) {
        double at = offsetFor(props.getThumbnailOffsetSeconds(), duration);
        Path target = null;
        try {
            target = storageService.resolveThumbnail(name);
            Files.createDirectories(target.getParent());
            toolkit.extractFrame(video, at, target);
            if (!Files.isRegularFile(target) || Files.size(target) == 0) {
                LOGGER.warn("ThumbnailService EMPTY video={} at={}", video.getFileName(), at);
                Files.deleteIfExists(target);
                return null;
            }
            LOGGER.info("ThumbnailService CREATED video={} at={} thumbnail={}", video.getFileName(), at, target);
            return target;
        } catch (ShortBuildException | StorageException | IOException e) {
            LOGGER.warn("ThumbnailService FAILED video={} target={} cause={}", video.getFileName(), target, e.getMessage());
            return null;
        }
    }

    /** Fixed offset, pulled back to the middle of very short videos. */
    static double offsetFor(double configured, double duration) {
        if (duration <= 0) {
            return MIN_THUMB_SEC;
        }
        return Math.max(MIN_THUMB_SEC, Math.min(configured, duration / 2.0));
    }
}
