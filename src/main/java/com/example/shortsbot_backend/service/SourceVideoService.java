package com.example.shortsbot_backend.service;

import com.example.shortsbot_backend.dto.web.RegisterVideoRequest;
import com.example.shortsbot_backend.model.SourceVideo;
import com.example.shortsbot_backend.repository.SourceVideoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Registry of downloaded source videos. Registering an existing id updates its paths and metadata.
 */
@Service
public class SourceVideoService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceVideoService.class);

    private final SourceVideoRepository videoRepository;
    private final Clock clock;

    public SourceVideoService(SourceVideoRepository videoRepository, Clock clock) {
        this.videoRepository = videoRepository;
        this.clock = clock;
    }

    @Transactional
    public SourceVideo register(RegisterVideoRequest req) {
        String theme = req.theme() == null || req.theme().isBlank() ? null : req.theme().trim().toLowerCase(Locale.ROOT);
        SourceVideo video = videoRepository.findByVideoId(req.videoId())
                .map(existing -> {
                    existing.setTitle(req.title());
                    existing.setTheme(theme);
                    existing.setVideoPath(req.videoPath());
                    existing.setAudioPath(req.audioPath());
                    return existing;
                })
                .orElseGet(() -> new SourceVideo(req.videoId(), req.title(), theme, req.videoPath(), req.audioPath(), clock.instant()));
        SourceVideo saved = videoRepository.save(video);
        LOGGER.info("SourceVideoService REGISTERED videoId={} theme={}", saved.getVideoId(), saved.getTheme());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<SourceVideo> find(String videoId) {
        return videoRepository.findByVideoId(videoId);
    }
}
