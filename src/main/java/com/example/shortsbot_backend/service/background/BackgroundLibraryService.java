package com.example.shortsbot_backend.service.background;

import com.example.shortsbot_backend.dto.web.BackgroundStatsResponse;
import com.example.shortsbot_backend.model.BackgroundClip;
import com.example.shortsbot_backend.repository.BackgroundClipRepository;
import com.example.shortsbot_backend.service.Interfaces.BackgroundAcquisitionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class BackgroundLibraryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(BackgroundLibraryService.class);

    private final BackgroundClipRepository clipRepository;
    private final BackgroundAcquisitionService acquisitionService;

    public BackgroundLibraryService(BackgroundClipRepository clipRepository, BackgroundAcquisitionService acquisitionService) {
        this.clipRepository = clipRepository;
        this.acquisitionService = acquisitionService;
    }

    @Transactional(readOnly = true)
    public BackgroundStatsResponse stats() {
        List<BackgroundStatsResponse.Group> byTheme = clipRepository.statsByTheme().stream()
                .map(s -> new BackgroundStatsResponse.Group(s.getGroupKey(), s.getClips(), s.getTotalUsage()))
                .toList();
        List<BackgroundStatsResponse.Group> bySource = clipRepository.statsBySource().stream()
                .map(s -> new BackgroundStatsResponse.Group(s.getGroupKey(), s.getClips(), s.getTotalUsage()))
                .toList();
        long clips = byTheme.stream().mapToLong(BackgroundStatsResponse.Group::clips).sum();
        long usage = byTheme.stream().mapToLong(BackgroundStatsResponse.Group::totalUsage).sum();
        return new BackgroundStatsResponse(clips, usage, byTheme, bySource);
    }

    public List<BackgroundClip> acquire(String theme, int countPerSource) {
        List<BackgroundClip> clips = acquisitionService.acquire(theme, countPerSource);
        LOGGER.info("BackgroundLibraryService ACQUIRE theme={} requestedPerSource={} acquired={}", theme, countPerSource, clips.size());
        return clips;
    }
}
