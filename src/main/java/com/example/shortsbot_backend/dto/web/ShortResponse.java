package com.example.shortsbot_backend.dto.web;

import com.example.shortsbot_backend.model.ShortBuild;

import java.time.Instant;
import java.util.UUID;

public record ShortResponse(UUID id, String videoId, String platform, String shortPath, String thumbnailPath,
                            String title, double startTime, double endTime, String justification, double score,
                            Instant createdAt) {
    public static ShortResponse from(ShortBuild s) {
        return new ShortResponse(s.getId(), s.getVideoId(), s.getPlatform(), s.getShortPath(), s.getThumbnailPath(),
                s.getTitle(), s.getStartTime(), s.getEndTime(), s.getJustification(), s.getScore(), s.getCreatedAt());
    }
}
