package com.example.shortsbot_backend.dto.web;

import com.example.shortsbot_backend.model.SourceVideo;

import java.time.Instant;
import java.util.UUID;

public record SourceVideoResponse(UUID id, String videoId, String title, String theme,
                                  String videoPath, String audioPath, Instant createdAt) {
    public static SourceVideoResponse from(SourceVideo v) {
        return new SourceVideoResponse(v.getId(), v.getVideoId(), v.getTitle(), v.getTheme(),
                v.getVideoPath(), v.getAudioPath(), v.getCreatedAt());
    }
}
