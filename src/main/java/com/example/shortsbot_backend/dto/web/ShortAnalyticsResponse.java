package com.example.shortsbot_backend.dto.web;

import com.example.shortsbot_backend.model.ShortAnalytics;

import java.time.Instant;

public record ShortAnalyticsResponse(String videoId, String platform, String shortPath, double duration,
                                     long fileSize, long views, long likes, long shares, long comments,
                                     long viralScore, String status, Instant createdAt, Instant lastUpdated) {
    public static ShortAnalyticsResponse from(ShortAnalytics a) {
        return new ShortAnalyticsResponse(a.getVideoId(), a.getPlatform(), a.getShortPath(), a.getDuration(),
                a.getFileSize(), a.getViews(), a.getLikes(), a.getShares(), a.getComments(), a.viralScore(),
                a.getStatus(), a.getCreatedAt(), a.getLastUpdated());
    }
}
