package com.example.shortsbot_backend.dto.web;

import com.example.shortsbot_backend.repository.ShortAnalyticsRepository;

/**
 * Aggregated metrics for one platform over a reporting window.
 */
public record PlatformStatsResponse(String platform, long shorts, long views, long likes, long shares,
                                    long comments, double avgDuration) {
    public static PlatformStatsResponse from(ShortAnalyticsRepository.PlatformStat s) {
        return new PlatformStatsResponse(s.getPlatform(), s.getShorts(), s.getViews(), s.getLikes(),
                s.getShares(), s.getComments(), s.getAvgDuration());
    }
}
