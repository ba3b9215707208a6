package com.example.shortsbot_backend.dto.web;

import java.util.List;

public record BackgroundStatsResponse(long totalClips, long totalUsage, List<Group> byTheme, List<Group> bySource) {
    public record Group(String key, long clips, long totalUsage) {}
}
