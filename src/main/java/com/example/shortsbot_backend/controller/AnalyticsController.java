package com.example.shortsbot_backend.controller;

import com.example.shortsbot_backend.dto.web.PerformanceUpdateRequest;
import com.example.shortsbot_backend.dto.web.PlatformStatsResponse;
import com.example.shortsbot_backend.dto.web.ShortAnalyticsResponse;
import com.example.shortsbot_backend.service.analytics.ShortAnalyticsService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/analytics")
public class AnalyticsController {
    private final ShortAnalyticsService analyticsService;

    public AnalyticsController(ShortAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @PutMapping("/{videoId}/{platform}")
    public ShortAnalyticsResponse update(@PathVariable String videoId,
                                         @PathVariable String platform,
                                         @Valid @RequestBody PerformanceUpdateRequest request) {
        return analyticsService.updatePerformance(videoId, platform,
                request.views(), request.likes(), request.shares(), request.comments());
    }

    @GetMapping("/platforms")
    public List<PlatformStatsResponse> platformStats(@RequestParam(defaultValue = "30") int days) {
        return analyticsService.platformStats(days);
    }

    @GetMapping("/top")
    public List<ShortAnalyticsResponse> top(@RequestParam(defaultValue = "10") int limit) {
        return analyticsService.topViral(limit);
    }
}
