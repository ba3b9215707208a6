package com.example.shortsbot_backend.service.analytics;

import com.example.shortsbot_backend.dto.web.PlatformStatsResponse;
import com.example.shortsbot_backend.dto.web.ShortAnalyticsResponse;
import com.example.shortsbot_backend.model.ShortAnalytics;
import com.example.shortsbot_backend.repository.ShortAnalyticsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class ShortAnalyticsService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortAnalyticsService.class);
    private static final int MAX_TOP = 100;

    private final ShortAnalyticsRepository analyticsRepository;
    private final Clock clock;

    public ShortAnalyticsService(ShortAnalyticsRepository analyticsRepository, Clock clock) {
        this.analyticsRepository = analyticsRepository;
        this.clock = clock;
    }

    /**
     * Overwrites the counters of a recorded short and marks it published.
     */
    @Transactional
    public ShortAnalyticsResponse updatePerformance(String videoId, String platform,
                                                    long views, long likes, long shares, long comments) {
        ShortAnalytics analytics = analyticsRepository.findByVideoIdAndPlatform(videoId, platform)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No short recorded for video=" + videoId + ", platform=" + platform));
        analytics.updateMetrics(views, likes, shares, comments, clock.instant());
        LOGGER.info("ShortAnalyticsService UPDATED videoId={} platform={} views={} score={}",
                videoId, platform, views, analytics.viralScore());
        return ShortAnalyticsResponse.from(analytics);
    }

    @Transactional(readOnly = true)
    public List<PlatformStatsResponse> platformStats(int days) {
        Instant since = clock.instant().minus(Duration.ofDays(Math.max(1, days)));
        return analyticsRepository.platformStatsSince(since).stream()
                .map(PlatformStatsResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ShortAnalyticsResponse> topViral(int limit) {
        int size = Math.min(Math.max(1, limit), MAX_TOP);
        return analyticsRepository.findTopViral(PageRequest.of(0, size)).stream()
                .map(ShortAnalyticsResponse::from)
                .toList();
    }
}
