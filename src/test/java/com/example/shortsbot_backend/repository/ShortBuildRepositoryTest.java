package com.example.shortsbot_backend.repository;

import com.example.shortsbot_backend.model.ShortAnalytics;
import com.example.shortsbot_backend.model.ShortBuild;
import com.example.shortsbot_backend.model.SourceVideo;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class ShortBuildRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private ShortBuildRepository shortRepository;

    @Autowired
    private ShortAnalyticsRepository analyticsRepository;

    @Autowired
    private SourceVideoRepository videoRepository;

    @Test
    void secondShortForSamePairViolatesUniqueConstraint() {
        shortRepository.saveAndFlush(build("v1", "tiktok", T0));

        assertThrows(DataIntegrityViolationException.class,
                () -> shortRepository.saveAndFlush(build("v1", "tiktok", T0.plusSeconds(1))));
    }

    @Test
    void findsVideosWithoutShortOnPlatform() {
        videoRepository.save(new SourceVideo("v1", "a", "nature", "/v1.mp4", null, T0));
        videoRepository.save(new SourceVideo("v2", "b", "nature", "/v2.mp4", null, T0.plusSeconds(1)));
        videoRepository.save(new SourceVideo("v3", "c", "nature", "/v3.mp4", null, T0.plusSeconds(2)));
        shortRepository.save(build("v1", "tiktok", T0));
        shortRepository.save(build("v2", "instagram_reels", T0));
        shortRepository.flush();

        List<SourceVideo> pending = videoRepository.findWithoutShortFor("tiktok", PageRequest.of(0, 10));
        List<SourceVideo> limited = videoRepository.findWithoutShortFor("tiktok", PageRequest.of(0, 1));

        assertThat(pending).extracting(SourceVideo::getVideoId).containsExactly("v2", "v3");
        assertThat(limited).extracting(SourceVideo::getVideoId).containsExactly("v2");
        assertThat(shortRepository.countByPlatform("tiktok")).isEqualTo(1);
    }

    @Test
    void topViralUsesWeightedEngagement() {
        ShortAnalytics views = ShortAnalytics.seed("v1", "tiktok", "/a.mp4", 70, 1, T0);
        views.updateMetrics(100, 0, 0, 0, T0);
        ShortAnalytics shares = ShortAnalytics.seed("v2", "tiktok", "/b.mp4", 80, 1, T0);
        shares.updateMetrics(10, 10, 20, 0, T0);
        ShortAnalytics fresh = ShortAnalytics.seed("v3", "youtube_shorts", "/c.mp4", 90, 1, T0.plusSeconds(10));
        analyticsRepository.saveAllAndFlush(List.of(views, shares, fresh));

        List<ShortAnalytics> top = analyticsRepository.findTopViral(PageRequest.of(0, 2));

        // 10 + 20 + 100 = 130 beats 100
        assertThat(top).extracting(ShortAnalytics::getVideoId).containsExactly("v2", "v1");
    }

    @Test
    void platformStatsAggregateSinceCutoff() {
        ShortAnalytics a = ShortAnalytics.seed("v1", "tiktok", "/a.mp4", 70, 1, T0);
        a.updateMetrics(100, 10, 1, 2, T0);
        ShortAnalytics b = ShortAnalytics.seed("v2", "tiktok", "/b.mp4", 90, 1, T0);
        b.updateMetrics(50, 5, 0, 0, T0);
        ShortAnalytics old = ShortAnalytics.seed("v3", "tiktok", "/c.mp4", 80, 1, T0.minusSeconds(86_400 * 60L));
        analyticsRepository.saveAllAndFlush(List.of(a, b, old));

        List<ShortAnalyticsRepository.PlatformStat> stats = analyticsRepository.platformStatsSince(T0.minusSeconds(3600));

        assertThat(stats).hasSize(1);
        ShortAnalyticsRepository.PlatformStat s = stats.get(0);
        assertThat(s.getPlatform()).isEqualTo("tiktok");
        assertThat(s.getShorts()).isEqualTo(2);
        assertThat(s.getViews()).isEqualTo(150);
        assertThat(s.getAvgDuration()).isEqualTo(80.0);
    }

    private static ShortBuild build(String videoId, String platform, Instant at) {
        return new ShortBuild(videoId, platform, "/out/" + videoId + ".mp4", null, "t", 0, 70, "j", 0.5, at);
    }
}
