package com.example.shortsbot_backend.repository;

import com.example.shortsbot_backend.model.ShortAnalytics;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ShortAnalyticsRepository extends JpaRepository<ShortAnalytics, UUID> {
    Optional<ShortAnalytics> findByVideoIdAndPlatform(String videoId, String platform);

    @Query("""
           select a.platform as platform,
                  count(a) as shorts,
                  coalesce(sum(a.views), 0) as views,
                  coalesce(sum(a.likes), 0) as likes,
                  coalesce(sum(a.shares), 0) as shares,
                  coalesce(sum(a.comments), 0) as comments,
                  coalesce(avg(a.duration), 0) as avgDuration
           from ShortAnalytics a
           where a.createdAt >= :since
           group by a.platform
           order by a.platform
           """)
    List<PlatformStat> platformStatsSince(@Param("since") Instant since);

    /**
     * Ranked by {@code views + 2*likes + 5*shares + 3*comments}, newest first on ties.
     */
    @Query("""
           select a
           from ShortAnalytics a
           order by (a.views + 2 * a.likes + 5 * a.shares + 3 * a.comments) desc, a.createdAt desc
           """)
    List<ShortAnalytics> findTopViral(Pageable pageable);

    interface PlatformStat {
        String getPlatform();
        long getShorts();
        long getViews();
        long getLikes();
        long getShares();
        long getComments();
        double getAvgDuration();
    }
}
