package com.example.shortsbot_backend.repository;

import com.example.shortsbot_backend.model.BackgroundClip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface BackgroundClipRepository extends JpaRepository<BackgroundClip, UUID> {

    /**
     * Pool for a theme in selection order: least used first, then most recently downloaded.
     */
    @Query("""
           select c
           from BackgroundClip c
           where c.theme = :theme
           order by c.usageCount asc, c.downloadDate desc
           """)
    List<BackgroundClip> findPoolInSelectionOrder(@Param("theme") String theme);

    /**
     * Compare-and-increment of the usage counter. Returns {@code 0} when another caller
     * selected the clip after {@code expected} was read.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           update BackgroundClip c
              set c.usageCount = c.usageCount + 1,
                  c.lastUsed = :now
            where c.id = :id
              and c.usageCount = :expected
           """)
    int incrementUsageIfUnchanged(@Param("id") UUID id,
                                  @Param("expected") int expected,
                                  @Param("now") Instant now);

    boolean existsByFilename(String filename);

    boolean existsBySourceAndUrl(String source, String url);

    long countByTheme(String theme);

    @Query("""
           select c.theme as groupKey, count(c) as clips, coalesce(sum(c.usageCount), 0) as totalUsage
           from BackgroundClip c
           group by c.theme
           order by c.theme
           """)
    List<UsageStat> statsByTheme();

    @Query("""
           select c.source as groupKey, count(c) as clips, coalesce(sum(c.usageCount), 0) as totalUsage
           from BackgroundClip c
           group by c.source
           order by c.source
           """)
    List<UsageStat> statsBySource();

    interface UsageStat {
        String getGroupKey();
        long getClips();
        long getTotalUsage();
    }
}
