package com.example.shortsbot_backend.repository;

import com.example.shortsbot_backend.model.SourceVideo;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SourceVideoRepository extends JpaRepository<SourceVideo, UUID> {
    Optional<SourceVideo> findByVideoId(String videoId);

    /**
     * Videos that have no short yet for the platform, oldest registration first.
     */
    @Query("""
           select v
           from SourceVideo v
           where not exists (
               select 1 from ShortBuild s
               where s.videoId = v.videoId and s.platform = :platform
           )
           order by v.createdAt asc
           """)
    List<SourceVideo> findWithoutShortFor(@Param("platform") String platform, Pageable pageable);
}
