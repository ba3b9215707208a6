package com.example.shortsbot_backend.repository;

import com.example.shortsbot_backend.model.ShortBuild;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ShortBuildRepository extends JpaRepository<ShortBuild, UUID> {
    boolean existsByVideoIdAndPlatform(String videoId, String platform);

    Optional<ShortBuild> findByVideoIdAndPlatform(String videoId, String platform);

    List<ShortBuild> findAllByOrderByCreatedAtDesc();

    List<ShortBuild> findByPlatformOrderByCreatedAtDesc(String platform);

    long countByPlatform(String platform);
}
