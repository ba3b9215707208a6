package com.example.shortsbot_backend.repository;

import com.example.shortsbot_backend.model.BackgroundUsage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BackgroundUsageRepository extends JpaRepository<BackgroundUsage, UUID> {
    List<BackgroundUsage> findByVideoIdOrderByUsageDateAsc(String videoId);
}
