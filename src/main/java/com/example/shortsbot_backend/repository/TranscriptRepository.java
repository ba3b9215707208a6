package com.example.shortsbot_backend.repository;

import com.example.shortsbot_backend.model.Transcript;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface TranscriptRepository extends JpaRepository<Transcript, UUID> {
    Optional<Transcript> findByVideoId(String videoId);
}
