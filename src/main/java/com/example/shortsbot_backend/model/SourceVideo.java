package com.example.shortsbot_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * A downloaded long-form video registered as short material.
 */
@Entity
@Table(name = "videos",
        uniqueConstraints = @UniqueConstraint(name = "uq_videos_video_id", columnNames = "video_id"))
public class SourceVideo {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "video_id", nullable = false, length = 128)
    private String videoId;

    @Column(name = "title", length = 512)
    private String title;

    @Column(name = "theme", length = 64)
    private String theme;

    @Column(name = "video_path", nullable = false, length = 1024)
    private String videoPath;

    @Column(name = "audio_path", length = 1024)
    private String audioPath;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected SourceVideo() {
    }

    public SourceVideo(String videoId, String title, String theme, String videoPath, String audioPath, Instant createdAt) {
        this.videoId = videoId;
        this.title = title;
        this.theme = theme;
        this.videoPath = videoPath;
        this.audioPath = audioPath;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public String getVideoId() { return videoId; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getTheme() { return theme; }
    public void setTheme(String theme) { this.theme = theme; }
    public String getVideoPath() { return videoPath; }
    public void setVideoPath(String videoPath) { this.videoPath = videoPath; }
    public String getAudioPath() { return audioPath; }
    public void setAudioPath(String audioPath) { this.audioPath = audioPath; }
    public Instant getCreatedAt() { return createdAt; }
}
