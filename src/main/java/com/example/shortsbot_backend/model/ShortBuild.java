package com.example.shortsbot_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Write-once record of a finished short. At most one per {@code (videoId, platform)}.
 */
@Entity
@Table(name = "shorts",
        uniqueConstraints = @UniqueConstraint(name = "uq_shorts_video_platform", columnNames = {"video_id", "platform"}))
public class ShortBuild {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "video_id", nullable = false, updatable = false, length = 128)
    private String videoId;

    @Column(name = "platform", nullable = false, updatable = false, length = 32)
    private String platform;

    @Column(name = "short_path", nullable = false, updatable = false, length = 1024)
    private String shortPath;

    @Column(name = "thumbnail_path", updatable = false, length = 1024)
    private String thumbnailPath;

    @Column(name = "title", updatable = false, length = 512)
    private String title;

    @Column(name = "start_time", nullable = false, updatable = false)
    private double startTime;

    @Column(name = "end_time", nullable = false, updatable = false)
    private double endTime;

    @Column(name = "justification", updatable = false, columnDefinition = "text")
    private String justification;

    @Column(name = "score", updatable = false)
    private double score;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ShortBuild() {
    }

    public ShortBuild(String videoId, String platform, String shortPath, String thumbnailPath,
                      String title, double startTime, double endTime, String justification,
                      double score, Instant createdAt) {
        this.videoId = videoId;
        this.platform = platform;
        this.shortPath = shortPath;
        this.thumbnailPath = thumbnailPath;
        this.title = title;
        this.startTime = startTime;
        this.endTime = endTime;
        this.justification = justification;
        this.score = score;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public String getVideoId() { return videoId; }
    public String getPlatform() { return platform; }
    public String getShortPath() { return shortPath; }
    public String getThumbnailPath() { return thumbnailPath; }
    public String getTitle() { return title; }
    public double getStartTime() { return startTime; }
    public double getEndTime() { return endTime; }
    public String getJustification() { return justification; }
    public double getScore() { return score; }
    public Instant getCreatedAt() { return createdAt; }
}
