package com.example.shortsbot_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Post-publication metrics for a short. Seeded with zeroes when the short is recorded and
 * updated out of band.
 */
@Entity
@Table(name = "shorts_analytics",
        uniqueConstraints = @UniqueConstraint(name = "uq_analytics_video_platform", columnNames = {"video_id", "platform"}))
public class ShortAnalytics {
    public static final String STATUS_CREATED = "created";
    public static final String STATUS_PUBLISHED = "published";

    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "video_id", nullable = false, length = 128)
    private String videoId;

    @Column(name = "platform", nullable = false, length = 32)
    private String platform;

    @Column(name = "short_path", length = 1024)
    private String shortPath;

    @Column(name = "duration")
    private double duration;

    @Column(name = "file_size")
    private long fileSize;

    @Column(name = "views", nullable = false)
    private long views;

    @Column(name = "likes", nullable = false)
    private long likes;

    @Column(name = "shares", nullable = false)
    private long shares;

    @Column(name = "comments", nullable = false)
    private long comments;

    @Column(name = "status", nullable = false, length = 32)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    protected ShortAnalytics() {
    }

    public static ShortAnalytics seed(String videoId, String platform, String shortPath,
                                      double duration, long fileSize, Instant now) {
        ShortAnalytics a = new ShortAnalytics();
        a.videoId = videoId;
        a.platform = platform;
        a.shortPath = shortPath;
        a.duration = duration;
        a.fileSize = fileSize;
        a.status = STATUS_CREATED;
        a.createdAt = now;
        a.lastUpdated = now;
        return a;
    }

    public void updateMetrics(long views, long likes, long shares, long comments, Instant now) {
        this.views = views;
        this.likes = likes;
        this.shares = shares;
        this.comments = comments;
        this.status = STATUS_PUBLISHED;
        this.lastUpdated = now;
    }

    /** {@code views + 2*likes + 5*shares + 3*comments}. */
    public long viralScore() {
        return views + 2 * likes + 5 * shares + 3 * comments;
    }

    public UUID getId() { return id; }
    public String getVideoId() { return videoId; }
    public String getPlatform() { return platform; }
    public String getShortPath() { return shortPath; }
    public double getDuration() { return duration; }
    public long getFileSize() { return fileSize; }
    public long getViews() { return views; }
    public long getLikes() { return likes; }
    public long getShares() { return shares; }
    public long getComments() { return comments; }
    public String getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastUpdated() { return lastUpdated; }
}
