package com.example.shortsbot_backend.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transcripts",
        uniqueConstraints = @UniqueConstraint(name = "uq_transcripts_video_id", columnNames = "video_id"))
public class Transcript {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "video_id", nullable = false, length = 128)
    private String videoId;

    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    @Column(name = "text", columnDefinition = "text")
    private String text;

    // array of {start, end, text}
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "segments")
    private JsonNode segments;

    @Column(name = "duration")
    private double duration;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Transcript() {
    }

    public Transcript(String videoId, String provider, Instant createdAt) {
        this.videoId = videoId;
        this.provider = provider;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public String getVideoId() { return videoId; }
    public String getProvider() { return provider; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public JsonNode getSegments() { return segments; }
    public void setSegments(JsonNode segments) { this.segments = segments; }
    public double getDuration() { return duration; }
    public void setDuration(double duration) { this.duration = duration; }
    public Instant getCreatedAt() { return createdAt; }
}
