package com.example.shortsbot_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "fond_usage")
public class BackgroundUsage {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "fond_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_fond_usage_fond"))
    private BackgroundClip clip;

    @Column(name = "video_id", nullable = false, length = 128)
    private String videoId;

    @Column(name = "usage_date", nullable = false)
    private Instant usageDate;

    protected BackgroundUsage() {
    }

    public BackgroundUsage(BackgroundClip clip, String videoId, Instant usageDate) {
        this.clip = clip;
        this.videoId = videoId;
        this.usageDate = usageDate;
    }

    public UUID getId() { return id; }
    public BackgroundClip getClip() { return clip; }
    public String getVideoId() { return videoId; }
    public Instant getUsageDate() { return usageDate; }
}
