package com.example.shortsbot_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Stock footage clip in the shared background pool. The only entity with cross-run mutable
 * state ({@code usageCount}, {@code lastUsed}).
 */
@Entity
@Table(name = "fonds",
        uniqueConstraints = @UniqueConstraint(name = "uq_fonds_filename", columnNames = "filename"),
        indexes = @Index(name = "ix_fonds_theme_usage", columnList = "theme, usage_count"))
public class BackgroundClip {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "filename", nullable = false, length = 512)
    private String filename;

    @Column(name = "theme", nullable = false, length = 64)
    private String theme;

    @Column(name = "source", nullable = false, length = 32)
    private String source;

    @Column(name = "url", length = 2048)
    private String url;

    @Column(name = "duration", nullable = false)
    private double duration;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "download_date", nullable = false)
    private Instant downloadDate;

    @Column(name = "usage_count", nullable = false)
    private int usageCount;

    @Column(name = "last_used")
    private Instant lastUsed;

    protected BackgroundClip() {
    }

    public BackgroundClip(String filename, String theme, String source, String url,
                          double duration, long fileSize, Instant downloadDate) {
        this.filename = filename;
        this.theme = theme;
        this.source = source;
        this.url = url;
        this.duration = duration;
        this.fileSize = fileSize;
        this.downloadDate = downloadDate;
        this.usageCount = 0;
    }

    public UUID getId() { return id; }
    public String getFilename() { return filename; }
    public String getTheme() { return theme; }
    public String getSource() { return source; }
    public String getUrl() { return url; }
    public double getDuration() { return duration; }
    public long getFileSize() { return fileSize; }
    public Instant getDownloadDate() { return downloadDate; }
    public int getUsageCount() { return usageCount; }
    public Instant getLastUsed() { return lastUsed; }
}
