package com.example.shortsbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "media.tools")
public class MediaToolProperties {
    private String ffmpegBinary = "ffmpeg";
    private String ffprobeBinary = "ffprobe";
    private long probeTimeoutSeconds = 30;
    private long stageTimeoutSeconds = 300;
    private long thumbnailTimeoutSeconds = 30;
    private double thumbnailOffsetSeconds = 5.0;
    private String preset = "veryfast";
    private int crf = 23;

    public String getFfmpegBinary() { return ffmpegBinary; }
    public void setFfmpegBinary(String ffmpegBinary) { this.ffmpegBinary = ffmpegBinary; }

    public String getFfprobeBinary() { return ffprobeBinary; }
    public void setFfprobeBinary(String ffprobeBinary) { this.ffprobeBinary = ffprobeBinary; }

    public long getProbeTimeoutSeconds() { return probeTimeoutSeconds; }
    public void setProbeTimeoutSeconds(long probeTimeoutSeconds) { this.probeTimeoutSeconds = probeTimeoutSeconds; }

    public long getStageTimeoutSeconds() { return stageTimeoutSeconds; }
    public void setStageTimeoutSeconds(long stageTimeoutSeconds) { this.stageTimeoutSeconds = stageTimeoutSeconds; }

    public long getThumbnailTimeoutSeconds() { return thumbnailTimeoutSeconds; }
    public void setThumbnailTimeoutSeconds(long thumbnailTimeoutSeconds) { this.thumbnailTimeoutSeconds = thumbnailTimeoutSeconds; }

    public double getThumbnailOffsetSeconds() { return thumbnailOffsetSeconds; }
    public void setThumbnailOffsetSeconds(double thumbnailOffsetSeconds) { this.thumbnailOffsetSeconds = thumbnailOffsetSeconds; }

    public String getPreset() { return preset; }
    public void setPreset(String preset) { this.preset = preset; }

    public int getCrf() { return crf; }
    public void setCrf(int crf) { this.crf = crf; }
}
