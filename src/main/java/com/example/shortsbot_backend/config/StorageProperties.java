package com.example.shortsbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String tempPrefix = "temp";
    private String platformsPrefix = "platforms";
    private String thumbnailsPrefix = "thumbnails";
    private String backgroundsPrefix = "backgrounds";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getTempPrefix() { return tempPrefix; }
    public void setTempPrefix(String tempPrefix) { this.tempPrefix = tempPrefix; }

    public String getPlatformsPrefix() { return platformsPrefix; }
    public void setPlatformsPrefix(String platformsPrefix) { this.platformsPrefix = platformsPrefix; }

    public String getThumbnailsPrefix() { return thumbnailsPrefix; }
    public void setThumbnailsPrefix(String thumbnailsPrefix) { this.thumbnailsPrefix = thumbnailsPrefix; }

    public String getBackgroundsPrefix() { return backgroundsPrefix; }
    public void setBackgroundsPrefix(String backgroundsPrefix) { this.backgroundsPrefix = backgroundsPrefix; }
}
