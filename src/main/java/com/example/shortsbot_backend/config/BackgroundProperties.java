package com.example.shortsbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Background clip pool and stock footage providers.
 */
@ConfigurationProperties(prefix = "shorts.background")
public class BackgroundProperties {
    private String defaultTheme = "motivation";
    private int acquireBatchSize = 2;
    private int maxClipsPerShort = 5;
    private int maxIncrementRetries = 3;
    private long downloadTimeoutSeconds = 120;
    private Provider pexels = new Provider("https://api.pexels.com");
    private Provider pixabay = new Provider("https://pixabay.com");

    public String getDefaultTheme() { return defaultTheme; }
    public void setDefaultTheme(String defaultTheme) { this.defaultTheme = defaultTheme; }

    public int getAcquireBatchSize() { return acquireBatchSize; }
    public void setAcquireBatchSize(int acquireBatchSize) { this.acquireBatchSize = acquireBatchSize; }

    public int getMaxClipsPerShort() { return maxClipsPerShort; }
    public void setMaxClipsPerShort(int maxClipsPerShort) { this.maxClipsPerShort = maxClipsPerShort; }

    public int getMaxIncrementRetries() { return maxIncrementRetries; }
    public void setMaxIncrementRetries(int maxIncrementRetries) { this.maxIncrementRetries = maxIncrementRetries; }

    public long getDownloadTimeoutSeconds() { return downloadTimeoutSeconds; }
    public void setDownloadTimeoutSeconds(long downloadTimeoutSeconds) { this.downloadTimeoutSeconds = downloadTimeoutSeconds; }

    public Provider getPexels() { return pexels; }
    public void setPexels(Provider pexels) { this.pexels = pexels; }

    public Provider getPixabay() { return pixabay; }
    public void setPixabay(Provider pixabay) { this.pixabay = pixabay; }

    public static class Provider {
        private String apiKey;
        private String baseUrl;

        public Provider() {
        }

        public Provider(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }
}
