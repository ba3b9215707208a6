package com.example.shortsbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Controls the scheduled purge of the temporary artifact area.
 */
@ConfigurationProperties(prefix = "shorts.cleanup")
public class TempCleanupProperties {
    private boolean enabled = true;
    private int maxAgeDays = 7;
    private String cron = "0 0 3 * * *";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getMaxAgeDays() { return maxAgeDays; }
    public void setMaxAgeDays(int maxAgeDays) { this.maxAgeDays = maxAgeDays; }

    public String getCron() { return cron; }
    public void setCron(String cron) { this.cron = cron; }
}
