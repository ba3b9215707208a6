package com.example.shortsbot_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({
        PlatformProperties.class,
        ScoringProperties.class,
        TimelineProperties.class,
        BackgroundProperties.class,
        MediaToolProperties.class,
        NarrationProperties.class,
        TempCleanupProperties.class
})
public class AppPropertiesConfig {
}
