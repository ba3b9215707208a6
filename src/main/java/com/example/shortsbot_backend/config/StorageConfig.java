package com.example.shortsbot_backend.config;

import com.example.shortsbot_backend.service.LocalStorageService;
import com.example.shortsbot_backend.service.Interfaces.StorageService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public StorageService storageService(StorageProperties properties, Clock clock) {
        Path base = Path.of(properties.getBaseDir());
        var svc = new LocalStorageService(base, properties, clock);
        org.slf4j.LoggerFactory.getLogger(StorageConfig.class)
                .info("Storage wired: base={}, temp={}, platforms={}, thumbnails={}, backgrounds={}",
                        base, properties.getTempPrefix(), properties.getPlatformsPrefix(),
                        properties.getThumbnailsPrefix(), properties.getBackgroundsPrefix());
        return svc;
    }
}
