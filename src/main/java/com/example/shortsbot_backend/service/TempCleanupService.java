package com.example.shortsbot_backend.service;

import com.example.shortsbot_backend.config.TempCleanupProperties;
import com.example.shortsbot_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Removes stale work files left in the temp area by interrupted builds.
 */
@Service
public class TempCleanupService {
    private static final Logger LOGGER = LoggerFactory.getLogger(TempCleanupService.class);

    private final StorageService storageService;
    private final TempCleanupProperties props;

    public TempCleanupService(StorageService storageService, TempCleanupProperties props) {
        this.storageService = storageService;
        this.props = props;
    }

    @Scheduled(cron = "${shorts.cleanup.cron:0 0 3 * * *}")
    public void scheduledPurge() {
        if (!props.isEnabled()) {
            return;
        }
        purgeTemp(props.getMaxAgeDays());
    }

    public int purgeTemp(int olderThanDays) {
        int days = Math.max(0, olderThanDays);
        int deleted = storageService.purgeTempOlderThan(Duration.ofDays(days));
        LOGGER.info("TempCleanupService PURGE olderThanDays={} deleted={}", days, deleted);
        return deleted;
    }
}
