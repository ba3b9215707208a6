package com.example.shortsbot_backend.controller;

import com.example.shortsbot_backend.dto.web.BackgroundStatsResponse;
import com.example.shortsbot_backend.model.BackgroundClip;
import com.example.shortsbot_backend.service.TempCleanupService;
import com.example.shortsbot_backend.service.background.BackgroundLibraryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/backgrounds")
public class BackgroundController {
    private static final Logger LOGGER = LoggerFactory.getLogger(BackgroundController.class);

    private final BackgroundLibraryService libraryService;
    private final TempCleanupService cleanupService;

    public BackgroundController(BackgroundLibraryService libraryService, TempCleanupService cleanupService) {
        this.libraryService = libraryService;
        this.cleanupService = cleanupService;
    }

    @GetMapping("/stats")
    public BackgroundStatsResponse stats() {
        return libraryService.stats();
    }

    /** Downloads up to {@code count} new clips per configured stock source for a theme. */
    @PostMapping("/{theme}/acquire")
    public Map<String, Object> acquire(@PathVariable String theme,
                                       @RequestParam(defaultValue = "2") int count) {
        List<BackgroundClip> added = libraryService.acquire(theme, Math.max(1, Math.min(count, 10)));
        LOGGER.info("BackgroundController acquire theme={} added={}", theme, added.size());
        return Map.of("theme", theme, "added", added.size(),
                "filenames", added.stream().map(BackgroundClip::getFilename).toList());
    }

    @PostMapping("/cleanup")
    public Map<String, Object> cleanup(@RequestParam(defaultValue = "7") int olderThanDays) {
        int deleted = cleanupService.purgeTemp(olderThanDays);
        return Map.of("deleted", deleted, "olderThanDays", olderThanDays);
    }
}
