package com.example.shortsbot_backend.controller;

import com.example.shortsbot_backend.config.PlatformProfileRegistry;
import com.example.shortsbot_backend.dto.BatchReport;
import com.example.shortsbot_backend.dto.BuildOutcome;
import com.example.shortsbot_backend.dto.web.BatchBuildRequest;
import com.example.shortsbot_backend.dto.web.BuildShortRequest;
import com.example.shortsbot_backend.dto.web.ShortResponse;
import com.example.shortsbot_backend.service.build.ShortBuildService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/v1/shorts")
public class ShortsController {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortsController.class);

    private final ShortBuildService buildService;
    private final PlatformProfileRegistry platforms;

    public ShortsController(ShortBuildService buildService, PlatformProfileRegistry platforms) {
        this.buildService = buildService;
        this.platforms = platforms;
    }

    /** Builds one short synchronously; failures come back as a FAILED outcome, not an HTTP error. */
    @PostMapping("/build")
    public BuildOutcome build(@Valid @RequestBody BuildShortRequest request) {
        ensurePlatform(request.platform());
        LOGGER.info("ShortsController build videoId={} platform={}", request.videoId(), request.platform());
        return buildService.buildOne(request.videoId(), request.platform());
    }

    @PostMapping("/batch")
    public BatchReport batch(@Valid @RequestBody BatchBuildRequest request) {
        ensurePlatform(request.platform());
        LOGGER.info("ShortsController batch platform={} limit={}", request.platform(), request.limit());
        return buildService.buildBatch(request.platform(), request.limit());
    }

    @GetMapping
    public List<ShortResponse> list(@RequestParam(required = false) String platform) {
        if (platform != null) {
            ensurePlatform(platform);
        }
        return buildService.listShorts(platform);
    }

    @GetMapping("/platforms")
    public Set<String> platforms() {
        return platforms.keys();
    }

    private void ensurePlatform(String platform) {
        if (platforms.find(platform).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown platform: " + platform);
        }
    }
}
