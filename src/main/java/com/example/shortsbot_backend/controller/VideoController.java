package com.example.shortsbot_backend.controller;

import com.example.shortsbot_backend.dto.web.RegisterVideoRequest;
import com.example.shortsbot_backend.dto.web.SourceVideoResponse;
import com.example.shortsbot_backend.service.SourceVideoService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/v1/videos")
public class VideoController {
    private final SourceVideoService videoService;

    public VideoController(SourceVideoService videoService) {
        this.videoService = videoService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SourceVideoResponse register(@Valid @RequestBody RegisterVideoRequest request) {
        return SourceVideoResponse.from(videoService.register(request));
    }

    @GetMapping("/{videoId}")
    public SourceVideoResponse get(@PathVariable String videoId) {
        return videoService.find(videoId)
                .map(SourceVideoResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Video not found: " + videoId));
    }
}
