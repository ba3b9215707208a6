package com.example.shortsbot_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

public record RegisterVideoRequest(
        @NotBlank String videoId,
        String title,
        String theme,
        @NotBlank String videoPath,
        String audioPath
) {}
