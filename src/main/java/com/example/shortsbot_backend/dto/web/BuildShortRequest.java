package com.example.shortsbot_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

public record BuildShortRequest(@NotBlank String videoId, @NotBlank String platform) {}
