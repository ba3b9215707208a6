package com.example.shortsbot_backend.dto.web;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record BatchBuildRequest(@NotBlank String platform, @Min(1) @Max(50) int limit) {}
