package com.example.shortsbot_backend.dto.web;

import jakarta.validation.constraints.PositiveOrZero;

public record PerformanceUpdateRequest(@PositiveOrZero long views,
                                       @PositiveOrZero long likes,
                                       @PositiveOrZero long shares,
                                       @PositiveOrZero long comments) {}
