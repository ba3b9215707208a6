package com.example.shortsbot_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FwVerboseResponse(
        String language,
        Double duration,
        String text,
        List<Seg> segments
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Seg(Double start, Double end, String text) {}
}
