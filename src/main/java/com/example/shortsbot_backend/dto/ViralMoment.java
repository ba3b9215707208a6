package com.example.shortsbot_backend.dto;

/**
 * Scored candidate sub-segment of a transcript. {@code endTime - startTime} is the candidate
 * duration before normalization and may violate platform bounds.
 */
public record ViralMoment(String title,
                          double startTime,
                          double endTime,
                          String text,
                          double score,
                          String justification) {

    public double candidateDuration() {
        return Math.max(0.0, endTime - startTime);
    }
}
