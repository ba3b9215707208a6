package com.example.shortsbot_backend.dto;

import java.util.List;

/**
 * Result of the speech-to-text collaborator.
 *
 * @param text            full transcript text.
 * @param segments        timed segments ordered by start; may be empty.
 * @param durationSeconds audio duration in seconds, {@code 0} when unknown.
 */
public record Transcription(String text, List<TranscriptSegment> segments, double durationSeconds) {
    public Transcription {
        text = text == null ? "" : text;
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public boolean isBlank() {
        return text.isBlank() && segments.stream().allMatch(s -> s.text().isBlank());
    }
}
