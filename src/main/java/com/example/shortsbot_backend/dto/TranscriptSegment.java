package com.example.shortsbot_backend.dto;

/**
 * One timed line of a transcription.
 *
 * @param start start offset in seconds.
 * @param end   end offset in seconds, strictly after {@code start}.
 * @param text  spoken text.
 */
public record TranscriptSegment(double start, double end, String text) {
    public TranscriptSegment {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid segment range start=" + start + " end=" + end);
        }
        text = text == null ? "" : text;
    }

    public double duration() {
        return end - start;
    }
}
