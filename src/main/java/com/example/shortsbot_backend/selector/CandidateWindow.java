package com.example.shortsbot_backend.selector;

/**
 * Transcript slice produced by the segmenter.
 *
 * @param startSec start offset in seconds (inclusive).
 * @param endSec   end offset in seconds (exclusive).
 * @param text     joined text of the slice.
 */
public record CandidateWindow(double startSec, double endSec, String text) {

    public double durationSec() {
        return endSec - startSec;
    }

    public int wordCount() {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
