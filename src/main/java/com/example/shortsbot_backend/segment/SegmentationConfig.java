package com.example.shortsbot_backend.segment;

/**
 * Window bounds used when slicing a transcript.
 *
 * @param minWindowSec   windows built from timed segments are not closed before this length.
 * @param maxWindowSec   upper bound on a window's estimated or measured duration.
 * @param wordsPerSecond narration pace used to place flat-text windows on the timeline.
 * @param charsPerMinute reading pace used to cut flat text.
 */
public record SegmentationConfig(double minWindowSec,
                                 double maxWindowSec,
                                 double wordsPerSecond,
                                 double charsPerMinute) {

    public SegmentationConfig {
        if (maxWindowSec <= 0 || minWindowSec < 0 || minWindowSec > maxWindowSec) {
            throw new IllegalArgumentException("Invalid window bounds min=" + minWindowSec + " max=" + maxWindowSec);
        }
        if (wordsPerSecond <= 0 || charsPerMinute <= 0) {
            throw new IllegalArgumentException("Pace values must be positive");
        }
    }

    public static SegmentationConfig defaults() {
        return new SegmentationConfig(30, 90, 2.5, 150);
    }
}
