package com.example.shortsbot_backend.timeline;

/**
 * One timed caption line.
 *
 * @param index 1-based position in the track.
 * @param start start in seconds.
 * @param end   end in seconds; never before {@code start}.
 * @param text  caption text.
 * @param role  act of the three-act timeline this cue belongs to.
 */
public record CaptionCue(int index, double start, double end, String text, CaptionRole role) {

    public double duration() {
        return end - start;
    }
}
