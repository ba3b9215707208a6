package com.example.shortsbot_backend.timing;

/**
 * Final timing of a short inside its (possibly extended) source.
 *
 * @param start          offset in seconds into the source.
 * @param duration       length in seconds, inside the platform bounds.
 * @param sourceDuration source length after extension; equals the probed length when not extended.
 * @param extended       whether the source must be looped before trimming.
 * @param loopCount      number of times the source is repeated when extended, otherwise {@code 1}.
 */
public record NormalizedWindow(double start,
                               double duration,
                               double sourceDuration,
                               boolean extended,
                               int loopCount) {

    public double end() {
        return start + duration;
    }
}
