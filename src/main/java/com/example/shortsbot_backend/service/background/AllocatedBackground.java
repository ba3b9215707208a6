package com.example.shortsbot_backend.service.background;

import java.nio.file.Path;
import java.util.List;

/**
 * Background footage chosen for one short.
 *
 * @param theme         theme the clips were taken from (may be the default theme after fallback).
 * @param clips         files in playback order.
 * @param totalDuration summed nominal duration of {@code clips}.
 * @param looped        {@code true} when the clips must be repeated to cover the short.
 */
public record AllocatedBackground(String theme, List<Path> clips, double totalDuration, boolean looped) {
    public AllocatedBackground {
        clips = List.copyOf(clips);
    }

    /**
     * Playback list long enough to cover {@code needed} seconds, repeating the clips in order.
     */
    public List<Path> playlistFor(double needed) {
        if (!looped || totalDuration <= 0) {
            return clips;
        }
        int rounds = (int) Math.ceil(needed / totalDuration);
        List<Path> out = new java.util.ArrayList<>(clips.size() * rounds);
        for (int i = 0; i < rounds; i++) {
            out.addAll(clips);
        }
        return out;
    }
}
