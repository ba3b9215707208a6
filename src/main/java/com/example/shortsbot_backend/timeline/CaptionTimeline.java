package com.example.shortsbot_backend.timeline;

import java.util.List;

/**
 * Ordered, non-overlapping cue track covering {@code [0, totalDuration]}.
 */
public record CaptionTimeline(List<CaptionCue> cues, double totalDuration) {
    public CaptionTimeline {
        cues = cues == null ? List.of() : List.copyOf(cues);
    }

    public List<CaptionCue> byRole(CaptionRole role) {
        return cues.stream().filter(c -> c.role() == role).toList();
    }

    public boolean isEmpty() {
        return cues.isEmpty();
    }
}
