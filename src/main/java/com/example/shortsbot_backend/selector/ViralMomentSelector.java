package com.example.shortsbot_backend.selector;

import com.example.shortsbot_backend.dto.ViralMoment;

import java.util.List;
import java.util.Map;

/**
 * Ranks transcript windows by engagement potential.
 */
public interface ViralMomentSelector {
    /**
     * Scores every window and returns the best {@code topK}, ordered by score descending with ties
     * broken by the earliest start. An empty input yields an empty list.
     *
     * @param windows candidate windows for one video.
     * @param cfg     scoring configuration; {@code null} means defaults.
     * @return at most {@code cfg.topK()} moments.
     */
    List<ViralMoment> selectTop(List<CandidateWindow> windows, ScoringConfig cfg);

    /**
     * Returns the component breakdown for the last invocation of {@link #selectTop}.
     *
     * @return map keyed by "start-end" with component values.
     */
    Map<String, Map<String, Object>> explainLast();
}
