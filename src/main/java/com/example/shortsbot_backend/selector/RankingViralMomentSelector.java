package com.example.shortsbot_backend.selector;

import com.example.shortsbot_backend.dto.ViralMoment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Default selector backed by {@link ViralScorer}.
 */
@Component
public class RankingViralMomentSelector implements ViralMomentSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(RankingViralMomentSelector.class);

    private static final Comparator<ViralMoment> RANKING = Comparator
            .comparingDouble(ViralMoment::score).reversed()
            .thenComparingDouble(ViralMoment::startTime);

    private final ViralScorer scorer;
    private volatile Map<String, Map<String, Object>> lastExplanation = Map.of();

    public RankingViralMomentSelector(ViralScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    public List<ViralMoment> selectTop(List<CandidateWindow> windows, ScoringConfig cfg) {
        ScoringConfig effective = cfg == null ? ScoringConfig.defaults() : cfg;
        if (windows == null || windows.isEmpty()) {
            lastExplanation = Map.of();
            return List.of();
        }
        List<ViralMoment> moments = new ArrayList<>();
        Map<String, Map<String, Object>> explanations = new LinkedHashMap<>();

        for (CandidateWindow window : windows) {
            if (window == null || window.text() == null || window.text().isBlank()) {
                continue;
            }
            ViralScorer.Result result = scorer.score(window.text(), effective);
            explanations.put(keyFor(window), result.toMeta());
            if (result.score() < effective.minScore()) {
                LOGGER.trace("selector skip start={} end={} score={} below min={}",
                        window.startSec(), window.endSec(), result.score(), effective.minScore());
                continue;
            }
            moments.add(new ViralMoment(
                    ViralScorer.title(window.text()),
                    window.startSec(),
                    window.endSec(),
                    window.text(),
                    result.score(),
                    ViralScorer.justification(result.score())));
        }

        moments.sort(RANKING);
        if (moments.size() > effective.topK()) {
            moments = new ArrayList<>(moments.subList(0, effective.topK()));
        }
        lastExplanation = explanations;
        LOGGER.debug("RankingViralMomentSelector windows={} selected={} topScore={}",
                windows.size(), moments.size(),
                moments.isEmpty() ? "-" : String.format(Locale.ROOT, "%.3f", moments.get(0).score()));
        return List.copyOf(moments);
    }

    @Override
    public Map<String, Map<String, Object>> explainLast() {
        return lastExplanation;
    }

    private static String keyFor(CandidateWindow window) {
        return String.format(Locale.ROOT, "%.2f-%.2f", window.startSec(), window.endSec());
    }
}
