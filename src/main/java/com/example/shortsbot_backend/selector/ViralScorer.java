package com.example.shortsbot_backend.selector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Engagement heuristic for a block of narration text.
 * <p>
 * {@code score = 0.4*keyword + 0.25*length + 0.35*structure}, clamped to {@code [0,1]}. The keyword
 * component is the raw sum of matched weights; neither it nor the structure component is clamped
 * before weighting, so keyword-dense text saturates at {@code 1.0}.
 */
@Component
public class ViralScorer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ViralScorer.class);

    static final double KEYWORD_WEIGHT = 0.4;
    static final double LENGTH_WEIGHT = 0.25;
    static final double STRUCTURE_WEIGHT = 0.35;

    private static final double EMOTION_STEP = 0.1;
    private static final double EMOTION_CAP = 0.3;
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    public record Result(double score,
                         double keywordComponent,
                         double lengthComponent,
                         double structureComponent,
                         int wordCount,
                         List<String> matchedKeywords) {
        public Map<String, Object> toMeta() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("score", score);
            m.put("keyword", keywordComponent);
            m.put("length", lengthComponent);
            m.put("structure", structureComponent);
            m.put("words", wordCount);
            m.put("matchedKeywords", matchedKeywords);
            return m;
        }
    }

    public Result score(String text, ScoringConfig cfg) {
        ScoringConfig effective = cfg == null ? ScoringConfig.defaults() : cfg;
        if (text == null || text.isBlank()) {
            return new Result(0.0, 0.0, 0.0, 0.0, 0, List.of());
        }
        String lower = text.toLowerCase(Locale.ROOT);

        List<String> matched = new ArrayList<>();
        double keyword = 0.0;
        for (Map.Entry<String, Double> e : effective.keywordWeights().entrySet()) {
            if (lower.contains(e.getKey().toLowerCase(Locale.ROOT))) {
                keyword += e.getValue();
                matched.add(e.getKey());
            }
        }

        int words = text.trim().split("\\s+").length;
        double length = lengthComponent(words);
        double structure = structureComponent(text, lower, effective);

        double raw = KEYWORD_WEIGHT * keyword + LENGTH_WEIGHT * length + STRUCTURE_WEIGHT * structure;
        double score = Math.max(0.0, Math.min(1.0, raw));
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("ViralScorer words={} keyword={} length={} structure={} raw={} score={}",
                    words, fmt(keyword), fmt(length), fmt(structure), fmt(raw), fmt(score));
        }
        matched.sort(String::compareTo);
        return new Result(score, keyword, length, structure, words, List.copyOf(matched));
    }

    static double lengthComponent(int words) {
        if (words >= 50 && words <= 150) {
            return 1.0;
        }
        if (words >= 30 && words <= 200) {
            return 0.8;
        }
        if (words >= 20 && words <= 300) {
            return 0.6;
        }
        return 0.3;
    }

    private static double structureComponent(String text, String lower, ScoringConfig cfg) {
        Set<String> tokens = tokens(lower);
        double s = 0.0;
        if (text.indexOf('?') >= 0) {
            s += 0.3;
        }
        if (text.indexOf('!') >= 0) {
            s += 0.2;
        }
        if (startsWithDeterminer(lower, cfg.determiners())) {
            s += 0.1;
        }
        if (cfg.interrogatives().stream().anyMatch(tokens::contains)) {
            s += 0.2;
        }
        double emotion = cfg.emotionWords().stream().filter(lower::contains).count() * EMOTION_STEP;
        s += Math.min(emotion, EMOTION_CAP);
        if (DIGIT.matcher(text).find()) {
            s += 0.1;
        }
        if (cfg.listMarkers().stream().anyMatch(marker -> marker.endsWith(".") ? lower.contains(marker) : tokens.contains(marker))) {
            s += 0.2;
        }
        return s;
    }

    private static boolean startsWithDeterminer(String lower, Set<String> determiners) {
        String trimmed = lower.stripLeading();
        if (trimmed.isEmpty()) {
            return false;
        }
        String first = NON_WORD.split(trimmed, 2)[0];
        return determiners.contains(first);
    }

    private static Set<String> tokens(String lower) {
        return Arrays.stream(NON_WORD.split(lower))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * Human-readable tier for a score.
     */
    public static String justification(double score) {
        if (score > 0.8) {
            return "Very viral segment: strong keywords and optimal structure";
        }
        if (score > 0.6) {
            return "Viral segment with good engagement potential";
        }
        if (score > 0.4) {
            return "Segment with moderate viral potential";
        }
        return "Segment with limited viral potential";
    }

    /**
     * Fallback title: first five words followed by an ellipsis.
     */
    public static String title(String text) {
        if (text == null || text.isBlank()) {
            return "...";
        }
        String[] words = text.trim().split("\\s+");
        return String.join(" ", Arrays.copyOf(words, Math.min(5, words.length))) + "...";
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
