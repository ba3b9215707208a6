package com.example.shortsbot_backend.config;

import com.example.shortsbot_backend.segment.SegmentationConfig;
import com.example.shortsbot_backend.selector.ScoringConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moment selection tuning. An empty keyword map keeps the built-in vocabulary.
 */
@ConfigurationProperties(prefix = "shorts.scoring")
public class ScoringProperties {
    private int topK = ScoringConfig.DEFAULT_TOP_K;
    private double minScore = 0.0;
    private double wordsPerSecond = 2.5;
    private double charsPerMinute = 150;
    private double minWindowSeconds = 30;
    private double maxWindowSeconds = 90;
    private Map<String, Double> keywordWeights = new LinkedHashMap<>();

    public ScoringConfig toScoringConfig() {
        ScoringConfig cfg = ScoringConfig.defaults().withTopK(topK).withMinScore(minScore);
        return keywordWeights.isEmpty() ? cfg : cfg.withKeywordWeights(keywordWeights);
    }

    public SegmentationConfig toSegmentationConfig() {
        return new SegmentationConfig(minWindowSeconds, maxWindowSeconds, wordsPerSecond, charsPerMinute);
    }

    public int getTopK() { return topK; }
    public void setTopK(int topK) { this.topK = topK; }

    public double getMinScore() { return minScore; }
    public void setMinScore(double minScore) { this.minScore = minScore; }

    public double getWordsPerSecond() { return wordsPerSecond; }
    public void setWordsPerSecond(double wordsPerSecond) { this.wordsPerSecond = wordsPerSecond; }

    public double getCharsPerMinute() { return charsPerMinute; }
    public void setCharsPerMinute(double charsPerMinute) { this.charsPerMinute = charsPerMinute; }

    public double getMinWindowSeconds() { return minWindowSeconds; }
    public void setMinWindowSeconds(double minWindowSeconds) { this.minWindowSeconds = minWindowSeconds; }

    public double getMaxWindowSeconds() { return maxWindowSeconds; }
    public void setMaxWindowSeconds(double maxWindowSeconds) { this.maxWindowSeconds = maxWindowSeconds; }

    public Map<String, Double> getKeywordWeights() { return keywordWeights; }
    public void setKeywordWeights(Map<String, Double> keywordWeights) { this.keywordWeights = keywordWeights; }
}
