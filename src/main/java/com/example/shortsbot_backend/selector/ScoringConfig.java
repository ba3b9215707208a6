package com.example.shortsbot_backend.selector;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Configuration for the {@link ViralMomentSelector}: keyword weights, structural vocabularies and
 * ranking limits.
 *
 * @param topK           maximum number of moments surfaced to the caller.
 * @param minScore       moments scoring below this value are dropped.
 * @param keywordWeights per-keyword weight in {@code [0,1]}, matched as lowercase substrings.
 * @param emotionWords   words contributing {@code 0.1} each to the structure component (capped).
 * @param interrogatives question words matched on word boundaries.
 * @param determiners    sentence openers rewarded when they start the text.
 * @param listMarkers    ordinal words or enumeration markers.
 */
public record ScoringConfig(int topK,
                            double minScore,
                            Map<String, Double> keywordWeights,
                            Set<String> emotionWords,
                            Set<String> interrogatives,
                            Set<String> determiners,
                            List<String> listMarkers) {

    public static final int DEFAULT_TOP_K = 5;

    private static final Map<String, Double> DEFAULT_KEYWORDS = Map.ofEntries(
            entry("secret", 0.9), entry("révélation", 0.95), entry("choc", 0.8), entry("incroyable", 0.7),
            entry("jamais", 0.6), entry("toujours", 0.5), entry("erreur", 0.7), entry("succès", 0.6),
            entry("échec", 0.7), entry("transformation", 0.8), entry("méthode", 0.6), entry("technique", 0.5),
            entry("astuce", 0.7), entry("conseil", 0.6), entry("truc", 0.5), entry("hack", 0.8),
            entry("lifehack", 0.9), entry("productivité", 0.6), entry("argent", 0.9), entry("richesse", 0.9),
            entry("bonheur", 0.7), entry("amour", 0.6), entry("relation", 0.5), entry("découverte", 0.8),
            entry("révolutionnaire", 0.9), entry("innovant", 0.7), entry("exclusif", 0.8), entry("unique", 0.7),
            entry("spécial", 0.6), entry("rare", 0.7), entry("puissant", 0.8), entry("efficace", 0.7),
            entry("rapide", 0.6), entry("facile", 0.6), entry("gratuit", 0.8), entry("gratuitement", 0.8),
            entry("économiser", 0.7), entry("gagner", 0.8), entry("perdre", 0.7), entry("changer", 0.6),
            entry("améliorer", 0.7), entry("développer", 0.6), entry("créer", 0.6), entry("construire", 0.5),
            entry("réaliser", 0.6), entry("accomplir", 0.7), entry("atteindre", 0.6), entry("obtenir", 0.6),
            entry("acquérir", 0.6), entry("maîtriser", 0.7), entry("dominer", 0.8), entry("conquérir", 0.8),
            entry("surmonter", 0.7), entry("résoudre", 0.7), entry("trouver", 0.5), entry("découvrir", 0.7),
            entry("apprendre", 0.6), entry("comprendre", 0.5), entry("savoir", 0.5), entry("connaître", 0.5),
            entry("expérimenter", 0.6), entry("tester", 0.5), entry("essayer", 0.5), entry("proposer", 0.5),
            entry("suggérer", 0.5), entry("recommander", 0.6), entry("conseiller", 0.6), entry("guider", 0.5),
            entry("aider", 0.5), entry("soutenir", 0.5), entry("encourager", 0.6), entry("motiver", 0.7),
            entry("inspirer", 0.7), entry("influencer", 0.7), entry("impacter", 0.7), entry("transformer", 0.8),
            entry("révolutionner", 0.9), entry("innover", 0.8), entry("inventer", 0.8)
    );

    private static final Set<String> DEFAULT_EMOTIONS = Set.of(
            "amour", "haine", "joie", "tristesse", "colère", "peur", "surprise", "dégoût");
    private static final Set<String> DEFAULT_INTERROGATIVES = Set.of(
            "pourquoi", "comment", "quand", "où", "qui", "quoi");
    private static final Set<String> DEFAULT_DETERMINERS = Set.of(
            "le", "la", "les", "un", "une", "ce", "cette");
    private static final List<String> DEFAULT_LIST_MARKERS = List.of(
            "première", "deuxième", "troisième", "1.", "2.", "3.");

    public ScoringConfig {
        topK = Math.max(1, topK);
        keywordWeights = keywordWeights == null ? Map.of() : Map.copyOf(keywordWeights);
        emotionWords = emotionWords == null ? Set.of() : Set.copyOf(emotionWords);
        interrogatives = interrogatives == null ? Set.of() : Set.copyOf(interrogatives);
        determiners = determiners == null ? Set.of() : Set.copyOf(determiners);
        listMarkers = listMarkers == null ? List.of() : List.copyOf(listMarkers);
    }

    /**
     * Provides the default French-language vocabulary tuned for motivational narration.
     *
     * @return configuration with the built-in keyword table, top-5 and no score floor.
     */
    public static ScoringConfig defaults() {
        return new ScoringConfig(DEFAULT_TOP_K, 0.0, DEFAULT_KEYWORDS, DEFAULT_EMOTIONS,
                DEFAULT_INTERROGATIVES, DEFAULT_DETERMINERS, DEFAULT_LIST_MARKERS);
    }

    public ScoringConfig withTopK(int k) {
        return new ScoringConfig(k, minScore, keywordWeights, emotionWords, interrogatives, determiners, listMarkers);
    }

    public ScoringConfig withKeywordWeights(Map<String, Double> weights) {
        return new ScoringConfig(topK, minScore, weights, emotionWords, interrogatives, determiners, listMarkers);
    }

    public ScoringConfig withMinScore(double floor) {
        return new ScoringConfig(topK, floor, keywordWeights, emotionWords, interrogatives, determiners, listMarkers);
    }
}
