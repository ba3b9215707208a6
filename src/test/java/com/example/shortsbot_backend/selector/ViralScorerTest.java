package com.example.shortsbot_backend.selector;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ViralScorerTest {

    private final ViralScorer scorer = new ViralScorer();

    @Test
    void blankTextScoresZero() {
        ViralScorer.Result result = scorer.score("   ", ScoringConfig.defaults());

        assertThat(result.score()).isZero();
        assertThat(result.wordCount()).isZero();
        assertThat(result.matchedKeywords()).isEmpty();
    }

    @Test
    void questionWithInterrogativeCombinesLengthAndStructure() {
        ViralScorer.Result result = scorer.score("Pourquoi ?", ScoringConfig.defaults());

        // length 0.3, structure 0.3 ('?') + 0.2 (interrogative)
        assertThat(result.lengthComponent()).isEqualTo(0.3);
        assertThat(result.structureComponent()).isCloseTo(0.5, within(1e-9));
        assertThat(result.score()).isCloseTo(0.25 * 0.3 + 0.35 * 0.5, within(1e-9));
    }

    @Test
    void keywordDenseTextSaturatesAtOne() {
        ViralScorer.Result result = scorer.score("le secret de la richesse et de l'argent", ScoringConfig.defaults());

        assertThat(result.keywordComponent()).isGreaterThan(2.0);
        assertThat(result.score()).isEqualTo(1.0);
        assertThat(result.matchedKeywords()).contains("argent", "richesse", "secret");
    }

    @Test
    void customKeywordWeightsReplaceDefaults() {
        ScoringConfig cfg = ScoringConfig.defaults().withKeywordWeights(Map.of("rocket", 0.5));

        ViralScorer.Result result = scorer.score("rocket secret", cfg);

        assertThat(result.matchedKeywords()).containsExactly("rocket");
        assertThat(result.keywordComponent()).isEqualTo(0.5);
    }

    static Stream<String> texts() {
        return Stream.of(
                "",
                "?",
                "!!!",
                "1 2 3",
                "Pourquoi ? Comment ? Premièrement, deuxièmement, enfin !",
                "incroyable choquant fou dingue révélation secret argent richesse succès ".repeat(20),
                "mot ".repeat(500),
                "Le secret. La vérité ! Voici 3 raisons : d'abord, ensuite, enfin ?",
                "\t\n  ");
    }

    @ParameterizedTest
    @MethodSource("texts")
    void scoreStaysInUnitInterval(String text) {
        assertThat(scorer.score(text, ScoringConfig.defaults()).score()).isBetween(0.0, 1.0);
        assertThat(scorer.score(text, null).score()).isBetween(0.0, 1.0);
    }

    @ParameterizedTest
    @MethodSource("texts")
    void negativeWeightsNeverPushScoreBelowZero(String text) {
        ScoringConfig cfg = ScoringConfig.defaults().withKeywordWeights(Map.of("secret", -10.0, "mot", -10.0));

        assertThat(scorer.score(text, cfg).score()).isBetween(0.0, 1.0);
    }

    @Test
    void lengthTiersFollowWordCount() {
        assertThat(ViralScorer.lengthComponent(10)).isEqualTo(0.3);
        assertThat(ViralScorer.lengthComponent(25)).isEqualTo(0.6);
        assertThat(ViralScorer.lengthComponent(40)).isEqualTo(0.8);
        assertThat(ViralScorer.lengthComponent(100)).isEqualTo(1.0);
        assertThat(ViralScorer.lengthComponent(180)).isEqualTo(0.8);
        assertThat(ViralScorer.lengthComponent(250)).isEqualTo(0.6);
        assertThat(ViralScorer.lengthComponent(400)).isEqualTo(0.3);
    }

    @Test
    void titleKeepsFirstFiveWords() {
        assertThat(ViralScorer.title("un deux trois quatre cinq six sept")).isEqualTo("un deux trois quatre cinq...");
        assertThat(ViralScorer.title("court")).isEqualTo("court...");
    }

    @Test
    void justificationTiers() {
        assertThat(ViralScorer.justification(0.9)).startsWith("Very viral");
        assertThat(ViralScorer.justification(0.7)).startsWith("Viral segment");
        assertThat(ViralScorer.justification(0.5)).startsWith("Segment with moderate");
        assertThat(ViralScorer.justification(0.1)).startsWith("Segment with limited");
    }
}
