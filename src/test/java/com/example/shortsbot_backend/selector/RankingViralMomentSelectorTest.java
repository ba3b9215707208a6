package com.example.shortsbot_backend.selector;

import com.example.shortsbot_backend.dto.ViralMoment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RankingViralMomentSelectorTest {

    private final RankingViralMomentSelector selector = new RankingViralMomentSelector(new ViralScorer());

    @Test
    void emptyInputYieldsNoMoments() {
        assertThat(selector.selectTop(List.of(), ScoringConfig.defaults())).isEmpty();
        assertThat(selector.selectTop(null, ScoringConfig.defaults())).isEmpty();
    }

    @Test
    void ranksByScoreThenEarliestStart() {
        List<CandidateWindow> windows = List.of(
                new CandidateWindow(60, 120, "rien de spécial ici"),
                new CandidateWindow(30, 90, "le secret de l'argent"),
                new CandidateWindow(0, 60, "le secret de l'argent"));

        List<ViralMoment> moments = selector.selectTop(windows, ScoringConfig.defaults());

        assertThat(moments).hasSize(3);
        assertThat(moments.get(0).startTime()).isEqualTo(0.0);
        assertThat(moments.get(1).startTime()).isEqualTo(30.0);
        assertThat(moments.get(0).score()).isGreaterThanOrEqualTo(moments.get(2).score());
        assertThat(moments.get(0).title()).isEqualTo("le secret de l'argent...");
    }

    @Test
    void truncatesToTopKAndDropsBelowFloor() {
        List<CandidateWindow> windows = List.of(
                new CandidateWindow(0, 60, "le secret de l'argent"),
                new CandidateWindow(60, 120, "texte neutre"),
                new CandidateWindow(120, 180, "gagner la révélation"));

        List<ViralMoment> top1 = selector.selectTop(windows, ScoringConfig.defaults().withTopK(1));
        List<ViralMoment> floored = selector.selectTop(windows, ScoringConfig.defaults().withMinScore(0.5));

        assertThat(top1).hasSize(1);
        assertThat(floored).extracting(ViralMoment::text).doesNotContain("texte neutre");
        assertThat(selector.explainLast()).hasSize(3);
    }

    @Test
    void skipsBlankWindows() {
        List<ViralMoment> moments = selector.selectTop(
                List.of(new CandidateWindow(0, 10, " "), new CandidateWindow(10, 20, "astuce")),
                ScoringConfig.defaults());

        assertThat(moments).extracting(ViralMoment::text).containsExactly("astuce");
    }
}
