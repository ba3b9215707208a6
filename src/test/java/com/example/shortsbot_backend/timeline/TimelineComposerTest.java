package com.example.shortsbot_backend.timeline;

import com.example.shortsbot_backend.dto.PlatformProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimelineComposerTest {

    private final TimelineComposer composer = new TimelineComposer();
    private final PlatformProfile profile = new PlatformProfile("tiktok", "9:16", 1080, 1920, 70, 90, null,
            Set.of(), List.of("A", "B", "C"), "platforms/tiktok");

    private static final String TEXT = "Voici le premier point important. Ensuite vient le second point ! "
            + "Et enfin une question pour vous ?";

    @Test
    void producesHookContentThenCtaWithoutGaps() {
        CaptionTimeline t = composer.compose(TEXT, profile, 80.0, 0, TimelineConfig.defaults());

        List<CaptionCue> cues = t.cues();
        assertThat(cues.get(0).role()).isEqualTo(CaptionRole.HOOK);
        assertThat(cues.get(0).start()).isZero();
        assertThat(cues.get(0).end()).isEqualTo(5.0);
        assertThat(cues.get(cues.size() - 1).role()).isEqualTo(CaptionRole.CTA);
        assertThat(t.totalDuration()).isEqualTo(80.0);
        assertThat(cues.get(cues.size() - 1).end()).isCloseTo(80.0, within(1e-9));
        for (int i = 1; i < cues.size(); i++) {
            assertThat(cues.get(i).start()).isCloseTo(cues.get(i - 1).end(), within(1e-9));
            assertThat(cues.get(i).index()).isEqualTo(i + 1);
        }
        assertThat(t.byRole(CaptionRole.CONTENT)).hasSize(3);
    }

    static Stream<Arguments> durationsAndTexts() {
        List<String> texts = List.of(
                "",
                "Court.",
                TEXT,
                "Une phrase sans ponctuation finale qui continue encore et encore pendant très longtemps pour dépasser la limite de ligne",
                "A! B? C. D! E? F. G! H? I. J! K? L. M! N? O.");
        double[] durations = {0.5, 3.0, 5.0, 12.5, 30.0, 36.0, 45.0, 70.0, 80.0, 90.0, 120.0, 600.0};
        return texts.stream().flatMap(text -> Arrays.stream(durations).mapToObj(d -> Arguments.of(text, d)));
    }

    @ParameterizedTest
    @MethodSource("durationsAndTexts")
    void cuesNeverOverlapAndStayInsideTheShort(String text, double duration) {
        for (int seed = 0; seed < 3; seed++) {
            CaptionTimeline t = composer.compose(text, profile, duration, seed, TimelineConfig.defaults());

            List<CaptionCue> cues = t.cues();
            for (int i = 0; i < cues.size(); i++) {
                CaptionCue cue = cues.get(i);
                assertThat(cue.start()).isGreaterThanOrEqualTo(0.0);
                assertThat(cue.end()).isGreaterThan(cue.start());
                assertThat(cue.end()).isLessThanOrEqualTo(Math.min(duration, profile.maxDuration()) + 1e-9);
                if (i + 1 < cues.size()) {
                    assertThat(cue.end()).isLessThanOrEqualTo(cues.get(i + 1).start() + 1e-9);
                }
            }
        }
    }

    @Test
    void ctaStartsNoLaterThanLatestStart() {
        CaptionTimeline t = composer.compose(TEXT, profile, 80.0, 0, TimelineConfig.defaults());

        // budget min(40, 35) puts the start at 45, the latest-start rule pulls it to 35
        assertThat(t.byRole(CaptionRole.CTA).get(0).start()).isEqualTo(35.0);
    }

    @Test
    void ctaIsShrunkToFitPlatformMaximum() {
        PlatformProfile seventy = new PlatformProfile("x", "9:16", 1080, 1920, 60, 70, null,
                Set.of(), List.of("A", "B"), "platforms/x");
        TimelineConfig cfg = TimelineConfig.defaults().withCtaMaxSeconds(40);

        CaptionTimeline t = composer.compose(TEXT, seventy, 100.0, 0, cfg);

        List<CaptionCue> cta = t.byRole(CaptionRole.CTA);
        assertThat(t.totalDuration()).isEqualTo(70.0);
        assertThat(cta).hasSize(2);
        assertThat(cta.get(cta.size() - 1).end()).isLessThanOrEqualTo(70.0);
        assertThat(cta).allSatisfy(c -> assertThat(c.duration()).isGreaterThan(0.0));
        assertThat(t.cues()).allSatisfy(c -> assertThat(c.end()).isLessThanOrEqualTo(70.0 + 1e-9));
    }

    @Test
    void rotationSeedShiftsPromptOrder() {
        List<String> first = texts(composer.compose(TEXT, profile, 80.0, 0, null).byRole(CaptionRole.CTA));
        List<String> second = texts(composer.compose(TEXT, profile, 80.0, 1, null).byRole(CaptionRole.CTA));

        assertThat(first).containsExactly("A", "B", "C");
        assertThat(second).containsExactly("B", "C", "A");
    }

    @Test
    void emptyTextStillGetsHookAndCta() {
        CaptionTimeline t = composer.compose("", profile, 20.0, 0, TimelineConfig.defaults());

        assertThat(t.byRole(CaptionRole.CONTENT)).isEmpty();
        assertThat(t.byRole(CaptionRole.HOOK)).hasSize(1);
        assertThat(t.byRole(CaptionRole.CTA).get(0).start()).isEqualTo(5.0);
    }

    @Test
    void zeroDurationYieldsEmptyTimeline() {
        assertThat(composer.compose("", profile, null, 0, null).isEmpty()).isTrue();
    }

    @Test
    void longSentenceIsSplitInTwo() {
        String[] halves = TimelineComposer.splitAtMidpoint("un deux trois quatre cinq six", 10);

        assertThat(halves).containsExactly("un deux trois", "quatre cinq six");
        assertThat(TimelineComposer.splitAtMidpoint("court", 10)).isNull();
    }

    @Test
    void estimatesDurationFromWordCountWhenAudioUnknown() {
        assertThat(TimelineComposer.estimateSeconds("a b c d e", 2.5)).isEqualTo(2.0);
    }

    @Test
    void fallbackPromptUsedWhenNoneConfigured() {
        assertThat(TimelineComposer.prompts(List.of(), 3, "Like")).containsExactly("Like");
    }

    private static List<String> texts(List<CaptionCue> cues) {
        return cues.stream().map(CaptionCue::text).toList();
    }
}
