package com.example.shortsbot_backend.timing;

import com.example.shortsbot_backend.dto.PlatformProfile;
import com.example.shortsbot_backend.dto.ViralMoment;
import com.example.shortsbot_backend.exception.DurationConstraintException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurationNormalizerTest {

    private final DurationNormalizer normalizer = new DurationNormalizer();
    private final PlatformProfile profile = new PlatformProfile("tiktok", "9:16", 1080, 1920, 70, 90,
            null, Set.of(), List.of(), "platforms/tiktok");

    @Test
    void shortSourceIsExtendedBeforeTrimming() {
        NormalizedWindow w = normalizer.normalize(moment(5, 35), 40, profile);

        assertThat(w.extended()).isTrue();
        assertThat(w.loopCount()).isEqualTo(2);
        assertThat(w.start()).isZero();
        assertThat(w.duration()).isBetween(70.0, 90.0);
        assertThat(w.sourceDuration()).isEqualTo(w.duration());
    }

    @Test
    void sourceBetweenMinAndCandidatePlaysOnceWithoutLooping() {
        NormalizedWindow w = normalizer.normalize(0, 85, 75, 70, 90);

        assertThat(w.extended()).isFalse();
        assertThat(w.loopCount()).isEqualTo(1);
        assertThat(w.start()).isZero();
        assertThat(w.duration()).isEqualTo(75.0);
        assertThat(w.end()).isLessThanOrEqualTo(75.0);
        assertThat(w.sourceDuration()).isEqualTo(75.0);
    }

    @Test
    void lateCandidateInShortSourceStartsAtZero() {
        NormalizedWindow w = normalizer.normalize(moment(40, 120), 80, profile);

        assertThat(w.extended()).isFalse();
        assertThat(w.start()).isZero();
        assertThat(w.duration()).isEqualTo(80.0);
    }

    @Test
    void overflowingCandidateIsShiftedInsideSource() {
        NormalizedWindow w = normalizer.normalize(moment(280, 310), 300, profile);

        assertThat(w.extended()).isFalse();
        assertThat(w.duration()).isEqualTo(70.0);
        assertThat(w.end()).isLessThanOrEqualTo(300.0);
        assertThat(w.start()).isEqualTo(230.0);
    }

    @Test
    void longCandidateIsClampedToMaximum() {
        NormalizedWindow w = normalizer.normalize(moment(10, 200), 600, profile);

        assertThat(w.start()).isEqualTo(10.0);
        assertThat(w.duration()).isEqualTo(90.0);
    }

    @Test
    void normalizingTwiceIsStable() {
        NormalizedWindow first = normalizer.normalize(moment(280, 310), 300, profile);
        NormalizedWindow second = normalizer.normalize(first.start(), first.duration(), 300, 70, 90);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void rejectsSourceWithoutDuration() {
        assertThatThrownBy(() -> normalizer.normalize(moment(0, 80), 0, profile))
                .isInstanceOf(DurationConstraintException.class);
    }

    @Test
    void loopCountCoversTarget() {
        assertThat(DurationNormalizer.loopsFor(40, 70)).isEqualTo(2);
        assertThat(DurationNormalizer.loopsFor(20, 70)).isEqualTo(4);
        assertThatThrownBy(() -> DurationNormalizer.loopsFor(0, 70)).isInstanceOf(DurationConstraintException.class);
    }

    private static ViralMoment moment(double start, double end) {
        return new ViralMoment("t", start, end, "text", 0.5, "j");
    }
}
