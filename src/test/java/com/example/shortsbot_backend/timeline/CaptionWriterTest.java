package com.example.shortsbot_backend.timeline;

import com.example.shortsbot_backend.dto.PlatformProfile;
import com.example.shortsbot_backend.util.CaptionFormat;
import com.example.shortsbot_backend.util.Effect;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CaptionWriterTest {

    @TempDir
    Path tmp;

    private final CaptionWriter writer = new CaptionWriter();
    private final CaptionTimeline timeline = new CaptionTimeline(List.of(
            new CaptionCue(1, 0.0, 5.0, "ATTENTION", CaptionRole.HOOK),
            new CaptionCue(2, 5.0, 62.25, "Une phrase assez longue pour passer sur deux lignes a l'ecran", CaptionRole.CONTENT),
            new CaptionCue(3, 62.25, 80.0, "Abonne-toi", CaptionRole.CTA)), 80.0);

    @Test
    void srtIsNumberedWithCommaMillis() {
        String srt = writer.render(timeline, CaptionFormat.SRT, profile(Set.of()));

        assertThat(srt).startsWith("1\n00:00:00,000 --> 00:00:05,000\nATTENTION\n\n");
        assertThat(srt).contains("00:00:05,000 --> 00:01:02,250");
    }

    @Test
    void vttHasHeaderAndDotMillis() {
        String vtt = writer.render(timeline, CaptionFormat.VTT, profile(Set.of()));

        assertThat(vtt).startsWith("WEBVTT\nKind: captions\n\n");
        assertThat(vtt).contains("00:01:02.250 --> 00:01:20.000");
    }

    @Test
    void assUsesRoleStylesAndCanvas() {
        String ass = writer.render(timeline, CaptionFormat.ASS, profile(Set.of(Effect.TEXT_ANIMATIONS)));

        assertThat(ass).contains("PlayResX: 1080").contains("PlayResY: 1920");
        assertThat(ass).contains("Style: Hook,Arial,34,&H0000FFFF");
        assertThat(ass).contains("Dialogue: 0,0:00:00.00,0:00:05.00,Hook,,0,0,0,,{\\fad(200,200)}ATTENTION");
        assertThat(ass).contains(",CTA,,0,0,0,,{\\fad(200,200)}Abonne-toi");
        assertThat(ass).contains("\\N");
    }

    @Test
    void assWithoutAnimationHasNoFadeTag() {
        String ass = writer.render(timeline, CaptionFormat.ASS, profile(Set.of()));

        assertThat(ass).doesNotContain("\\fad");
    }

    @Test
    void writeCreatesFile() throws Exception {
        Path target = tmp.resolve("sub/captions.srt");

        writer.write(timeline, CaptionFormat.SRT, profile(Set.of()), target);

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).contains("Abonne-toi");
    }

    @Test
    void cueTextWrapsToTwoBalancedLines() {
        String wrapped = CaptionWriter.formatCueText("Une phrase assez longue pour passer sur deux lignes a l'ecran");

        String[] lines = wrapped.split("\n");
        assertThat(lines).hasSize(2);
        assertThat(lines).allSatisfy(l -> assertThat(l.length()).isLessThanOrEqualTo(CaptionWriter.MAX_LINE_CHARS));
        assertThat(CaptionWriter.formatCueText("  court   texte ")).isEqualTo("court texte");
    }

    private static PlatformProfile profile(Set<Effect> effects) {
        return new PlatformProfile("tiktok", "9:16", 1080, 1920, 70, 90, null, effects, List.of(), "platforms/tiktok");
    }
}
