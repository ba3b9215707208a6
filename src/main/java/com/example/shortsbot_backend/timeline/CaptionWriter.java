package com.example.shortsbot_backend.timeline;

import com.example.shortsbot_backend.dto.CaptionStyle;
import com.example.shortsbot_backend.dto.PlatformProfile;
import com.example.shortsbot_backend.exception.StorageException;
import com.example.shortsbot_backend.ffmpeg.AssStyleUtil;
import com.example.shortsbot_backend.util.CaptionFormat;
import com.example.shortsbot_backend.util.Effect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serialises a {@link CaptionTimeline} into SubRip, WebVTT or Advanced SubStation files.
 */
@Component
public class CaptionWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(CaptionWriter.class);
    static final int MAX_LINE_CHARS = 38;
    private static final String FADE_TAG = "{\\fad(200,200)}";

    public Path write(CaptionTimeline timeline, CaptionFormat format, PlatformProfile profile, Path target) {
        String body = render(timeline, format, profile);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to write captions to " + target, e);
        }
        LOGGER.debug("CaptionWriter WRITE format={} cues={} path={}", format, timeline.cues().size(), target);
        return target;
    }

    public String render(CaptionTimeline timeline, CaptionFormat format, PlatformProfile profile) {
        return switch (format) {
            case SRT -> buildSrt(timeline);
            case VTT -> buildVtt(timeline);
            case ASS -> buildAss(timeline, profile);
        };
    }

    static String buildSrt(CaptionTimeline timeline) {
        StringBuilder srt = new StringBuilder();
        for (CaptionCue cue : timeline.cues()) {
            srt.append(cue.index()).append('\n');
            srt.append(CaptionTimeFormat.srt(cue.start()))
               .append(" --> ")
               .append(CaptionTimeFormat.srt(cue.end()))
               .append('\n');
            srt.append(formatCueText(cue.text())).append("\n\n");
        }
        return srt.toString();
    }

    static String buildVtt(CaptionTimeline timeline) {
        StringBuilder vtt = new StringBuilder("WEBVTT\nKind: captions\n\n");
        for (CaptionCue cue : timeline.cues()) {
            vtt.append(CaptionTimeFormat.vtt(cue.start()))
               .append(" --> ")
               .append(CaptionTimeFormat.vtt(cue.end()))
               .append('\n');
            vtt.append(formatCueText(cue.text())).append("\n\n");
        }
        return vtt.toString();
    }

    static String buildAss(CaptionTimeline timeline, PlatformProfile profile) {
        CaptionStyle style = profile.captionStyle();
        boolean animate = profile.has(Effect.TEXT_ANIMATIONS);
        StringBuilder ass = new StringBuilder();
        ass.append("[Script Info]\n")
           .append("ScriptType: v4.00+\n")
           .append("PlayResX: ").append(profile.width()).append('\n')
           .append("PlayResY: ").append(profile.height()).append('\n')
           .append("WrapStyle: 0\n\n");

        ass.append("[V4+ Styles]\n")
           .append("Format: Name, Fontname, Fontsize, PrimaryColour, SecondaryColour, OutlineColour, BackColour, ")
           .append("Bold, Italic, Underline, StrikeOut, ScaleX, ScaleY, Spacing, Angle, BorderStyle, Outline, Shadow, ")
           .append("Alignment, MarginL, MarginR, MarginV, Encoding\n")
           .append(AssStyleUtil.styleLine("Default", style, style.fontSize(), style.primaryColour())).append('\n')
           .append(AssStyleUtil.styleLine("Hook", style, style.fontSize() + 6, AssStyleUtil.HOOK_COLOUR)).append('\n')
           .append(AssStyleUtil.styleLine("CTA", style, style.fontSize(), AssStyleUtil.CTA_COLOUR)).append("\n\n");

        ass.append("[Events]\n")
           .append("Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text\n");
        for (CaptionCue cue : timeline.cues()) {
            String text = formatCueText(cue.text()).replace("\n", "\\N");
            ass.append("Dialogue: 0,")
               .append(CaptionTimeFormat.ass(cue.start())).append(',')
               .append(CaptionTimeFormat.ass(cue.end())).append(',')
               .append(styleName(cue.role()))
               .append(",,0,0,0,,")
               .append(animate ? FADE_TAG : "")
               .append(text)
               .append('\n');
        }
        return ass.toString();
    }

    private static String styleName(CaptionRole role) {
        return switch (role) {
            case HOOK -> "Hook";
            case CTA -> "CTA";
            case CONTENT -> "Default";
        };
    }

    /**
     * Wraps text to at most two lines, picking the split with the least overflow, then the shortest
     * longest line, then the best balance.
     */
    static String formatCueText(String text) {
        if (text == null) {
            return "";
        }

        String normalized = text.replaceAll("\\s+", " ").trim();
        if (normalized.isEmpty() || normalized.length() <= MAX_LINE_CHARS) {
            return normalized;
        }

        String[] words = normalized.split(" ");
        if (words.length <= 1) {
            return normalized;
        }

        int bestSplit = 1;
        int bestPenalty = Integer.MAX_VALUE;
        int bestMax = Integer.MAX_VALUE;
        int bestBalance = Integer.MAX_VALUE;

        for (int split = 1; split < words.length; split++) {
            int len1 = String.join(" ", java.util.Arrays.copyOfRange(words, 0, split)).length();
            int len2 = String.join(" ", java.util.Arrays.copyOfRange(words, split, words.length)).length();

            int penalty = Math.max(0, len1 - MAX_LINE_CHARS) + Math.max(0, len2 - MAX_LINE_CHARS);
            int maxLen = Math.max(len1, len2);
            int balance = Math.abs(len1 - len2);

            if (penalty < bestPenalty
                    || (penalty == bestPenalty && maxLen < bestMax)
                    || (penalty == bestPenalty && maxLen == bestMax && balance < bestBalance)) {
                bestPenalty = penalty;
                bestMax = maxLen;
                bestBalance = balance;
                bestSplit = split;
            }
        }

        return String.join(" ", java.util.Arrays.copyOfRange(words, 0, bestSplit))
                + "\n"
                + String.join(" ", java.util.Arrays.copyOfRange(words, bestSplit, words.length));
    }
}
