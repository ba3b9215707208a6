package com.example.shortsbot_backend.timeline;

import com.example.shortsbot_backend.dto.PlatformProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the hook / content / call-to-action caption track.
 * <p>
 * The track ends at {@code min(total, platform max)}. The CTA block closes the video: it starts
 * {@code min(total * ctaShare, ctaMaxSeconds)} before the end, but no later than
 * {@code ctaLatestStart} and never before the hook ends. Content sentences share the span between
 * the hook and the CTA start evenly, so the last content cue ends exactly where the first CTA cue
 * starts. Prompts then divide whatever CTA span is left.
 */
@Component
public class TimelineComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TimelineComposer.class);
    private static final Pattern SENTENCE = Pattern.compile("[^.!?]+[.!?]*");
    private static final double EPSILON = 1e-6;

    /**
     * @param narrationText    text spoken in the short.
     * @param profile          target platform; provides max duration and CTA prompts.
     * @param narrationSeconds measured audio duration; {@code null} or non-positive to estimate from word count.
     * @param rotationSeed     offset into the prompt list so consecutive shorts rotate prompts.
     * @param cfg              timing rules; {@code null} means defaults.
     */
    public CaptionTimeline compose(String narrationText,
                                   PlatformProfile profile,
                                   Double narrationSeconds,
                                   int rotationSeed,
                                   TimelineConfig cfg) {
        TimelineConfig c = cfg == null ? TimelineConfig.defaults() : cfg;
        String text = narrationText == null ? "" : narrationText.trim();

        double total = narrationSeconds != null && narrationSeconds > 0
                ? narrationSeconds
                : estimateSeconds(text, c.wordsPerSecond());
        double end = Math.min(total, profile.maxDuration());
        if (end <= EPSILON) {
            return new CaptionTimeline(List.of(), 0.0);
        }

        double hookEnd = Math.min(c.hookSeconds(), end);
        double ctaBudget = Math.min(total * c.ctaShare(), c.ctaMaxSeconds());
        double ctaStart = end - ctaBudget;
        ctaStart = Math.min(ctaStart, c.ctaLatestStart());
        ctaStart = Math.max(ctaStart, hookEnd);

        List<String> sentences = sentences(text, c.minSentenceChars());
        if (sentences.isEmpty()) {
            ctaStart = hookEnd;
        }

        List<Draft> drafts = new ArrayList<>();
        drafts.add(new Draft(0.0, hookEnd, c.hookText(), CaptionRole.HOOK));
        addContent(drafts, sentences, hookEnd, ctaStart, c.longLineChars());
        addCta(drafts, prompts(profile.ctaPrompts(), rotationSeed, c.fallbackCta()), ctaStart, end);

        List<CaptionCue> cues = new ArrayList<>(drafts.size());
        for (Draft d : drafts) {
            if (d.end() - d.start() <= EPSILON) {
                continue;
            }
            cues.add(new CaptionCue(cues.size() + 1, d.start(), d.end(), d.text(), d.role()));
        }
        LOGGER.debug("TimelineComposer platform={} total={} end={} hookEnd={} ctaStart={} sentences={} cues={}",
                profile.key(), total, end, hookEnd, ctaStart, sentences.size(), cues.size());
        return new CaptionTimeline(cues, end);
    }

    private static void addContent(List<Draft> out, List<String> sentences, double from, double to, int longLine) {
        if (sentences.isEmpty() || to - from <= EPSILON) {
            return;
        }
        int n = sentences.size();
        double per = (to - from) / n;
        for (int i = 0; i < n; i++) {
            double s = from + per * i;
            double e = i == n - 1 ? to : from + per * (i + 1);
            String sentence = sentences.get(i);
            String[] halves = splitAtMidpoint(sentence, longLine);
            if (halves == null) {
                out.add(new Draft(s, e, sentence, CaptionRole.CONTENT));
            } else {
                double mid = s + (e - s) / 2.0;
                out.add(new Draft(s, mid, halves[0], CaptionRole.CONTENT));
                out.add(new Draft(mid, e, halves[1], CaptionRole.CONTENT));
            }
        }
    }

    private static void addCta(List<Draft> out, List<String> prompts, double from, double to) {
        if (prompts.isEmpty() || to - from <= EPSILON) {
            return;
        }
        int n = prompts.size();
        double per = (to - from) / n;
        for (int i = 0; i < n; i++) {
            double s = from + per * i;
            double e = i == n - 1 ? to : from + per * (i + 1);
            out.add(new Draft(s, e, prompts.get(i), CaptionRole.CTA));
        }
    }

    static List<String> sentences(String text, int minChars) {
        List<String> result = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return result;
        }
        Matcher m = SENTENCE.matcher(text);
        while (m.find()) {
            String s = m.group().replaceAll("\\s+", " ").trim();
            if (s.length() > minChars) {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * Splits an over-long sentence at the word boundary closest to its middle.
     *
     * @return two halves, or {@code null} when the sentence is short enough or a single word.
     */
    static String[] splitAtMidpoint(String sentence, int longLine) {
        if (sentence.length() <= longLine) {
            return null;
        }
        String[] words = sentence.split(" ");
        if (words.length < 2) {
            return null;
        }
        int mid = words.length / 2;
        return new String[]{
                String.join(" ", java.util.Arrays.copyOfRange(words, 0, mid)),
                String.join(" ", java.util.Arrays.copyOfRange(words, mid, words.length))
        };
    }

    static List<String> prompts(List<String> configured, int seed, String fallback) {
        if (configured == null || configured.isEmpty()) {
            return fallback == null || fallback.isBlank() ? List.of() : List.of(fallback);
        }
        int n = configured.size();
        int offset = Math.floorMod(seed, n);
        List<String> rotated = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            rotated.add(configured.get((offset + i) % n));
        }
        return rotated;
    }

    static double estimateSeconds(String text, double wordsPerSecond) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        return text.trim().split("\\s+").length / wordsPerSecond;
    }

    private record Draft(double start, double end, String text, CaptionRole role) {}
}
