package com.example.shortsbot_backend.timeline;

/**
 * Timing rules for the three-act caption track.
 *
 * @param hookSeconds          fixed length of the opening hook cue.
 * @param hookText             hook caption.
 * @param ctaShare             fraction of the total duration reserved for CTA prompts.
 * @param ctaMaxSeconds        upper bound on the CTA budget.
 * @param ctaLatestStart       CTA block starts no later than this offset.
 * @param longLineChars        content sentences longer than this are split in two cues.
 * @param minSentenceChars     sentences of this length or shorter are dropped.
 * @param wordsPerSecond       narration pace used when the audio duration is unknown.
 * @param fallbackCta          prompt used when the platform has none configured.
 */
public record TimelineConfig(double hookSeconds,
                             String hookText,
                             double ctaShare,
                             double ctaMaxSeconds,
                             double ctaLatestStart,
                             int longLineChars,
                             int minSentenceChars,
                             double wordsPerSecond,
                             String fallbackCta) {

    public TimelineConfig {
        if (hookSeconds < 0 || ctaShare < 0 || ctaShare > 1 || ctaMaxSeconds < 0 || wordsPerSecond <= 0) {
            throw new IllegalArgumentException("Invalid timeline configuration");
        }
    }

    public static TimelineConfig defaults() {
        return new TimelineConfig(5.0, "🎯 ATTENTION !", 0.5, 35.0, 35.0, 100, 3, 2.5, "👍 Likez et abonnez-vous !");
    }

    public TimelineConfig withCtaMaxSeconds(double seconds) {
        return new TimelineConfig(hookSeconds, hookText, ctaShare, seconds, ctaLatestStart, longLineChars,
                minSentenceChars, wordsPerSecond, fallbackCta);
    }
}
