package com.example.shortsbot_backend.timeline;

import java.util.Locale;

/**
 * Stateless seconds-to-timestamp conversions for the caption dialects the muxer accepts.
 */
public final class CaptionTimeFormat {

    private CaptionTimeFormat() {
    }

    /** SubRip: {@code HH:MM:SS,mmm}. */
    public static String srt(double seconds) {
        return millisFormat(seconds, ',');
    }

    /** WebVTT: {@code HH:MM:SS.mmm}. */
    public static String vtt(double seconds) {
        return millisFormat(seconds, '.');
    }

    /** Advanced SubStation: {@code H:MM:SS.cc}. */
    public static String ass(double seconds) {
        long cs = Math.round(Math.max(0.0, seconds) * 100.0);
        long hours = cs / 360_000;
        long minutes = (cs % 360_000) / 6_000;
        long secs = (cs % 6_000) / 100;
        long centis = cs % 100;
        return String.format(Locale.ROOT, "%d:%02d:%02d.%02d", hours, minutes, secs, centis);
    }

    private static String millisFormat(double seconds, char separator) {
        long safeMs = Math.round(Math.max(0.0, seconds) * 1000.0);
        long hours = safeMs / 3_600_000;
        long minutes = (safeMs % 3_600_000) / 60_000;
        long secs = (safeMs % 60_000) / 1000;
        long millis = safeMs % 1000;
        return String.format(Locale.ROOT, "%02d:%02d:%02d%c%03d", hours, minutes, secs, separator, millis);
    }
}
