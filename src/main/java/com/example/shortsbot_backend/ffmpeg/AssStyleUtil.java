package com.example.shortsbot_backend.ffmpeg;

import com.example.shortsbot_backend.dto.CaptionStyle;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class AssStyleUtil {
    private static final Pattern RGBA = Pattern.compile("rgba\\((\\d+),(\\d+),(\\d+),(\\d+(?:\\.\\d+)?)\\)");

    public static final String HOOK_COLOUR = "#FFFF00";
    public static final String CTA_COLOUR = "#00FF00";

    private AssStyleUtil() {
    }

    public static String toAssColor(String color) {
        color = color.trim().toLowerCase(Locale.ROOT);
        int r = 255;
        int g = 255;
        int b = 255;
        int a = 0;

        if (color.startsWith("#") && (color.length() == 7 || color.length() == 4)) {
            if (color.length() == 7) {
                r = Integer.parseInt(color.substring(1, 3), 16);
                g = Integer.parseInt(color.substring(3, 5), 16);
                b = Integer.parseInt(color.substring(5, 7), 16);
            } else {
                r = Integer.parseInt(color.substring(1, 2) + color.substring(1, 2), 16);
                g = Integer.parseInt(color.substring(2, 3) + color.substring(2, 3), 16);
                b = Integer.parseInt(color.substring(3, 4) + color.substring(3, 4), 16);
            }
        } else {
            Matcher m = RGBA.matcher(color.replace(" ", ""));
            if (m.matches()) {
                r = clamp(Integer.parseInt(m.group(1)));
                g = clamp(Integer.parseInt(m.group(2)));
                b = clamp(Integer.parseInt(m.group(3)));
                double alpha = Double.parseDouble(m.group(4));
                a = 255 - (int) Math.round(alpha * 255.0);
            }
        }
        return String.format(Locale.ROOT, "&H%02X%02X%02X%02X", a, b, g, r);
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }

    /**
     * Style override for the ffmpeg {@code subtitles} filter, used when burning SRT/VTT tracks.
     */
    public static String buildForceStyle(CaptionStyle style) {
        CaptionStyle effective = style == null ? CaptionStyle.defaults() : style;
        return String.join(",",
                "FontName=" + effective.fontName(),
                "FontSize=" + effective.fontSize(),
                "PrimaryColour=" + toAssColor(effective.primaryColour()),
                "OutlineColour=" + toAssColor(effective.outlineColour()),
                "BorderStyle=" + effective.borderStyle(),
                "Alignment=" + effective.alignment(),
                "MarginV=" + effective.marginV()
        );
    }

    /**
     * One {@code Style:} line of an ASS {@code [V4+ Styles]} section.
     *
     * @param name     style name referenced by dialogue events.
     * @param style    base caption style.
     * @param fontSize size override for this style.
     * @param colour   primary colour override (CSS hex).
     */
    public static String styleLine(String name, CaptionStyle style, int fontSize, String colour) {
        CaptionStyle effective = style == null ? CaptionStyle.defaults() : style;
        return String.join(",",
                "Style: " + name,
                effective.fontName(),
                String.valueOf(fontSize),
                toAssColor(colour),
                toAssColor(colour),
                toAssColor(effective.outlineColour()),
                "&H80000000",
                "-1", "0", "0", "0",
                "100", "100", "0", "0",
                String.valueOf(effective.borderStyle()),
                "2", "0",
                String.valueOf(effective.alignment()),
                "10", "10",
                String.valueOf(effective.marginV()),
                "1");
    }

    /** Escapes a path for use inside an ffmpeg filter argument. */
    public static String escapeForFilter(String path) {
        return path
                .replace("\\", "/")
                .replace(":", "\\:")
                .replace("'", "\\'");
    }
}
