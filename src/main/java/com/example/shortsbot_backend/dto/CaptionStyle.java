package com.example.shortsbot_backend.dto;

/**
 * Caption appearance for one platform. Colours are CSS hex or {@code rgba(...)} strings.
 */
public record CaptionStyle(String fontName,
                           int fontSize,
                           String primaryColour,
                           String outlineColour,
                           int borderStyle,
                           int alignment,
                           int marginV) {

    public static CaptionStyle defaults() {
        return new CaptionStyle("Arial", 28, "#FFFFFF", "#000000", 3, 2, 40);
    }
}
