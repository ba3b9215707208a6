package com.example.shortsbot_backend.util;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Stock footage search vocabulary per content theme.
 */
public final class ThemeKeywords {
    public static final int KEYWORDS_PER_SEARCH = 2;

    private static final Map<String, List<String>> KEYWORDS = Map.ofEntries(
            entry("motivation", List.of("motivation", "inspiration", "success", "achievement", "determination")),
            entry("success", List.of("success", "achievement", "victory", "winning", "accomplishment")),
            entry("philosophy", List.of("philosophy", "wisdom", "meditation", "reflection", "thinking")),
            entry("discipline", List.of("discipline", "routine", "habits", "consistency", "perseverance")),
            entry("growth", List.of("growth", "development", "learning", "improvement", "progress")),
            entry("failure", List.of("failure", "resilience", "overcoming", "challenge", "struggle")),
            entry("leadership", List.of("leadership", "management", "team", "direction", "guidance")),
            entry("mindset", List.of("mindset", "attitude", "perspective", "thinking", "mental")),
            entry("business", List.of("business", "entrepreneurship", "startup", "office", "work")),
            entry("health", List.of("health", "fitness", "wellness", "exercise", "lifestyle"))
    );

    private ThemeKeywords() {
    }

    /**
     * Search keywords for a theme: the first {@link #KEYWORDS_PER_SEARCH} known keywords, or the
     * theme itself when unknown.
     */
    public static List<String> searchTermsFor(String theme) {
        String key = theme == null ? "" : theme.trim().toLowerCase(Locale.ROOT);
        List<String> all = KEYWORDS.get(key);
        if (all == null) {
            return key.isEmpty() ? List.of() : List.of(key);
        }
        return all.subList(0, Math.min(KEYWORDS_PER_SEARCH, all.size()));
    }

    public static boolean isKnown(String theme) {
        return theme != null && KEYWORDS.containsKey(theme.trim().toLowerCase(Locale.ROOT));
    }
}
