package com.example.shortsbot_backend.config;

import com.example.shortsbot_backend.dto.CaptionStyle;
import com.example.shortsbot_backend.dto.PlatformProfile;
import com.example.shortsbot_backend.util.Effect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves platform keys to immutable {@link PlatformProfile}s: built-in templates merged with
 * {@code shorts.platforms.profiles.*} overrides.
 */
@Component
public class PlatformProfileRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlatformProfileRegistry.class);

    public static final String TIKTOK = "tiktok";
    public static final String YOUTUBE_SHORTS = "youtube_shorts";
    public static final String INSTAGRAM_REELS = "instagram_reels";

    private final Map<String, PlatformProfile> profiles;

    public PlatformProfileRegistry(PlatformProperties properties) {
        Map<String, PlatformProfile> merged = new LinkedHashMap<>(builtIns());
        properties.getProfiles().forEach((key, override) -> {
            String k = key.toLowerCase(Locale.ROOT);
            merged.put(k, merge(k, merged.get(k), override));
        });
        this.profiles = Collections.unmodifiableMap(merged);
        LOGGER.info("PlatformProfileRegistry loaded platforms={}", profiles.keySet());
    }

    public Optional<PlatformProfile> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(key.toLowerCase(Locale.ROOT)));
    }

    public PlatformProfile require(String key) {
        return find(key).orElseThrow(() -> new IllegalArgumentException("Unknown platform: " + key));
    }

    public Set<String> keys() {
        return profiles.keySet();
    }

    static Map<String, PlatformProfile> builtIns() {
        Map<String, PlatformProfile> m = new LinkedHashMap<>();
        m.put(TIKTOK, new PlatformProfile(TIKTOK, "9:16", 1080, 1920, 70, 90,
                new CaptionStyle("Arial", 32, "#FFFFFF", "#000000", 3, 2, 50),
                EnumSet.of(Effect.ZOOM, Effect.TEXT_ANIMATIONS, Effect.TRANSITIONS, Effect.FILTERS),
                List.of("🔥 Abonne-toi pour plus de contenu comme ça !",
                        "💯 Suis-moi pour du contenu exclusif !",
                        "🚀 Abonne-toi et active la cloche !",
                        "⭐ Like et abonne-toi pour plus !"),
                "platforms/tiktok"));
        m.put(YOUTUBE_SHORTS, new PlatformProfile(YOUTUBE_SHORTS, "9:16", 1080, 1920, 70, 90,
                new CaptionStyle("Arial", 28, "#FFFFFF", "#000000", 3, 2, 40),
                EnumSet.of(Effect.ZOOM, Effect.TEXT_ANIMATIONS, Effect.TRANSITIONS),
                List.of("🔔 Abonne-toi et active la cloche !",
                        "👍 Like et abonne-toi pour plus de contenu !",
                        "💎 Rejoins la communauté !",
                        "🎯 Abonne-toi pour ne rien manquer !"),
                "platforms/youtube"));
        m.put(INSTAGRAM_REELS, new PlatformProfile(INSTAGRAM_REELS, "9:16", 1080, 1920, 70, 90,
                new CaptionStyle("Arial", 30, "#FFFFFF", "#000000", 3, 2, 45),
                EnumSet.noneOf(Effect.class),
                List.of("✨ Suis-moi pour plus de contenu !",
                        "🔥 Abonne-toi et active les notifications !",
                        "💫 Double tap et abonne-toi !",
                        "🌟 Suis-moi pour du contenu exclusif !"),
                "platforms/instagram"));
        return m;
    }

    private static PlatformProfile merge(String key, PlatformProfile base, PlatformProperties.Platform o) {
        PlatformProfile b = base != null ? base : new PlatformProfile(key, "9:16", 1080, 1920, 70, 90,
                CaptionStyle.defaults(), Set.of(), List.of(), "platforms/" + key);
        CaptionStyle s = b.captionStyle();
        CaptionStyle style = new CaptionStyle(
                o.getFontName() != null ? o.getFontName() : s.fontName(),
                o.getFontSize() != null ? o.getFontSize() : s.fontSize(),
                o.getPrimaryColour() != null ? o.getPrimaryColour() : s.primaryColour(),
                o.getOutlineColour() != null ? o.getOutlineColour() : s.outlineColour(),
                s.borderStyle(),
                s.alignment(),
                o.getMarginV() != null ? o.getMarginV() : s.marginV());
        return new PlatformProfile(key,
                o.getAspectRatio() != null ? o.getAspectRatio() : b.aspectRatio(),
                o.getWidth() != null ? o.getWidth() : b.width(),
                o.getHeight() != null ? o.getHeight() : b.height(),
                o.getMinDuration() != null ? o.getMinDuration() : b.minDuration(),
                o.getMaxDuration() != null ? o.getMaxDuration() : b.maxDuration(),
                style,
                o.getEffects() != null ? Set.copyOf(o.getEffects()) : b.effects(),
                o.getCtaPrompts() != null && !o.getCtaPrompts().isEmpty() ? o.getCtaPrompts() : b.ctaPrompts(),
                o.getOutputDir() != null ? o.getOutputDir() : b.outputDir());
    }
}
