package com.example.shortsbot_backend.dto;

import com.example.shortsbot_backend.util.Effect;

import java.util.List;
import java.util.Set;

/**
 * Read-only constraints for one distribution channel.
 *
 * @param key          lookup key such as {@code tiktok}.
 * @param aspectRatio  display ratio, e.g. {@code 9:16}.
 * @param width        output canvas width in pixels.
 * @param height       output canvas height in pixels.
 * @param minDuration  minimum short length in seconds.
 * @param maxDuration  maximum short length in seconds.
 * @param captionStyle caption appearance.
 * @param effects      effects applied in the effects pass.
 * @param ctaPrompts   rotating call-to-action prompts.
 * @param outputDir    directory, relative to the storage base, receiving finished shorts.
 */
public record PlatformProfile(String key,
                              String aspectRatio,
                              int width,
                              int height,
                              double minDuration,
                              double maxDuration,
                              CaptionStyle captionStyle,
                              Set<Effect> effects,
                              List<String> ctaPrompts,
                              String outputDir) {

    public PlatformProfile {
        if (minDuration <= 0 || maxDuration < minDuration) {
            throw new IllegalArgumentException("Invalid duration bounds for " + key + ": min=" + minDuration + " max=" + maxDuration);
        }
        captionStyle = captionStyle == null ? CaptionStyle.defaults() : captionStyle;
        effects = effects == null ? Set.of() : Set.copyOf(effects);
        ctaPrompts = ctaPrompts == null ? List.of() : List.copyOf(ctaPrompts);
    }

    public boolean has(Effect effect) {
        return effects.contains(effect);
    }
}
