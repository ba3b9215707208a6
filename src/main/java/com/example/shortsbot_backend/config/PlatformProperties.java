package com.example.shortsbot_backend.config;

import com.example.shortsbot_backend.util.Effect;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-platform overrides. Keys missing here fall back to the built-in profiles of
 * {@link PlatformProfileRegistry}; unset fields of a listed key keep the built-in value.
 */
@ConfigurationProperties(prefix = "shorts.platforms")
public class PlatformProperties {
    private Map<String, Platform> profiles = new LinkedHashMap<>();

    public Map<String, Platform> getProfiles() { return profiles; }
    public void setProfiles(Map<String, Platform> profiles) { this.profiles = profiles; }

    public static class Platform {
        private String aspectRatio;
        private Integer width;
        private Integer height;
        private Double minDuration;
        private Double maxDuration;
        private String fontName;
        private Integer fontSize;
        private String primaryColour;
        private String outlineColour;
        private Integer marginV;
        private List<Effect> effects;
        private List<String> ctaPrompts = new ArrayList<>();
        private String outputDir;

        public String getAspectRatio() { return aspectRatio; }
        public void setAspectRatio(String aspectRatio) { this.aspectRatio = aspectRatio; }

        public Integer getWidth() { return width; }
        public void setWidth(Integer width) { this.width = width; }

        public Integer getHeight() { return height; }
        public void setHeight(Integer height) { this.height = height; }

        public Double getMinDuration() { return minDuration; }
        public void setMinDuration(Double minDuration) { this.minDuration = minDuration; }

        public Double getMaxDuration() { return maxDuration; }
        public void setMaxDuration(Double maxDuration) { this.maxDuration = maxDuration; }

        public String getFontName() { return fontName; }
        public void setFontName(String fontName) { this.fontName = fontName; }

        public Integer getFontSize() { return fontSize; }
        public void setFontSize(Integer fontSize) { this.fontSize = fontSize; }

        public String getPrimaryColour() { return primaryColour; }
        public void setPrimaryColour(String primaryColour) { this.primaryColour = primaryColour; }

        public String getOutlineColour() { return outlineColour; }
        public void setOutlineColour(String outlineColour) { this.outlineColour = outlineColour; }

        public Integer getMarginV() { return marginV; }
        public void setMarginV(Integer marginV) { this.marginV = marginV; }

        public List<Effect> getEffects() { return effects; }
        public void setEffects(List<Effect> effects) { this.effects = effects; }

        public List<String> getCtaPrompts() { return ctaPrompts; }
        public void setCtaPrompts(List<String> ctaPrompts) { this.ctaPrompts = ctaPrompts; }

        public String getOutputDir() { return outputDir; }
        public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    }
}
