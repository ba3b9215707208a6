package com.example.shortsbot_backend.config;

import com.example.shortsbot_backend.timeline.TimelineConfig;
import com.example.shortsbot_backend.util.CaptionFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "shorts.timeline")
public class TimelineProperties {
    private double hookSeconds = 5.0;
    private String hookText = "🎯 ATTENTION !";
    private double ctaShare = 0.5;
    private double ctaMaxSeconds = 35.0;
    private double ctaLatestStart = 35.0;
    private int longLineChars = 100;
    private double wordsPerSecond = 2.5;
    private CaptionFormat captionFormat = CaptionFormat.ASS;

    public TimelineConfig toConfig() {
        TimelineConfig d = TimelineConfig.defaults();
        return new TimelineConfig(hookSeconds, hookText, ctaShare, ctaMaxSeconds, ctaLatestStart,
                longLineChars, d.minSentenceChars(), wordsPerSecond, d.fallbackCta());
    }

    public double getHookSeconds() { return hookSeconds; }
    public void setHookSeconds(double hookSeconds) { this.hookSeconds = hookSeconds; }

    public String getHookText() { return hookText; }
    public void setHookText(String hookText) { this.hookText = hookText; }

    public double getCtaShare() { return ctaShare; }
    public void setCtaShare(double ctaShare) { this.ctaShare = ctaShare; }

    public double getCtaMaxSeconds() { return ctaMaxSeconds; }
    public void setCtaMaxSeconds(double ctaMaxSeconds) { this.ctaMaxSeconds = ctaMaxSeconds; }

    public double getCtaLatestStart() { return ctaLatestStart; }
    public void setCtaLatestStart(double ctaLatestStart) { this.ctaLatestStart = ctaLatestStart; }

    public int getLongLineChars() { return longLineChars; }
    public void setLongLineChars(int longLineChars) { this.longLineChars = longLineChars; }

    public double getWordsPerSecond() { return wordsPerSecond; }
    public void setWordsPerSecond(double wordsPerSecond) { this.wordsPerSecond = wordsPerSecond; }

    public CaptionFormat getCaptionFormat() { return captionFormat; }
    public void setCaptionFormat(CaptionFormat captionFormat) { this.captionFormat = captionFormat; }
}
