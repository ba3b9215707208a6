package com.example.shortsbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Speech synthesis server and the two voices used per short.
 */
@ConfigurationProperties(prefix = "narration")
public class NarrationProperties {
    private String baseUrl = "https://api.elevenlabs.io";
    private String apiKey;
    private String modelId = "eleven_multilingual_v2";
    private String voice = "21m00Tcm4TlvDq8ikWAM";
    private String ctaVoice = "AZnzlk1XvdvUeBnXmlld";
    private long timeoutSeconds = 120;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getModelId() { return modelId; }
    public void setModelId(String modelId) { this.modelId = modelId; }

    public String getVoice() { return voice; }
    public void setVoice(String voice) { this.voice = voice; }

    public String getCtaVoice() { return ctaVoice; }
    public void setCtaVoice(String ctaVoice) { this.ctaVoice = ctaVoice; }

    public long getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
}
