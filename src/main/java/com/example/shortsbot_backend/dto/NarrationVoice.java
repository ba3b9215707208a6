package com.example.shortsbot_backend.dto;

/**
 * Voice selection passed with every synthesis call.
 *
 * @param voiceId   provider voice identifier.
 * @param stability provider stability setting in {@code [0,1]}.
 */
public record NarrationVoice(String voiceId, double stability) {
    public NarrationVoice {
        if (voiceId == null || voiceId.isBlank()) {
            throw new IllegalArgumentException("voiceId is required");
        }
    }

    public static NarrationVoice of(String voiceId) {
        return new NarrationVoice(voiceId, 0.5);
    }
}
