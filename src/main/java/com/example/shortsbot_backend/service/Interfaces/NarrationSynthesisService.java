package com.example.shortsbot_backend.service.Interfaces;

import com.example.shortsbot_backend.dto.NarrationVoice;

import java.nio.file.Path;

/**
 * Text-to-speech collaborator. The result is an opaque audio file; its duration is probed by
 * the caller.
 */
public interface NarrationSynthesisService {
    /**
     * @param text   text to speak.
     * @param voice  voice for this call only.
     * @param target file to write.
     * @return {@code target}.
     */
    Path synthesize(String text, NarrationVoice voice, Path target);
}
