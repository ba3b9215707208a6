package com.example.shortsbot_backend.service.Interfaces;

import com.example.shortsbot_backend.dto.Transcription;

import java.nio.file.Path;

/**
 * Speech-to-text collaborator.
 */
public interface TranscriptionService {
    Transcription transcribe(Path audioFile);

    /** Provider name stored with cached transcripts. */
    String provider();
}
