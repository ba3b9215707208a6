package com.example.shortsbot_backend.util;

public enum CaptionFormat {
    SRT(".srt"),
    VTT(".vtt"),
    ASS(".ass");

    private final String extension;

    CaptionFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
