package com.example.shortsbot_backend.timeline;

public enum CaptionRole {
    HOOK,
    CONTENT,
    CTA
}
