package com.example.shortsbot_backend.util;

/**
 * Visual treatments a platform profile can request during the effects pass.
 */
public enum Effect {
    ZOOM,
    TEXT_ANIMATIONS,
    TRANSITIONS,
    FILTERS
}
