package com.example.shortsbot_backend.service.assembly;

public enum AssemblyStage {
    ACQUIRE_SOURCE,
    EXTEND,
    TRIM,
    CONCATENATE_BACKGROUND,
    MUX_NARRATION_AUDIO,
    CONCATENATE_CTA_AUDIO,
    BURN_CAPTIONS,
    APPLY_EFFECTS,
    FINALIZE
}
