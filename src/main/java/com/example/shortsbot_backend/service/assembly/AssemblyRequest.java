package com.example.shortsbot_backend.service.assembly;

import com.example.shortsbot_backend.dto.PlatformProfile;
import com.example.shortsbot_backend.dto.ViralMoment;

import java.nio.file.Path;

/**
 * @param videoId      source video identifier.
 * @param sourceVideo  local source video file.
 * @param theme        background theme.
 * @param moment       selected moment; its text is narrated and captioned.
 * @param profile      target platform.
 * @param rotationSeed offset into the CTA prompt rotation.
 */
public record AssemblyRequest(String videoId,
                              Path sourceVideo,
                              String theme,
                              ViralMoment moment,
                              PlatformProfile profile,
                              int rotationSeed) {}
