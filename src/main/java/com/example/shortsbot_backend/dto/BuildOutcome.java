package com.example.shortsbot_backend.dto;

import com.example.shortsbot_backend.exception.FailureKind;
import com.example.shortsbot_backend.util.BuildStatus;

/**
 * Per-item result of a build attempt.
 *
 * @param failureKind set only when {@code status} is {@link BuildStatus#FAILED}.
 * @param shortPath   set only when {@code status} is {@link BuildStatus#BUILT}.
 */
public record BuildOutcome(String videoId,
                           String platform,
                           BuildStatus status,
                           FailureKind failureKind,
                           String message,
                           String shortPath,
                           String thumbnailPath,
                           String title,
                           Double score) {

    public static BuildOutcome built(String videoId, String platform, String shortPath, String thumbnailPath,
                                     String title, double score) {
        return new BuildOutcome(videoId, platform, BuildStatus.BUILT, null, "built", shortPath, thumbnailPath, title, score);
    }

    public static BuildOutcome skipped(String videoId, String platform) {
        return new BuildOutcome(videoId, platform, BuildStatus.SKIPPED, null, "short already recorded", null, null, null, null);
    }

    public static BuildOutcome noMoment(String videoId, String platform) {
        return new BuildOutcome(videoId, platform, BuildStatus.NO_MOMENT, null, "no viral moment found", null, null, null, null);
    }

    public static BuildOutcome failed(String videoId, String platform, FailureKind kind, String message) {
        return new BuildOutcome(videoId, platform, BuildStatus.FAILED, kind, message, null, null, null, null);
    }

    public boolean isBuilt() {
        return status == BuildStatus.BUILT;
    }

    /** One line for batch output, e.g. {@code [BUILT] abc123 tiktok - built}. */
    public String line() {
        String kind = failureKind == null ? "" : " " + failureKind;
        return "[" + status + kind + "] " + videoId + " " + platform + " - " + message;
    }
}
