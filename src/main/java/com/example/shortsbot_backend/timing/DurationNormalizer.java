package com.example.shortsbot_backend.timing;

import com.example.shortsbot_backend.dto.PlatformProfile;
import com.example.shortsbot_backend.dto.ViralMoment;
import com.example.shortsbot_backend.exception.DurationConstraintException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Fits a candidate moment into platform duration bounds without running past the source.
 * <p>
 * Order of precedence:
 * <ol>
 *     <li>clamp the candidate duration to {@code [min, max]};</li>
 *     <li>when the source is shorter than {@code min}, extend it by integer looping; the extended
 *     source is capped at exactly the target duration;</li>
 *     <li>shift the start down so the window ends inside the source;</li>
 *     <li>trim the duration only if the shift still overflows.</li>
 * </ol>
 * A source of at least {@code min} seconds is never looped, so the window always ends inside it.
 * Normalizing an already-normalized window returns it unchanged.
 */
@Component
public class DurationNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DurationNormalizer.class);
    private static final double EPSILON = 1e-6;

    public NormalizedWindow normalize(ViralMoment moment, double videoDuration, PlatformProfile profile) {
        return normalize(moment.startTime(), moment.candidateDuration(), videoDuration,
                profile.minDuration(), profile.maxDuration());
    }

    public NormalizedWindow normalize(double candidateStart,
                                      double candidateDuration,
                                      double videoDuration,
                                      double minDuration,
                                      double maxDuration) {
        if (minDuration <= 0 || maxDuration < minDuration) {
            throw new IllegalArgumentException("Invalid bounds min=" + minDuration + " max=" + maxDuration);
        }
        if (Double.isNaN(videoDuration) || Double.isInfinite(videoDuration) || videoDuration <= 0) {
            throw new DurationConstraintException("Source has no usable duration: " + videoDuration);
        }

        double duration = clamp(Double.isNaN(candidateDuration) ? 0.0 : candidateDuration, minDuration, maxDuration);
        double start = Double.isNaN(candidateStart) ? 0.0 : Math.max(0.0, candidateStart);

        double source = videoDuration;
        boolean extended = false;
        int loops = 1;
        if (source + EPSILON < minDuration) {
            loops = loopsFor(source, duration);
            source = duration;
            extended = true;
        }

        if (start + duration > source) {
            start = Math.max(0.0, source - duration);
        }
        if (start + duration > source + EPSILON) {
            duration = source - start;
        }

        if (duration + EPSILON < minDuration || duration - EPSILON > maxDuration) {
            throw new DurationConstraintException(String.format(Locale.ROOT,
                    "Cannot fit [%.3f, %.3f] into source of %.3fs (got %.3fs)", minDuration, maxDuration, videoDuration, duration));
        }
        LOGGER.debug("DurationNormalizer candidate=({}, {}) video={} -> start={} duration={} extended={} loops={}",
                candidateStart, candidateDuration, videoDuration, start, duration, extended, loops);
        return new NormalizedWindow(start, duration, source, extended, loops);
    }

    /**
     * Repetitions of a source of {@code current} seconds needed to cover {@code target} seconds.
     */
    public static int loopsFor(double current, double target) {
        if (current <= 0) {
            throw new DurationConstraintException("Cannot loop a zero-length source");
        }
        return (int) (target / current) + 1;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
