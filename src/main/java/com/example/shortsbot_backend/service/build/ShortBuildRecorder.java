package com.example.shortsbot_backend.service.build;

import com.example.shortsbot_backend.dto.ViralMoment;
import com.example.shortsbot_backend.exception.PersistenceFailureException;
import com.example.shortsbot_backend.model.ShortAnalytics;
import com.example.shortsbot_backend.model.ShortBuild;
import com.example.shortsbot_backend.repository.ShortAnalyticsRepository;
import com.example.shortsbot_backend.repository.ShortBuildRepository;
import com.example.shortsbot_backend.service.assembly.AssemblyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Writes the build ledger: one {@code shorts} row plus one zeroed {@code shorts_analytics} row,
 * in a single transaction.
 * <p>
 * Re-building an already recorded {@code (videoId, platform)} pair is skipped by the caller via
 * {@link #isRecorded}; the unique constraint rejects a concurrent duplicate, which surfaces as a
 * {@link PersistenceFailureException}.
 */
@Service
public class ShortBuildRecorder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortBuildRecorder.class);
    static final String UNRECORDED_ARTIFACT = "UNRECORDED_ARTIFACT";

    private final ShortBuildRepository shortRepository;
    private final ShortAnalyticsRepository analyticsRepository;
    private final TransactionOperations tx;
    private final Clock clock;

    public ShortBuildRecorder(ShortBuildRepository shortRepository,
                              ShortAnalyticsRepository analyticsRepository,
                              TransactionOperations tx,
                              Clock clock) {
        this.shortRepository = shortRepository;
        this.analyticsRepository = analyticsRepository;
        this.tx = tx;
        this.clock = clock;
    }

    public boolean isRecorded(String videoId, String platform) {
        return shortRepository.existsByVideoIdAndPlatform(videoId, platform);
    }

    /**
     * @throws PersistenceFailureException when the rows cannot be written; the artifact stays on disk.
     */
    public ShortBuild record(String videoId, String platform, ViralMoment moment, AssemblyResult result) {
        Path artifact = result.outputPath();
        Instant now = clock.instant();
        try {
            ShortBuild saved = tx.execute(status -> {
                ShortBuild build = shortRepository.saveAndFlush(new ShortBuild(
                        videoId,
                        platform,
                        artifact.toString(),
                        result.thumbnailPath() == null ? null : result.thumbnailPath().toString(),
                        moment.title(),
                        result.window().start(),
                        result.window().end(),
                        moment.justification(),
                        moment.score(),
                        now));
                analyticsRepository.saveAndFlush(ShortAnalytics.seed(videoId, platform, artifact.toString(),
                        result.duration(), result.fileSize(), now));
                return build;
            });
            LOGGER.info("ShortBuildRecorder RECORDED videoId={} platform={} id={}",
                    videoId, platform, saved == null ? null : saved.getId());
            return saved;
        } catch (DataAccessException | TransactionException e) {
            LOGGER.error("ShortBuildRecorder {} videoId={} platform={} artifact={} cause={}",
                    UNRECORDED_ARTIFACT, videoId, platform, artifact, e.getMessage());
            throw new PersistenceFailureException("Short built but not recorded for " + videoId + "/" + platform
                    + " (artifact " + artifact + ")", artifact, e);
        }
    }
}
