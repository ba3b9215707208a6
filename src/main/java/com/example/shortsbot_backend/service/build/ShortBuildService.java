package com.example.shortsbot_backend.service.build;

import com.example.shortsbot_backend.config.PlatformProfileRegistry;
import com.example.shortsbot_backend.config.ScoringProperties;
import com.example.shortsbot_backend.dto.BatchReport;
import com.example.shortsbot_backend.dto.BuildOutcome;
import com.example.shortsbot_backend.dto.PlatformProfile;
import com.example.shortsbot_backend.dto.Transcription;
import com.example.shortsbot_backend.dto.ViralMoment;
import com.example.shortsbot_backend.dto.web.ShortResponse;
import com.example.shortsbot_backend.exception.FailureKind;
import com.example.shortsbot_backend.exception.MissingInputException;
import com.example.shortsbot_backend.exception.ShortBuildException;
import com.example.shortsbot_backend.exception.StorageException;
import com.example.shortsbot_backend.model.ShortBuild;
import com.example.shortsbot_backend.model.SourceVideo;
import com.example.shortsbot_backend.repository.ShortBuildRepository;
import com.example.shortsbot_backend.repository.SourceVideoRepository;
import com.example.shortsbot_backend.segment.TranscriptSegmenter;
import com.example.shortsbot_backend.selector.CandidateWindow;
import com.example.shortsbot_backend.selector.ViralMomentSelector;
import com.example.shortsbot_backend.service.TranscriptService;
import com.example.shortsbot_backend.service.assembly.AssemblyRequest;
import com.example.shortsbot_backend.service.assembly.AssemblyResult;
import com.example.shortsbot_backend.service.assembly.MediaAssemblyPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds shorts end to end: transcript, moment selection, assembly, recording.
 * <p>
 * Expected failures become a {@link BuildOutcome} so batches continue with the next video.
 * Programming errors propagate.
 */
@Service
public class ShortBuildService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortBuildService.class);

    private final PlatformProfileRegistry platforms;
    private final SourceVideoRepository videoRepository;
    private final ShortBuildRepository shortRepository;
    private final TranscriptService transcriptService;
    private final TranscriptSegmenter segmenter;
    private final ViralMomentSelector selector;
    private final MediaAssemblyPipeline pipeline;
    private final ShortBuildRecorder recorder;
    private final ScoringProperties scoringProps;

    public ShortBuildService(PlatformProfileRegistry platforms,
                             SourceVideoRepository videoRepository,
                             ShortBuildRepository shortRepository,
                             TranscriptService transcriptService,
                             TranscriptSegmenter segmenter,
                             ViralMomentSelector selector,
                             MediaAssemblyPipeline pipeline,
                             ShortBuildRecorder recorder,
                             ScoringProperties scoringProps) {
        this.platforms = platforms;
        this.videoRepository = videoRepository;
        this.shortRepository = shortRepository;
        this.transcriptService = transcriptService;
        this.segmenter = segmenter;
        this.selector = selector;
        this.pipeline = pipeline;
        this.recorder = recorder;
        this.scoringProps = scoringProps;
    }

    /**
     * @throws IllegalArgumentException for an unknown platform.
     */
    public BuildOutcome buildOne(String videoId, String platform) {
        PlatformProfile profile = platforms.require(platform);
        String key = profile.key();
        try {
            if (recorder.isRecorded(videoId, key)) {
                LOGGER.info("ShortBuildService SKIP videoId={} platform={} reason=already-recorded", videoId, key);
                return BuildOutcome.skipped(videoId, key);
            }
            SourceVideo video = videoRepository.findByVideoId(videoId)
                    .orElseThrow(() -> new MissingInputException("Unknown video " + videoId));
            return build(video, profile);
        } catch (ShortBuildException e) {
            return failed(videoId, key, e.getKind(), e.getMessage());
        } catch (StorageException e) {
            return failed(videoId, key, FailureKind.EXTERNAL_TOOL, e.getMessage());
        } catch (DataAccessException | TransactionException e) {
            return failed(videoId, key, FailureKind.PERSISTENCE, e.getMessage());
        }
    }

    /**
     * Builds up to {@code limit} shorts for videos that have none on the platform yet, one at a time.
     */
    public BatchReport buildBatch(String platform, int limit) {
        PlatformProfile profile = platforms.require(platform);
        List<SourceVideo> candidates = videoRepository.findWithoutShortFor(profile.key(), PageRequest.of(0, Math.max(1, limit)));
        LOGGER.info("ShortBuildService BATCH_START platform={} limit={} candidates={}", profile.key(), limit, candidates.size());

        List<BuildOutcome> outcomes = new ArrayList<>(candidates.size());
        int i = 0;
        for (SourceVideo video : candidates) {
            i++;
            BuildOutcome outcome = buildOne(video.getVideoId(), profile.key());
            outcomes.add(outcome);
            LOGGER.info("ShortBuildService BATCH_ITEM {}/{} {}", i, candidates.size(), outcome.line());
        }
        BatchReport report = new BatchReport(profile.key(), limit, outcomes);
        LOGGER.info("ShortBuildService BATCH_DONE platform={} {}", profile.key(), report.summary());
        return report;
    }

    /**
     * Recorded shorts, newest first; all platforms when {@code platform} is null.
     */
    @Transactional(readOnly = true)
    public List<ShortResponse> listShorts(String platform) {
        List<ShortBuild> shorts = platform == null
                ? shortRepository.findAllByOrderByCreatedAtDesc()
                : shortRepository.findByPlatformOrderByCreatedAtDesc(platforms.require(platform).key());
        return shorts.stream().map(ShortResponse::from).toList();
    }

    private BuildOutcome build(SourceVideo video, PlatformProfile profile) {
        String videoId = video.getVideoId();
        Transcription transcription = transcriptService.getOrTranscribe(video);
        if (transcription.isBlank()) {
            LOGGER.info("ShortBuildService no viral moment found videoId={} platform={} reason=empty-transcript", videoId, profile.key());
            return BuildOutcome.noMoment(videoId, profile.key());
        }
        List<CandidateWindow> windows = segmenter.segment(transcription, scoringProps.toSegmentationConfig());
        List<ViralMoment> moments = selector.selectTop(windows, scoringProps.toScoringConfig());
        if (moments.isEmpty()) {
            LOGGER.info("ShortBuildService no viral moment found videoId={} platform={} windows={}", videoId, profile.key(), windows.size());
            return BuildOutcome.noMoment(videoId, profile.key());
        }
        ViralMoment best = moments.get(0);
        LOGGER.info("ShortBuildService MOMENT videoId={} platform={} start={} end={} score={}",
                videoId, profile.key(), best.startTime(), best.endTime(), best.score());

        int rotationSeed = (int) shortRepository.countByPlatform(profile.key());
        AssemblyResult result = pipeline.assemble(new AssemblyRequest(
                videoId, Path.of(video.getVideoPath()), video.getTheme(), best, profile, rotationSeed));
        recorder.record(videoId, profile.key(), best, result);

        LOGGER.info("ShortBuildService DONE videoId={} platform={} output={}", videoId, profile.key(), result.outputPath());
        return BuildOutcome.built(videoId, profile.key(), result.outputPath().toString(),
                result.thumbnailPath() == null ? null : result.thumbnailPath().toString(),
                best.title(), best.score());
    }

    private static BuildOutcome failed(String videoId, String platform, FailureKind kind, String message) {
        LOGGER.warn("ShortBuildService FAILED videoId={} platform={} kind={} cause={}", videoId, platform, kind, message);
        return BuildOutcome.failed(videoId, platform, kind, message);
    }
}
