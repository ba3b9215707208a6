package com.example.shortsbot_backend.service.assembly;

import com.example.shortsbot_backend.config.NarrationProperties;
import com.example.shortsbot_backend.config.TimelineProperties;
import com.example.shortsbot_backend.dto.NarrationVoice;
import com.example.shortsbot_backend.dto.PlatformProfile;
import com.example.shortsbot_backend.engine.MediaToolkit;
import com.example.shortsbot_backend.exception.MissingInputException;
import com.example.shortsbot_backend.exception.ShortBuildException;
import com.example.shortsbot_backend.exception.StorageException;
import com.example.shortsbot_backend.service.Interfaces.NarrationSynthesisService;
import com.example.shortsbot_backend.service.Interfaces.StorageService;
import com.example.shortsbot_backend.service.background.AllocatedBackground;
import com.example.shortsbot_backend.service.background.BackgroundClipAllocator;
import com.example.shortsbot_backend.service.thumbnail.ThumbnailService;
import com.example.shortsbot_backend.timeline.CaptionTimeline;
import com.example.shortsbot_backend.timeline.CaptionWriter;
import com.example.shortsbot_backend.timeline.TimelineComposer;
import com.example.shortsbot_backend.timing.DurationNormalizer;
import com.example.shortsbot_backend.timing.NormalizedWindow;
import com.example.shortsbot_backend.util.CaptionFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a selected moment into a finished vertical short.
 * <p>
 * Stages run in order and each one either produces its temporary artifact or aborts the build:
 * acquire source, extend (when the source is too short), trim, compose over background footage,
 * mux narration, append CTA audio (best-effort), burn captions, apply effects, finalize. All
 * temporary files live in one work directory that is removed on every exit path.
 */
@Service
public class MediaAssemblyPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaAssemblyPipeline.class);

    private final MediaToolkit toolkit;
    private final DurationNormalizer normalizer;
    private final BackgroundClipAllocator allocator;
    private final NarrationSynthesisService narration;
    private final TimelineComposer timelineComposer;
    private final CaptionWriter captionWriter;
    private final StorageService storageService;
    private final ThumbnailService thumbnailService;
    private final NarrationProperties narrationProps;
    private final TimelineProperties timelineProps;

    public MediaAssemblyPipeline(MediaToolkit toolkit,
                                 DurationNormalizer normalizer,
                                 BackgroundClipAllocator allocator,
                                 NarrationSynthesisService narration,
                                 TimelineComposer timelineComposer,
                                 CaptionWriter captionWriter,
                                 StorageService storageService,
                                 ThumbnailService thumbnailService,
                                 NarrationProperties narrationProps,
                                 TimelineProperties timelineProps) {
        this.toolkit = toolkit;
        this.normalizer = normalizer;
        this.allocator = allocator;
        this.narration = narration;
        this.timelineComposer = timelineComposer;
        this.captionWriter = captionWriter;
        this.storageService = storageService;
        this.thumbnailService = thumbnailService;
        this.narrationProps = narrationProps;
        this.timelineProps = timelineProps;
    }

    /**
     * @throws ShortBuildException on missing inputs, tool failures or unsatisfiable duration bounds.
     */
    public AssemblyResult assemble(AssemblyRequest req) {
        PlatformProfile profile = req.profile();
        List<AssemblyStage> stages = new ArrayList<>();

        try (TempArtifactScope scope = new TempArtifactScope(storageService.newWorkDir(req.videoId() + "-" + profile.key()))) {
            // AcquireSource
            enter(stages, AssemblyStage.ACQUIRE_SOURCE, req);
            Path source = req.sourceVideo();
            if (source == null || !Files.isRegularFile(source)) {
                throw new MissingInputException("Source video missing for " + req.videoId() + ": " + source);
            }
            double videoDuration = toolkit.probeDuration(source);
            NormalizedWindow window = normalizer.normalize(req.moment(), videoDuration, profile);
            double duration = window.duration();

            Path narrationAudio = scope.file("narration.mp3");
            narration.synthesize(req.moment().text(), NarrationVoice.of(narrationProps.getVoice()), narrationAudio);
            if (!isNonEmpty(narrationAudio)) {
                throw new MissingInputException("Narration audio missing for " + req.videoId());
            }
            double narrationSeconds = toolkit.probeDuration(narrationAudio);

            // OptionalExtend
            if (window.extended()) {
                enter(stages, AssemblyStage.EXTEND, req);
                Path extended = scope.file("extended.mp4");
                toolkit.extendByLoop(source, window.loopCount(), window.sourceDuration(), scope.file("extend.txt"), extended);
                source = extended;
            }

            enter(stages, AssemblyStage.TRIM, req);
            Path trimmed = toolkit.trim(source, window.start(), duration, scope.file("trimmed.mp4"));

            enter(stages, AssemblyStage.CONCATENATE_BACKGROUND, req);
            AllocatedBackground background = allocator.allocate(req.theme(), duration, req.videoId());
            Path composed = toolkit.composeBackground(background.playlistFor(duration), trimmed, duration, profile,
                    scope.file("background.txt"), scope.file("composed.mp4"));

            enter(stages, AssemblyStage.MUX_NARRATION_AUDIO, req);
            Path muxed = toolkit.muxNarration(composed, narrationAudio, scope.file("muxed.mp4"));
            double audioSeconds = narrationSeconds;

            // OptionalConcatenateCTAAudio
            enter(stages, AssemblyStage.CONCATENATE_CTA_AUDIO, req);
            CtaAudio cta = appendCtaAudio(req, narrationAudio, composed, scope);
            if (cta != null) {
                muxed = cta.video();
                audioSeconds = cta.audioSeconds();
            }

            enter(stages, AssemblyStage.BURN_CAPTIONS, req);
            CaptionFormat format = timelineProps.getCaptionFormat();
            CaptionTimeline timeline = timelineComposer.compose(req.moment().text(), profile,
                    Math.min(audioSeconds, duration), req.rotationSeed(), timelineProps.toConfig());
            Path captions = captionWriter.write(timeline, format, profile, scope.file("captions" + format.extension()));
            Path captioned = toolkit.burnCaptions(muxed, captions, format, profile, duration, scope.file("captioned.mp4"));

            enter(stages, AssemblyStage.APPLY_EFFECTS, req);
            Path effected = toolkit.applyEffects(captioned, profile, duration, scope.file("final.mp4"));

            enter(stages, AssemblyStage.FINALIZE, req);
            if (!isNonEmpty(effected)) {
                throw new StorageException("Final render is empty for " + req.videoId());
            }
            long size = Files.size(effected);
            String key = profile.outputDir() + "/" + outputName(req.videoId(), profile.key(), ".mp4");
            Path output = storageService.moveTo(effected, key);
            scope.release(effected);
            Path thumbnail = thumbnailService.extract(output, duration, outputName(req.videoId(), profile.key(), ".jpg"));

            LOGGER.info("MediaAssemblyPipeline DONE videoId={} platform={} duration={} bytes={} output={}",
                    req.videoId(), profile.key(), duration, size, output);
            return new AssemblyResult(output, thumbnail, window, size, List.copyOf(stages));
        } catch (IOException e) {
            throw new StorageException("Cannot read final render for " + req.videoId(), e);
        } catch (ShortBuildException | StorageException e) {
            AssemblyStage failedAt = stages.isEmpty() ? AssemblyStage.ACQUIRE_SOURCE : stages.get(stages.size() - 1);
            LOGGER.warn("MediaAssemblyPipeline FAILED videoId={} platform={} stage={} cause={}",
                    req.videoId(), profile.key(), failedAt, firstLine(e.getMessage()));
            throw e;
        }
    }

    /**
     * Synthesizes the CTA prompts with the CTA voice, appends them to the narration and re-muxes.
     *
     * @return {@code null} when any step fails; the build then keeps the narration-only audio.
     */
    private CtaAudio appendCtaAudio(AssemblyRequest req, Path narrationAudio, Path composed, TempArtifactScope scope) {
        List<String> prompts = req.profile().ctaPrompts();
        if (prompts.isEmpty()) {
            return null;
        }
        NarrationVoice ctaVoice = NarrationVoice.of(narrationProps.getCtaVoice());
        try {
            List<Path> parts = new ArrayList<>();
            parts.add(narrationAudio);
            int n = prompts.size();
            for (int i = 0; i < n; i++) {
                String spoken = spoken(prompts.get(Math.floorMod(req.rotationSeed() + i, n)));
                if (spoken.isEmpty()) {
                    continue;
                }
                parts.add(narration.synthesize(spoken, ctaVoice, scope.file("cta_" + i + ".mp3")));
            }
            if (parts.size() == 1) {
                return null;
            }
            Path voice = toolkit.concatAudio(parts, scope.file("voice.m4a"));
            double seconds = toolkit.probeDuration(voice);
            Path video = toolkit.muxNarration(composed, voice, scope.file("muxed_cta.mp4"));
            return new CtaAudio(video, seconds);
        } catch (ShortBuildException | StorageException e) {
            LOGGER.warn("MediaAssemblyPipeline CTA_AUDIO_SKIPPED videoId={} platform={} cause={}",
                    req.videoId(), req.profile().key(), firstLine(e.getMessage()));
            return null;
        }
    }

    /** Prompt text without emoji and symbols, as sent to speech synthesis. */
    static String spoken(String prompt) {
        if (prompt == null) {
            return "";
        }
        return prompt.replaceAll("[^\\p{L}\\p{N}\\p{P}\\s]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    static String outputName(String videoId, String platform, String extension) {
        String safeId = videoId.replaceAll("[^A-Za-z0-9_-]", "_");
        return safeId + "_" + platform.toLowerCase(Locale.ROOT) + extension;
    }

    private static boolean isNonEmpty(Path p) {
        try {
            return Files.isRegularFile(p) && Files.size(p) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private static void enter(List<AssemblyStage> stages, AssemblyStage stage, AssemblyRequest req) {
        stages.add(stage);
        LOGGER.info("MediaAssemblyPipeline STAGE stage={} videoId={} platform={}", stage, req.videoId(), req.profile().key());
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    private record CtaAudio(Path video, double audioSeconds) {}
}
