package com.example.shortsbot_backend.service.build;

import com.example.shortsbot_backend.config.PlatformProfileRegistry;
import com.example.shortsbot_backend.config.PlatformProperties;
import com.example.shortsbot_backend.config.ScoringProperties;
import com.example.shortsbot_backend.dto.BatchReport;
import com.example.shortsbot_backend.dto.BuildOutcome;
import com.example.shortsbot_backend.dto.TranscriptSegment;
import com.example.shortsbot_backend.dto.Transcription;
import com.example.shortsbot_backend.exception.ExternalToolException;
import com.example.shortsbot_backend.exception.FailureKind;
import com.example.shortsbot_backend.model.SourceVideo;
import com.example.shortsbot_backend.repository.ShortBuildRepository;
import com.example.shortsbot_backend.repository.SourceVideoRepository;
import com.example.shortsbot_backend.segment.TranscriptSegmenter;
import com.example.shortsbot_backend.selector.RankingViralMomentSelector;
import com.example.shortsbot_backend.selector.ViralScorer;
import com.example.shortsbot_backend.service.TranscriptService;
import com.example.shortsbot_backend.service.assembly.AssemblyRequest;
import com.example.shortsbot_backend.service.assembly.AssemblyResult;
import com.example.shortsbot_backend.service.assembly.MediaAssemblyPipeline;
import com.example.shortsbot_backend.timing.NormalizedWindow;
import com.example.shortsbot_backend.util.BuildStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.TransactionSystemException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShortBuildServiceTest {

    @Mock
    private SourceVideoRepository videoRepository;
    @Mock
    private ShortBuildRepository shortRepository;
    @Mock
    private TranscriptService transcriptService;
    @Mock
    private MediaAssemblyPipeline pipeline;
    @Mock
    private ShortBuildRecorder recorder;

    private ShortBuildService service;

    @BeforeEach
    void setUp() {
        service = new ShortBuildService(new PlatformProfileRegistry(new PlatformProperties()), videoRepository,
                shortRepository, transcriptService, new TranscriptSegmenter(),
                new RankingViralMomentSelector(new ViralScorer()), pipeline, recorder, new ScoringProperties());
    }

    @Test
    void alreadyRecordedPairIsSkipped() {
        when(recorder.isRecorded("v1", "tiktok")).thenReturn(true);

        BuildOutcome outcome = service.buildOne("v1", "TikTok");

        assertThat(outcome.status()).isEqualTo(BuildStatus.SKIPPED);
        verifyNoInteractions(pipeline, transcriptService);
    }

    @Test
    void unknownVideoIsMissingInput() {
        when(videoRepository.findByVideoId("v1")).thenReturn(Optional.empty());

        BuildOutcome outcome = service.buildOne("v1", "tiktok");

        assertThat(outcome.status()).isEqualTo(BuildStatus.FAILED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.MISSING_INPUT);
    }

    @Test
    void emptyTranscriptYieldsNoMoment() {
        SourceVideo video = video("v1");
        when(videoRepository.findByVideoId("v1")).thenReturn(Optional.of(video));
        when(transcriptService.getOrTranscribe(video)).thenReturn(new Transcription("", List.of(), 0));

        BuildOutcome outcome = service.buildOne("v1", "tiktok");

        assertThat(outcome.status()).isEqualTo(BuildStatus.NO_MOMENT);
        assertThat(outcome.message()).isEqualTo("no viral moment found");
        verify(pipeline, never()).assemble(any());
    }

    @Test
    void buildsBestMomentAndRecordsIt() {
        SourceVideo video = video("v1");
        when(videoRepository.findByVideoId("v1")).thenReturn(Optional.of(video));
        when(transcriptService.getOrTranscribe(video)).thenReturn(transcription());
        when(shortRepository.countByPlatform("youtube_shorts")).thenReturn(3L);
        AssemblyResult result = result("v1");
        when(pipeline.assemble(any())).thenReturn(result);

        BuildOutcome outcome = service.buildOne("v1", "youtube_shorts");

        assertThat(outcome.isBuilt()).isTrue();
        assertThat(outcome.shortPath()).isEqualTo(result.outputPath().toString());
        ArgumentCaptor<AssemblyRequest> captor = ArgumentCaptor.forClass(AssemblyRequest.class);
        verify(pipeline).assemble(captor.capture());
        AssemblyRequest req = captor.getValue();
        assertThat(req.profile().key()).isEqualTo("youtube_shorts");
        assertThat(req.rotationSeed()).isEqualTo(3);
        assertThat(req.theme()).isEqualTo("motivation");
        assertThat(req.moment().text()).contains("secret");
        verify(recorder).record(eq("v1"), eq("youtube_shorts"), eq(req.moment()), eq(result));
    }

    @Test
    void batchContinuesAfterFailedItem() {
        SourceVideo bad = video("bad");
        SourceVideo good = video("good");
        when(videoRepository.findWithoutShortFor(eq("tiktok"), any(Pageable.class))).thenReturn(List.of(bad, good));
        when(videoRepository.findByVideoId("bad")).thenReturn(Optional.of(bad));
        when(videoRepository.findByVideoId("good")).thenReturn(Optional.of(good));
        when(transcriptService.getOrTranscribe(any())).thenReturn(transcription());
        when(pipeline.assemble(any()))
                .thenThrow(new ExternalToolException("burn", 1, false, "boom"))
                .thenReturn(result("good"));

        BatchReport report = service.buildBatch("tiktok", 5);

        assertThat(report.outcomes()).extracting(BuildOutcome::status)
                .containsExactly(BuildStatus.FAILED, BuildStatus.BUILT);
        assertThat(report.outcomes().get(0).failureKind()).isEqualTo(FailureKind.EXTERNAL_TOOL);
        assertThat(report.summary()).contains("built 1/2");
    }

    @Test
    void batchContinuesWhenRecordingFailsToCommit() {
        SourceVideo first = video("first");
        SourceVideo second = video("second");
        when(videoRepository.findWithoutShortFor(eq("tiktok"), any(Pageable.class))).thenReturn(List.of(first, second));
        when(videoRepository.findByVideoId("first")).thenReturn(Optional.of(first));
        when(videoRepository.findByVideoId("second")).thenReturn(Optional.of(second));
        when(transcriptService.getOrTranscribe(any())).thenReturn(transcription());
        when(pipeline.assemble(any())).thenReturn(result("first"), result("second"));
        when(recorder.record(any(), any(), any(), any()))
                .thenThrow(new TransactionSystemException("commit failed"))
                .thenReturn(null);

        BatchReport report = service.buildBatch("tiktok", 2);

        assertThat(report.outcomes()).extracting(BuildOutcome::status)
                .containsExactly(BuildStatus.FAILED, BuildStatus.BUILT);
        assertThat(report.outcomes().get(0).failureKind()).isEqualTo(FailureKind.PERSISTENCE);
        assertThat(report.summary()).contains("built 1/2");
    }

    @Test
    void storeOutageBecomesPersistenceFailure() {
        when(recorder.isRecorded("v1", "tiktok")).thenThrow(new DataAccessResourceFailureException("connection refused"));

        BuildOutcome outcome = service.buildOne("v1", "tiktok");

        assertThat(outcome.status()).isEqualTo(BuildStatus.FAILED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.PERSISTENCE);
        verifyNoInteractions(pipeline);
    }

    @Test
    void unknownPlatformIsRejected() {
        assertThatThrownBy(() -> service.buildOne("v1", "myspace"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown platform");
    }

    private static SourceVideo video(String id) {
        return new SourceVideo(id, "Titre " + id, "motivation", "/videos/" + id + ".mp4", "/audio/" + id + ".mp3",
                Instant.parse("2026-03-01T10:00:00Z"));
    }

    private static Transcription transcription() {
        return new Transcription("", List.of(
                new TranscriptSegment(0, 40, "Le secret de l'argent ? Voici la méthode."),
                new TranscriptSegment(40, 80, "Un texte neutre sans rien.")), 80);
    }

    private static AssemblyResult result(String id) {
        return new AssemblyResult(Path.of("/data/platforms/" + id + ".mp4"), null,
                new NormalizedWindow(0, 70, 80, false, 1), 100L, List.of());
    }
}
