package com.example.shortsbot_backend.service;

import com.example.shortsbot_backend.dto.TranscriptSegment;
import com.example.shortsbot_backend.dto.Transcription;
import com.example.shortsbot_backend.exception.MissingInputException;
import com.example.shortsbot_backend.model.SourceVideo;
import com.example.shortsbot_backend.model.Transcript;
import com.example.shortsbot_backend.repository.TranscriptRepository;
import com.example.shortsbot_backend.service.Interfaces.TranscriptionService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Transcript cache in front of the transcription collaborator.
 */
@Service
public class TranscriptService {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptService.class);

    private final TranscriptRepository transcriptRepo;
    private final TranscriptionService transcriptionService;
    private final ObjectMapper om;
    private final Clock clock;

    public TranscriptService(TranscriptRepository transcriptRepo,
                             TranscriptionService transcriptionService,
                             ObjectMapper om,
                             Clock clock) {
        this.transcriptRepo = transcriptRepo;
        this.transcriptionService = transcriptionService;
        this.om = om;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<Transcription> findCached(String videoId) {
        return transcriptRepo.findByVideoId(videoId).map(this::toTranscription);
    }

    /**
     * Returns the cached transcript or transcribes the video's audio track and caches the result.
     *
     * @throws MissingInputException when nothing is cached and the audio file is absent.
     */
    @Transactional
    public Transcription getOrTranscribe(SourceVideo video) {
        Optional<Transcription> cached = findCached(video.getVideoId());
        if (cached.isPresent()) {
            LOGGER.debug("TranscriptService CACHE_HIT videoId={}", video.getVideoId());
            return cached.get();
        }
        if (video.getAudioPath() == null || video.getAudioPath().isBlank()) {
            throw new MissingInputException("No transcript and no audio track for video " + video.getVideoId());
        }
        Path audio = Path.of(video.getAudioPath());
        if (!Files.isRegularFile(audio)) {
            throw new MissingInputException("No transcript and audio file missing for video " + video.getVideoId() + ": " + audio);
        }
        Transcription result = transcriptionService.transcribe(audio);
        save(video.getVideoId(), transcriptionService.provider(), result);
        LOGGER.info("TranscriptService TRANSCRIBED videoId={} segments={} duration={}",
                video.getVideoId(), result.segments().size(), result.durationSeconds());
        return result;
    }

    @Transactional
    public Transcript save(String videoId, String provider, Transcription t) {
        Transcript entity = transcriptRepo.findByVideoId(videoId)
                .orElseGet(() -> new Transcript(videoId, provider, clock.instant()));
        entity.setText(t.text());
        entity.setDuration(t.durationSeconds());
        entity.setSegments(toJson(t.segments()));
        return transcriptRepo.save(entity);
    }

    Transcription toTranscription(Transcript t) {
        List<TranscriptSegment> segments = new ArrayList<>();
        JsonNode arr = t.getSegments();
        if (arr != null && arr.isArray()) {
            for (JsonNode n : arr) {
                double start = n.path("start").asDouble(-1);
                double end = n.path("end").asDouble(-1);
                if (start < 0 || end <= start) {
                    continue;
                }
                segments.add(new TranscriptSegment(start, end, n.path("text").asText("")));
            }
        }
        return new Transcription(t.getText(), segments, t.getDuration());
    }

    private JsonNode toJson(List<TranscriptSegment> segments) {
        ArrayNode arr = om.createArrayNode();
        for (TranscriptSegment s : segments) {
            ObjectNode n = arr.addObject();
            n.put("start", s.start());
            n.put("end", s.end());
            n.put("text", s.text());
        }
        return arr;
    }
}
