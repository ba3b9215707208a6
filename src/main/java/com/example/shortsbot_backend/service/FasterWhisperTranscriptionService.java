package com.example.shortsbot_backend.service;

import com.example.shortsbot_backend.config.FwProperties;
import com.example.shortsbot_backend.dto.FwVerboseResponse;
import com.example.shortsbot_backend.dto.TranscriptSegment;
import com.example.shortsbot_backend.dto.Transcription;
import com.example.shortsbot_backend.exception.MissingInputException;
import com.example.shortsbot_backend.service.Interfaces.TranscriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Talks to a faster-whisper server exposing the OpenAI-compatible transcription endpoint.
 */
@Service
public class FasterWhisperTranscriptionService implements TranscriptionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FasterWhisperTranscriptionService.class);

    private final WebClient client;
    private final FwProperties props;
    private final Duration timeout;

    public FasterWhisperTranscriptionService(@Qualifier("fwWebClient") WebClient client, FwProperties props) {
        this.client = client;
        this.props = props;
        this.timeout = Duration.ofSeconds(props.getTimeoutSeconds());
    }

    @Override
    public Transcription transcribe(Path audioFile) {
        var mb = new LinkedMultiValueMap<String, Object>();
        mb.add("file", new FileSystemResource(audioFile));
        if (props.getModel() != null && !props.getModel().isBlank()) {
            mb.add("model", props.getModel());
        }
        if (props.getLanguage() != null && !props.getLanguage().isBlank()) {
            mb.add("language", props.getLanguage());
        }
        mb.add("response_format", "verbose_json");

        long start = System.currentTimeMillis();
        FwVerboseResponse response;
        try {
            response = client.post()
                    .uri("/v1/audio/transcriptions")
                    .body(BodyInserters.fromMultipartData(mb))
                    .retrieve()
                    .bodyToMono(FwVerboseResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientException e) {
            throw new MissingInputException("Transcription failed for " + audioFile.getFileName() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // reactor wraps the TimeoutException
            throw new MissingInputException("Transcription did not complete for " + audioFile.getFileName() + ": " + e.getMessage(), e);
        }
        if (response == null) {
            throw new MissingInputException("Empty transcription response for " + audioFile.getFileName());
        }
        LOGGER.info("FasterWhisperTranscriptionService DONE file={} segments={} ms={}",
                audioFile.getFileName(),
                response.segments() == null ? 0 : response.segments().size(),
                System.currentTimeMillis() - start);
        return toTranscription(response);
    }

    @Override
    public String provider() {
        return "faster-whisper";
    }

    static Transcription toTranscription(FwVerboseResponse r) {
        List<TranscriptSegment> segments = new ArrayList<>();
        if (r.segments() != null) {
            for (FwVerboseResponse.Seg s : r.segments()) {
                if (s.start() == null || s.end() == null || s.start() < 0 || s.end() <= s.start()) {
                    continue;
                }
                segments.add(new TranscriptSegment(s.start(), s.end(), s.text() == null ? "" : s.text().trim()));
            }
        }
        double duration = r.duration() != null ? r.duration()
                : segments.isEmpty() ? 0.0 : segments.get(segments.size() - 1).end();
        return new Transcription(r.text() == null ? "" : r.text().trim(), segments, duration);
    }
}
