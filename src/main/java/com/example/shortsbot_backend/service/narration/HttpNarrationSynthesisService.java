package com.example.shortsbot_backend.service.narration;

import com.example.shortsbot_backend.config.NarrationProperties;
import com.example.shortsbot_backend.dto.NarrationVoice;
import com.example.shortsbot_backend.exception.MissingInputException;
import com.example.shortsbot_backend.exception.StorageException;
import com.example.shortsbot_backend.service.Interfaces.NarrationSynthesisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ElevenLabs-compatible text-to-speech adapter ({@code POST /v1/text-to-speech/{voiceId}}).
 */
@Service
public class HttpNarrationSynthesisService implements NarrationSynthesisService {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpNarrationSynthesisService.class);

    private final WebClient client;
    private final NarrationProperties props;
    private final Duration timeout;

    public HttpNarrationSynthesisService(@Qualifier("narrationWebClient") WebClient client, NarrationProperties props) {
        this.client = client;
        this.props = props;
        this.timeout = Duration.ofSeconds(props.getTimeoutSeconds());
    }

    @Override
    public Path synthesize(String text, NarrationVoice voice, Path target) {
        if (text == null || text.isBlank()) {
            throw new MissingInputException("Nothing to narrate");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        body.put("model_id", props.getModelId());
        body.put("voice_settings", Map.of("stability", voice.stability(), "similarity_boost", 0.75));

        long start = System.currentTimeMillis();
        byte[] audio;
        try {
            audio = client.post()
                    .uri("/v1/text-to-speech/{voiceId}", voice.voiceId())
                    .headers(h -> {
                        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
                            h.set("xi-api-key", props.getApiKey());
                        }
                    })
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.valueOf("audio/mpeg"))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientException e) {
            throw new MissingInputException("Narration synthesis failed voice=" + voice.voiceId() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new MissingInputException("Narration synthesis did not complete voice=" + voice.voiceId() + ": " + e.getMessage(), e);
        }
        if (audio == null || audio.length == 0) {
            throw new MissingInputException("Narration synthesis returned no audio voice=" + voice.voiceId());
        }
        try {
            Files.write(target, audio);
        } catch (IOException e) {
            throw new StorageException("Cannot write narration audio " + target, e);
        }
        LOGGER.info("HttpNarrationSynthesisService DONE voice={} chars={} bytes={} ms={}",
                voice.voiceId(), text.length(), audio.length, System.currentTimeMillis() - start);
        return target;
    }
}
