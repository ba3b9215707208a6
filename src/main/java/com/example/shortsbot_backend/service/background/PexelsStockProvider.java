package com.example.shortsbot_backend.service.background;

import com.example.shortsbot_backend.config.BackgroundProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Component
@Order(10)
class PexelsStockProvider implements StockFootageProvider {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final BackgroundProperties.Provider props;

    PexelsStockProvider(@Qualifier("stockWebClient") WebClient webClient, ObjectMapper objectMapper, BackgroundProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.props = properties.getPexels();
    }

    @Override
    public String name() {
        return "pexels";
    }

    @Override
    public boolean isEnabled() {
        return props.isConfigured();
    }

    @Override
    public List<StockVideo> search(String keyword, int count) {
        String endpoint = UriComponentsBuilder.fromUriString(props.getBaseUrl())
                .path("/videos/search")
                .queryParam("query", keyword)
                .queryParam("per_page", Math.max(1, Math.min(count, 80)))
                .queryParam("orientation", "portrait")
                .build()
                .toUriString();
        try {
            String payload = webClient.get()
                    .uri(endpoint)
                    .header(HttpHeaders.AUTHORIZATION, props.getApiKey())
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (payload == null || payload.isBlank()) {
                return List.of();
            }
            return parse(objectMapper.readTree(payload));
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().value() == 404) {
                return List.of();
            }
            throw new StockFootageAccessException("pexels search failed status=" + ex.getStatusCode().value(), ex);
        } catch (WebClientRequestException | IOException ex) {
            throw new StockFootageAccessException("pexels search failed", ex);
        }
    }

    static List<StockVideo> parse(JsonNode root) {
        List<StockVideo> out = new ArrayList<>();
        for (JsonNode video : root.path("videos")) {
            String link = bestFile(video.path("video_files"));
            if (link == null) {
                continue;
            }
            out.add(new StockVideo("pexels", video.path("id").asText(), link, video.path("duration").asDouble(0)));
        }
        return out;
    }

    /** Largest portrait file, else the first file with a link. */
    private static String bestFile(JsonNode files) {
        String fallback = null;
        String best = null;
        int bestHeight = -1;
        for (JsonNode f : files) {
            String link = f.path("link").asText(null);
            if (link == null || link.isBlank()) {
                continue;
            }
            if (fallback == null) {
                fallback = link;
            }
            int w = f.path("width").asInt(0);
            int h = f.path("height").asInt(0);
            if (h > w && h > bestHeight && h <= 1920) {
                best = link;
                bestHeight = h;
            }
        }
        return best != null ? best : fallback;
    }
}
