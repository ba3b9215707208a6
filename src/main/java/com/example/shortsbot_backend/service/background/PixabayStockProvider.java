package com.example.shortsbot_backend.service.background;

import com.example.shortsbot_backend.config.BackgroundProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Component
@Order(20)
class PixabayStockProvider implements StockFootageProvider {
    // the API rejects per_page below 3
    private static final int MIN_PER_PAGE = 3;
    private static final int MAX_PER_PAGE = 20;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final BackgroundProperties.Provider props;

    PixabayStockProvider(@Qualifier("stockWebClient") WebClient webClient, ObjectMapper objectMapper, BackgroundProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.props = properties.getPixabay();
    }

    @Override
    public String name() {
        return "pixabay";
    }

    @Override
    public boolean isEnabled() {
        return props.isConfigured();
    }

    @Override
    public List<StockVideo> search(String keyword, int count) {
        String endpoint = UriComponentsBuilder.fromUriString(props.getBaseUrl())
                .path("/api/videos/")
                .queryParam("key", props.getApiKey())
                .queryParam("q", keyword)
                .queryParam("per_page", Math.max(MIN_PER_PAGE, Math.min(count, MAX_PER_PAGE)))
                .queryParam("orientation", "vertical")
                .build()
                .toUriString();
        try {
            String payload = webClient.get()
                    .uri(endpoint)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (payload == null || payload.isBlank()) {
                return List.of();
            }
            return parse(objectMapper.readTree(payload));
        } catch (WebClientResponseException ex) {
            throw new StockFootageAccessException("pixabay search failed status=" + ex.getStatusCode().value(), ex);
        } catch (WebClientRequestException | IOException ex) {
            throw new StockFootageAccessException("pixabay search failed", ex);
        }
    }

    static List<StockVideo> parse(JsonNode root) {
        List<StockVideo> out = new ArrayList<>();
        for (JsonNode hit : root.path("hits")) {
            String url = hit.path("videos").path("large").path("url").asText("");
            if (url.isBlank()) {
                url = hit.path("videos").path("medium").path("url").asText("");
            }
            if (url.isBlank()) {
                continue;
            }
            out.add(new StockVideo("pixabay", hit.path("id").asText(), url, hit.path("duration").asDouble(0)));
        }
        return out;
    }
}
