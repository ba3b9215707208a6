package com.example.shortsbot_backend.service.background;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StockProviderParseTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void pexelsPrefersLargestPortraitFile() throws Exception {
        JsonNode root = om.readTree("""
                {"videos":[
                  {"id":11,"duration":14,"video_files":[
                    {"link":"https://p/land.mp4","width":1920,"height":1080},
                    {"link":"https://p/small.mp4","width":540,"height":960},
                    {"link":"https://p/hd.mp4","width":1080,"height":1920},
                    {"link":"https://p/uhd.mp4","width":2160,"height":3840}]},
                  {"id":12,"duration":9,"video_files":[
                    {"link":"https://p/only-land.mp4","width":1280,"height":720}]},
                  {"id":13,"video_files":[]}
                ]}
                """);

        List<StockVideo> videos = PexelsStockProvider.parse(root);

        assertThat(videos).hasSize(2);
        assertThat(videos.get(0)).isEqualTo(new StockVideo("pexels", "11", "https://p/hd.mp4", 14));
        assertThat(videos.get(1).downloadUrl()).isEqualTo("https://p/only-land.mp4");
    }

    @Test
    void pixabayFallsBackToMediumRendition() throws Exception {
        JsonNode root = om.readTree("""
                {"hits":[
                  {"id":1,"duration":20,"videos":{"large":{"url":"https://x/large.mp4"},"medium":{"url":"https://x/m1.mp4"}}},
                  {"id":2,"duration":15,"videos":{"large":{"url":""},"medium":{"url":"https://x/m2.mp4"}}},
                  {"id":3,"duration":15,"videos":{}}
                ]}
                """);

        List<StockVideo> videos = PixabayStockProvider.parse(root);

        assertThat(videos).extracting(StockVideo::downloadUrl)
                .containsExactly("https://x/large.mp4", "https://x/m2.mp4");
        assertThat(videos).allMatch(v -> v.source().equals("pixabay"));
    }
}
