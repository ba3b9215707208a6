package com.example.shortsbot_backend.controller;

import com.example.shortsbot_backend.dto.web.ShortAnalyticsResponse;
import com.example.shortsbot_backend.service.analytics.ShortAnalyticsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AnalyticsController.class)
@AutoConfigureMockMvc(addFilters = false)
class AnalyticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ShortAnalyticsService analyticsService;

    @Test
    void updateReturnsScoredAnalytics() throws Exception {
        Instant now = Instant.parse("2026-03-10T12:00:00Z");
        when(analyticsService.updatePerformance("abc", "tiktok", 100, 10, 2, 1)).thenReturn(
                new ShortAnalyticsResponse("abc", "tiktok", "/a.mp4", 74.0, 1000, 100, 10, 2, 1,
                        133, "published", now, now));

        mockMvc.perform(put("/v1/analytics/abc/tiktok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"views\":100,\"likes\":10,\"shares\":2,\"comments\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.viralScore").value(133))
                .andExpect(jsonPath("$.status").value("published"));
    }

    @Test
    void negativeCountersAreRejected() throws Exception {
        mockMvc.perform(put("/v1/analytics/abc/tiktok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"views\":-1,\"likes\":0,\"shares\":0,\"comments\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void updateOfUnknownShortIsNotFound() throws Exception {
        when(analyticsService.updatePerformance("abc", "tiktok", 1, 0, 0, 0))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "none"));

        mockMvc.perform(put("/v1/analytics/abc/tiktok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"views\":1,\"likes\":0,\"shares\":0,\"comments\":0}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void platformStatsDefaultToThirtyDays() throws Exception {
        when(analyticsService.platformStats(30)).thenReturn(List.of());

        mockMvc.perform(get("/v1/analytics/platforms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(analyticsService).platformStats(30);
    }
}
