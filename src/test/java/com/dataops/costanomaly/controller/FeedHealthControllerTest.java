package com.dataops.costanomaly.controller;

import com.dataops.costanomaly.config.CostFeedConfig;
import com.dataops.costanomaly.model.FeedHealth;
import com.dataops.costanomaly.service.CostAnomalyDetectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FeedHealthController.class)
class FeedHealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CostAnomalyDetectionService detectionService;

    @MockBean
    private CostFeedConfig costFeedConfig;

    @Test
    void health_namedSource() throws Exception {
        when(detectionService.checkFeedHealth("analytics-prod")).thenReturn(FeedHealth.builder()
                .sourceId("analytics-prod").healthy(true).dataPoints(7).build());

        mockMvc.perform(get("/api/v1/feed/health").param("sourceId", "analytics-prod"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthy").value(true))
                .andExpect(jsonPath("$.dataPoints").value(7))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void health_defaultSourceAndFailure() throws Exception {
        when(costFeedConfig.getSourceId()).thenReturn("default");
        when(detectionService.checkFeedHealth("default")).thenReturn(FeedHealth.builder()
                .sourceId("default").healthy(false).dataPoints(0).error("Connection refused").build());

        mockMvc.perform(get("/api/v1/feed/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceId").value("default"))
                .andExpect(jsonPath("$.healthy").value(false))
                .andExpect(jsonPath("$.error").value("Connection refused"));
    }
}
