package com.dataops.costanomaly.controller;

import com.dataops.costanomaly.config.CostFeedConfig;
import com.dataops.costanomaly.model.FeedHealth;
import com.dataops.costanomaly.service.CostAnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/feed")
@Tag(name = "Feed", description = "Cost feed reachability")
public class FeedHealthController {

    private final CostAnomalyDetectionService detectionService;
    private final CostFeedConfig costFeedConfig;

    public FeedHealthController(CostAnomalyDetectionService detectionService, CostFeedConfig costFeedConfig) {
        this.detectionService = detectionService;
        this.costFeedConfig = costFeedConfig;
    }

    @Operation(summary = "Check the cost feed",
            description = "Fetches the last 7 days for the source. healthy=false with an error message " +
                    "when the feed fails or returns nothing.")
    @GetMapping("/health")
    public ResponseEntity<FeedHealth> health(
            @Parameter(description = "Cost source; defaults to cost-feed.source-id", example = "analytics-prod")
            @RequestParam(required = false) String sourceId) {
        String source = sourceId == null || sourceId.isBlank() ? costFeedConfig.getSourceId() : sourceId;
        return ResponseEntity.ok(detectionService.checkFeedHealth(source));
    }
}
