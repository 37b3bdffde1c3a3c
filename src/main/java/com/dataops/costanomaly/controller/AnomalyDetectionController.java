package com.dataops.costanomaly.controller;

import com.dataops.costanomaly.model.AnalysisRequest;
import com.dataops.costanomaly.model.DetectionResult;
import com.dataops.costanomaly.service.CostAnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Detect cost anomalies in the daily warehouse spend series")
public class AnomalyDetectionController {

    private final CostAnomalyDetectionService detectionService;

    public AnomalyDetectionController(CostAnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Run cost anomaly detection",
            description = "Fetches the daily cost series, runs the statistical, rolling-window and " +
                    "day-of-week detectors, merges their findings per date and enriches each anomaly " +
                    "with root-cause context. Returns anomalies, summary, risk assessment and metadata. " +
                    "Failures are returned in the same envelope with success=false and an errorType.")
    @PostMapping("/detect")
    public ResponseEntity<DetectionResult> detect(@RequestBody(required = false) AnalysisRequest request) {
        return toResponse(detectionService.detect(request != null ? request : new AnalysisRequest()));
    }

    @Operation(summary = "Run cost anomaly detection with query parameters",
            description = "Same as POST /detect. Omitted parameters fall back to configured defaults.")
    @GetMapping("/detect")
    public ResponseEntity<DetectionResult> detectWithParams(
            @Parameter(description = "Cost source", example = "analytics-prod")
            @RequestParam(required = false) String sourceId,
            @Parameter(description = "Lookback window in days (7-90)", example = "30")
            @RequestParam(required = false) Integer days,
            @Parameter(description = "low, medium or high", example = "medium")
            @RequestParam(required = false) String sensitivity,
            @Parameter(description = "Minimum fractional deviation to report", example = "0.25")
            @RequestParam(required = false) Double alertThreshold,
            @Parameter(description = "Dispatch an alert digest", example = "false")
            @RequestParam(defaultValue = "false") boolean sendAlert) {
        AnalysisRequest request = AnalysisRequest.builder()
                .sourceId(sourceId)
                .days(days)
                .sensitivity(sensitivity)
                .alertThreshold(alertThreshold)
                .sendAlert(sendAlert)
                .build();
        return toResponse(detectionService.detect(request));
    }

    static HttpStatus statusFor(DetectionResult result) {
        if (result.isSuccess()) {
            return HttpStatus.OK;
        }
        if (result.getErrorType() == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        switch (result.getErrorType()) {
            case VALIDATION_ERROR:
                return HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_DATA:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case PROVIDER_ERROR:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<DetectionResult> toResponse(DetectionResult result) {
        return ResponseEntity.status(statusFor(result)).body(result);
    }
}
