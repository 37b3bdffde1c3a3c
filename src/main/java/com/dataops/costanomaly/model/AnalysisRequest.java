package com.dataops.costanomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Parameters for a cost anomaly detection run")
public class AnalysisRequest {

    @Schema(description = "Cost source to analyse. Defaults to cost-feed.source-id.", example = "analytics-prod")
    private String sourceId;

    @Schema(description = "Lookback window in days (7-90). Defaults to detection.default-lookback-days.", example = "30")
    private Integer days;

    @Schema(description = "Detection sensitivity", example = "medium", allowableValues = {"low", "medium", "high"})
    private String sensitivity;

    @Schema(description = "Minimum fractional deviation to report. Defaults to detection.default-alert-threshold.", example = "0.25")
    private Double alertThreshold;

    @Schema(description = "Dispatch an alert digest when anomalies are found", example = "false")
    private boolean sendAlert;
}
