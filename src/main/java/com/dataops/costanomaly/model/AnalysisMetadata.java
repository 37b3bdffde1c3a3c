package com.dataops.costanomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Parameters and provenance of a detection run")
public class AnalysisMetadata {

    @Schema(description = "Source the series was fetched for", example = "analytics-prod")
    private String sourceId;

    @Schema(description = "Requested lookback in days", example = "30")
    private int analysisPeriodDays;

    @Schema(description = "Sensitivity level used", example = "medium")
    private String sensitivity;

    @Schema(description = "Minimum fractional deviation reported", example = "0.25")
    private double alertThreshold;

    @Schema(description = "Detector tags that completed", example = "[\"statistical_z_score\", \"moving_average\", \"seasonal_day_of_week\"]")
    private List<String> detectionMethods;

    @Schema(description = "Number of daily samples analysed", example = "30")
    private int totalDataPoints;

    @Schema(description = "Wall-clock time of the analysis", example = "2024-03-06T08:15:30Z")
    private Instant analyzedAt;
}
