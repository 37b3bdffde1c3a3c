package com.dataops.costanomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A day whose cost deviated from the expected baseline")
public class CostAnomaly {

    @Schema(description = "Deterministic key: detection method tag(s) and date",
            example = "statistical_z_score+moving_average-2024-03-05")
    private String anomalyId;

    @Schema(description = "Anomalous day", example = "2024-03-05")
    private LocalDate date;

    @Schema(description = "Observed cost for the day", example = "412.80")
    private double actualCost;

    @Schema(description = "Baseline cost the detector expected", example = "138.15")
    private double expectedCost;

    @Schema(description = "|actual - expected| / expected as a percentage; 0 when expected is 0", example = "198.8")
    private double deviationPercentage;

    @Schema(description = "Severity band containing the deviation", example = "CRITICAL")
    private Severity severity;

    @Schema(description = "Normalized anomaly strength in [0, 1]", example = "0.9")
    private double confidenceScore;

    @Schema(description = "Detector tag, or several tags joined with '+' when detectors agreed",
            example = "statistical_z_score+moving_average")
    private String detectionMethod;

    @Builder.Default
    @Schema(description = "Distinct signals explaining the anomaly",
            example = "[\"statistical_deviation\", \"high_cost_single_user\"]")
    private List<String> contributingFactors = new ArrayList<>();

    @Builder.Default
    @Schema(description = "Warehouse resources involved", example = "[\"bigquery\", \"analytics_raw\"]")
    private List<String> affectedResources = new ArrayList<>();

    @Builder.Default
    @Schema(description = "Suggested operator actions")
    private List<String> remediationSteps = new ArrayList<>();

    public static String idFor(String detectionMethod, LocalDate date) {
        return detectionMethod + "-" + date;
    }

    public void addContributingFactor(String factor) {
        if (!contributingFactors.contains(factor)) {
            contributingFactors.add(factor);
        }
    }

    public void addAffectedResource(String resource) {
        if (!affectedResources.contains(resource)) {
            affectedResources.add(resource);
        }
    }
}
