package com.dataops.costanomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Forward-looking estimate of near-term cost anomaly risk")
public class RiskAssessment {

    public static final String TREND_INCREASING = "increasing";
    public static final String TREND_STABLE = "stable";

    @Schema(description = "Risk bucket derived from the score", example = "MEDIUM")
    private RiskLevel riskLevel;

    @Schema(description = "Sum of weighted risk factor points", example = "4")
    private int riskScore;

    @Schema(description = "Risk factors that contributed points",
            example = "[\"costs_trending_upward\", \"high_cost_volatility\"]")
    private List<String> riskFactors;

    @Schema(description = "Suggested preventive actions")
    private List<String> recommendations;

    @Schema(description = "Recent daily mean x 7", example = "1120.50")
    private double predictedWeeklyCost;

    @Schema(description = "Cost trend label", example = "increasing", allowableValues = {"increasing", "stable"})
    private String costTrend;
}
