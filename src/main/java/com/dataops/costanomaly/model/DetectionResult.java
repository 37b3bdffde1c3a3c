package com.dataops.costanomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Envelope returned by every detection run, successful or not")
public class DetectionResult {

    @Schema(description = "Whether detection completed", example = "true")
    private boolean success;

    @Schema(description = "Anomalies ordered by severity, then deviation")
    private List<CostAnomaly> anomaliesDetected;

    private AnomalySummary summary;

    private RiskAssessment riskAssessment;

    private AnalysisMetadata analysisMetadata;

    @Schema(description = "Present when an alert was requested. Dispatch problems never flip success.")
    private AlertDispatchResult alertStatus;

    @Schema(description = "Failure message", example = "Days must be between 7 and 90")
    private String error;

    @Schema(description = "Failure classification", example = "VALIDATION_ERROR")
    private ErrorType errorType;

    @Schema(description = "Samples the provider returned, reported for INSUFFICIENT_DATA", example = "5")
    private Integer dataPointsAvailable;

    public static DetectionResult failure(ErrorType errorType, String error) {
        return DetectionResult.builder()
                .success(false)
                .errorType(errorType)
                .error(error)
                .build();
    }
}
