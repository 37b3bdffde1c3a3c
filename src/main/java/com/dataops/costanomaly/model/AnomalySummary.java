package com.dataops.costanomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Descriptive statistics over the detected anomalies")
public class AnomalySummary {

    @Schema(description = "Number of anomalies after merge and filtering", example = "3")
    private int totalAnomalies;

    @Schema(description = "Anomalies / analysed days", example = "0.1")
    private double anomalyRate;

    @Schema(description = "Sum of max(0, actual - expected) across anomalies", example = "512.44")
    private double totalExcessCost;

    @Schema(description = "Anomaly count per severity, most severe first", example = "{\"CRITICAL\": 1, \"HIGH\": 2}")
    private Map<String, Integer> severityBreakdown;

    @Schema(description = "Up to five most frequent contributing factors")
    private List<String> mostCommonFactors;

    @Schema(description = "Earliest and latest anomaly dates")
    private DateRange dateRange;

    @Schema(description = "Operator-facing narrative")
    private List<String> insights;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DateRange {
        private LocalDate firstAnomaly;
        private LocalDate lastAnomaly;
    }
}
