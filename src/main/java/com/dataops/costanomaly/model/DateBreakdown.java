package com.dataops.costanomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Per-date cost detail used to explain an anomaly")
public class DateBreakdown {

    @Schema(description = "Day the breakdown covers", example = "2024-03-05")
    LocalDate date;

    @Schema(description = "Total cost attributed on that day", example = "412.80")
    double totalCost;

    @Schema(description = "Queries run on that day", example = "5120")
    long queryCount;

    @Schema(description = "User with the highest cost", example = "etl-runner@example.com")
    String topUser;

    @Schema(description = "Cost attributed to the top user", example = "260.10")
    double topUserCost;

    @Schema(description = "Cost of the most expensive single query", example = "48.20")
    double maxQueryCost;

    @Schema(description = "Up to three datasets with the highest cost, most expensive first")
    List<String> topDatasets;

    @Schema(description = "Top dataset cost / total cost for that day", example = "0.86")
    double datasetConcentration;
}
