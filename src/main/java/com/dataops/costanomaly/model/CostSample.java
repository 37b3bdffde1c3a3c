package com.dataops.costanomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "One day of aggregated warehouse cost and usage")
public class CostSample {

    @Schema(description = "Calendar day", example = "2024-03-05")
    LocalDate date;

    @Schema(description = "Total on-demand cost for the day in USD", example = "142.37")
    double cost;

    @Schema(description = "Number of completed queries", example = "1840")
    long queryCount;

    @Schema(description = "Distinct users who ran queries", example = "37")
    long uniqueUsers;

    @Schema(description = "Average query duration in milliseconds", example = "5230.5")
    double avgDurationMs;

    @Schema(description = "Cost of the single most expensive query of the day", example = "18.75")
    double maxSingleQueryCost;

    @Schema(description = "Day of week as reported by the billing feed, 1 = Sunday .. 7 = Saturday", example = "3")
    int dayOfWeek;

    /**
     * Converts a calendar date to the feed's day-of-week numbering (1 = Sunday .. 7 = Saturday).
     */
    public static int dayOfWeekOf(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7 + 1;
    }
}
