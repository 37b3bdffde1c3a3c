package com.dataops.costanomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Reachability of the cost time-series feed")
public class FeedHealth {

    @Schema(example = "analytics-prod")
    private String sourceId;

    @Schema(description = "True when a one-week series could be fetched and was non-empty", example = "true")
    private boolean healthy;

    @Schema(description = "Samples returned by the probe", example = "7")
    private int dataPoints;

    @Schema(description = "Probe failure reason")
    private String error;
}
