package com.dataops.costanomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of handing anomalies to the notification channel")
public class AlertDispatchResult {

    public enum Status {
        SENT,
        SKIPPED,
        DISABLED,
        PENDING,
        FAILED
    }

    @Schema(description = "Dispatch outcome", example = "SENT")
    private Status status;

    @Schema(description = "Notification channel", example = "sms")
    private String channel;

    @Schema(description = "Anomalies included in the alert", example = "3")
    private int alertsSent;

    @Schema(description = "CRITICAL anomalies included", example = "1")
    private int criticalAlerts;

    @Schema(description = "HIGH anomalies included", example = "2")
    private int highPriorityAlerts;

    @Schema(description = "Alerted anomaly count per severity")
    private Map<String, Integer> bySeverity;

    @Schema(description = "Provider message id or failure reason")
    private String message;

    public static AlertDispatchResult of(Status status, String channel, String message) {
        return AlertDispatchResult.builder()
                .status(status)
                .channel(channel)
                .message(message)
                .build();
    }
}
