package com.dataops.costanomaly.service;

import com.dataops.costanomaly.config.CostFeedConfig;
import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.exception.ValidationException;
import com.dataops.costanomaly.model.AnalysisRequest;
import com.dataops.costanomaly.model.Sensitivity;
import org.springframework.stereotype.Component;

/**
 * Checks request parameters and fills in configured defaults. Runs before any
 * series is fetched, so an invalid request never reaches the cost feed.
 */
@Component
public class RequestValidator {

    private final DetectionConfig detectionConfig;
    private final CostFeedConfig costFeedConfig;

    public RequestValidator(DetectionConfig detectionConfig, CostFeedConfig costFeedConfig) {
        this.detectionConfig = detectionConfig;
        this.costFeedConfig = costFeedConfig;
    }

    public AnalysisParameters validate(AnalysisRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required", "request");
        }

        int days = request.getDays() != null ? request.getDays() : detectionConfig.getDefaultLookbackDays();
        if (days < detectionConfig.getMinLookbackDays() || days > detectionConfig.getMaxLookbackDays()) {
            throw new ValidationException(String.format("Days must be between %d and %d",
                    detectionConfig.getMinLookbackDays(), detectionConfig.getMaxLookbackDays()), "days");
        }

        Sensitivity sensitivity = request.getSensitivity() != null
                ? Sensitivity.fromValue(request.getSensitivity())
                : Sensitivity.MEDIUM;

        double alertThreshold = request.getAlertThreshold() != null
                ? request.getAlertThreshold()
                : detectionConfig.getDefaultAlertThreshold();
        if (Double.isNaN(alertThreshold) || alertThreshold < 0
                || alertThreshold > detectionConfig.getMaxAlertThreshold()) {
            throw new ValidationException("Alert threshold must be between 0 and "
                    + detectionConfig.getMaxAlertThreshold(), "alertThreshold");
        }

        String sourceId = request.getSourceId() == null || request.getSourceId().isBlank()
                ? costFeedConfig.getSourceId()
                : request.getSourceId().trim();

        return AnalysisParameters.builder()
                .sourceId(sourceId)
                .days(days)
                .sensitivity(sensitivity)
                .thresholds(detectionConfig.thresholdsFor(sensitivity))
                .severityBands(detectionConfig.getSeverityBands().copy())
                .alertThreshold(alertThreshold)
                .sendAlert(request.isSendAlert())
                .build();
    }
}
