package com.dataops.costanomaly.service;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.model.Sensitivity;
import lombok.Builder;
import lombok.Value;

/**
 * A validated request with every default resolved.
 */
@Value
@Builder
public class AnalysisParameters {
    String sourceId;
    int days;
    Sensitivity sensitivity;
    DetectionConfig.Thresholds thresholds;
    // Copied when the request is validated; a run never sees a later config update.
    DetectionConfig.SeverityBands severityBands;
    double alertThreshold;
    boolean sendAlert;
}
