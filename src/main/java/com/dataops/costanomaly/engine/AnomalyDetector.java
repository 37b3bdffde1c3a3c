package com.dataops.costanomaly.engine;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DetectionMethod;

import java.util.List;

/**
 * Interface for all cost anomaly detectors.
 * Each implementation models the expected cost with a different baseline.
 */
public interface AnomalyDetector {

    /**
     * The baseline model this detector implements.
     */
    DetectionMethod getMethod();

    /**
     * Scan a daily cost series and emit candidate anomalies.
     * Implementations must not mutate the series and must not keep state between calls.
     *
     * @param series     daily samples, ascending by date, at most one per date
     * @param thresholds z-score and deviation thresholds for the requested sensitivity
     * @param bands      severity bands in force for this run
     * @return candidates in series order, at most one per date
     */
    List<CostAnomaly> detect(List<CostSample> series, DetectionConfig.Thresholds thresholds,
                             DetectionConfig.SeverityBands bands);
}
