package com.dataops.costanomaly.engine.detectors;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.engine.AnomalyDetector;
import com.dataops.costanomaly.engine.BaselineStats;
import com.dataops.costanomaly.engine.DeviationScorer;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compares every day against the mean and sample standard deviation of the
 * whole lookback window.
 *
 * A constant series (stdev = 0) yields no candidates.
 * Confidence = min(z / 3, 1.0).
 */
@Component
public class GlobalStatisticalDetector implements AnomalyDetector {

    static final String FACTOR = "statistical_deviation";

    private final DetectionConfig config;
    private final DeviationScorer scorer;

    public GlobalStatisticalDetector(DetectionConfig config, DeviationScorer scorer) {
        this.config = config;
        this.scorer = scorer;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.STATISTICAL_Z_SCORE;
    }

    @Override
    public List<CostAnomaly> detect(List<CostSample> series, DetectionConfig.Thresholds thresholds,
                                   DetectionConfig.SeverityBands bands) {
        BaselineStats stats = BaselineStats.ofCosts(series);
        if (stats.getStdDev() == 0.0) {
            return Collections.emptyList();
        }

        double cap = config.getDetectors().getGlobalConfidenceCap();
        List<CostAnomaly> candidates = new ArrayList<>();
        for (CostSample sample : series) {
            scorer.score(sample, stats.getMean(), stats.getStdDev(), thresholds, bands, cap, getMethod(), FACTOR)
                    .ifPresent(candidates::add);
        }
        return candidates;
    }
}
