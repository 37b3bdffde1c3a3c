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
 * Compares each day against a trailing window of the days immediately before it,
 * catching local level shifts that a whole-period baseline would absorb.
 *
 * Window = min(7, n / 3). The current day is never part of its own window.
 * Needs at least 10 samples; windows with zero variance are skipped.
 * Confidence is capped at 0.9.
 */
@Component
public class RollingWindowDetector implements AnomalyDetector {

    static final String FACTOR = "trend_deviation";

    private final DetectionConfig config;
    private final DeviationScorer scorer;

    public RollingWindowDetector(DetectionConfig config, DeviationScorer scorer) {
        this.config = config;
        this.scorer = scorer;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.MOVING_AVERAGE;
    }

    @Override
    public List<CostAnomaly> detect(List<CostSample> series, DetectionConfig.Thresholds thresholds,
                                   DetectionConfig.SeverityBands bands) {
        DetectionConfig.Detectors params = config.getDetectors();
        int n = series.size();
        if (n < params.getRollingMinSamples()) {
            return Collections.emptyList();
        }

        int window = windowSize(n);
        if (window < 2) {
            return Collections.emptyList();
        }

        List<CostAnomaly> candidates = new ArrayList<>();
        for (int i = window; i < n; i++) {
            BaselineStats trailing = BaselineStats.ofCosts(series, i - window, i);
            scorer.score(series.get(i), trailing.getMean(), trailing.getStdDev(), thresholds, bands,
                            params.getRollingConfidenceCap(), getMethod(), FACTOR)
                    .ifPresent(candidates::add);
        }
        return candidates;
    }

    int windowSize(int sampleCount) {
        DetectionConfig.Detectors params = config.getDetectors();
        return Math.min(params.getRollingMaxWindow(), sampleCount / params.getRollingWindowDivisor());
    }
}
