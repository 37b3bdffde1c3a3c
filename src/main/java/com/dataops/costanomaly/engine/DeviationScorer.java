package com.dataops.costanomaly.engine;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DetectionMethod;
import com.dataops.costanomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies the dual-threshold test shared by every detector: a sample is anomalous
 * only when it is both statistically unusual (z-score) and materially different
 * (relative deviation) from the detector's baseline.
 *
 * Example: baseline mean=100, stdev=20, medium sensitivity (z>=2.0, deviation>=0.3).
 * A cost of 145 has z=2.25 and deviation=0.45, so it fires as MEDIUM with
 * confidence min(2.25/3, cap)=0.75.
 */
@Component
public class DeviationScorer {

    private final DetectionConfig config;

    public DeviationScorer(DetectionConfig config) {
        this.config = config;
    }

    /**
     * Score one sample against a baseline.
     *
     * @param sample        the observed day
     * @param expected      baseline mean
     * @param stdDev        baseline standard deviation; must be positive
     * @param thresholds    sensitivity thresholds
     * @param bands         severity bands for the run
     * @param confidenceCap upper bound on confidence for this detector
     * @param method        detector producing the candidate
     * @param factor        detector-specific contributing factor
     * @return a candidate if both thresholds are met, empty otherwise
     */
    public Optional<CostAnomaly> score(CostSample sample, double expected, double stdDev,
                                       DetectionConfig.Thresholds thresholds,
                                       DetectionConfig.SeverityBands bands, double confidenceCap,
                                       DetectionMethod method, String factor) {
        if (stdDev <= 0) {
            return Optional.empty();
        }

        double actual = sample.getCost();
        double distance = Math.abs(actual - expected);
        double zScore = distance / stdDev;
        double deviation = expected > 0 ? distance / expected : 0.0;

        if (zScore < thresholds.getZScore() || deviation < thresholds.getDeviationThreshold()) {
            return Optional.empty();
        }

        double deviationPct = deviation * 100.0;
        Severity severity = bands.classify(deviationPct);
        double confidence = confidence(zScore, confidenceCap);

        List<String> factors = new ArrayList<>();
        factors.add(factor);
        List<String> resources = new ArrayList<>();
        resources.add(config.getDefaultAffectedResource());

        return Optional.of(CostAnomaly.builder()
                .anomalyId(CostAnomaly.idFor(method.getTag(), sample.getDate()))
                .date(sample.getDate())
                .actualCost(actual)
                .expectedCost(expected)
                .deviationPercentage(deviationPct)
                .severity(severity)
                .confidenceScore(confidence)
                .detectionMethod(method.getTag())
                .contributingFactors(factors)
                .affectedResources(resources)
                .remediationSteps(new ArrayList<>())
                .build());
    }

    double confidence(double zScore, double confidenceCap) {
        double raw = zScore / config.getDetectors().getConfidenceDivisor();
        double capped = Math.min(raw, confidenceCap);
        return Math.max(0.0, Math.min(1.0, capped));
    }
}
