package com.dataops.costanomaly.config;

import com.dataops.costanomaly.exception.ValidationException;
import com.dataops.costanomaly.model.Sensitivity;
import com.dataops.costanomaly.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Accepted lookback window, inclusive on both ends.
    private int minLookbackDays = 7;
    private int maxLookbackDays = 90;
    private int defaultLookbackDays = 30;

    // Fewer samples than this is reported as INSUFFICIENT_DATA, never as "no anomalies".
    private int minDataPoints = 7;

    // Fractional deviation below which merged candidates are dropped.
    // The runtime-tunable fields are replaced wholesale by PUT /api/config/detection.
    private volatile double defaultAlertThreshold = 0.25;
    private double maxAlertThreshold = 10.0;

    // Resource every detector attributes its candidates to.
    private String defaultAffectedResource = "bigquery";

    // Run the three detectors on the detection executor instead of the calling thread.
    private boolean parallelDetectors = true;
    private int detectorPoolSize = 3;

    private volatile Map<Sensitivity, Thresholds> sensitivity = defaultSensitivity();

    private volatile SeverityBands severityBands = new SeverityBands();

    private Detectors detectors = new Detectors();

    private Enrichment enrichment = new Enrichment();

    private Summary summary = new Summary();

    private Risk risk = new Risk();

    public Thresholds thresholdsFor(Sensitivity level) {
        Thresholds thresholds = sensitivity.get(level);
        if (thresholds == null) {
            throw new ValidationException("No thresholds configured for sensitivity: " + level.value(), "sensitivity");
        }
        return thresholds;
    }

    private static Map<Sensitivity, Thresholds> defaultSensitivity() {
        Map<Sensitivity, Thresholds> map = new EnumMap<>(Sensitivity.class);
        map.put(Sensitivity.LOW, new Thresholds(2.5, 0.5));
        map.put(Sensitivity.MEDIUM, new Thresholds(2.0, 0.3));
        map.put(Sensitivity.HIGH, new Thresholds(1.5, 0.2));
        return map;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        // Minimum |actual - expected| / stdev
        private double zScore;
        // Minimum |actual - expected| / expected, as a fraction
        private double deviationThreshold;
    }

    /**
     * Lower bounds (in percent) of the MEDIUM, HIGH and CRITICAL bands.
     * Everything below {@code mediumFromPct} is LOW; CRITICAL is open-ended.
     */
    @Data
    public static class SeverityBands {
        private double mediumFromPct = 30.0;
        private double highFromPct = 60.0;
        private double criticalFromPct = 100.0;

        public Severity classify(double deviationPct) {
            if (deviationPct >= criticalFromPct) return Severity.CRITICAL;
            if (deviationPct >= highFromPct) return Severity.HIGH;
            if (deviationPct >= mediumFromPct) return Severity.MEDIUM;
            return Severity.LOW;
        }

        public boolean isOrdered() {
            return mediumFromPct >= 0 && mediumFromPct < highFromPct && highFromPct < criticalFromPct;
        }

        public SeverityBands copy() {
            SeverityBands copy = new SeverityBands();
            copy.setMediumFromPct(mediumFromPct);
            copy.setHighFromPct(highFromPct);
            copy.setCriticalFromPct(criticalFromPct);
            return copy;
        }
    }

    @Data
    public static class Detectors {
        // Confidence = min(z / confidenceDivisor, detector cap)
        private double confidenceDivisor = 3.0;
        private double globalConfidenceCap = 1.0;

        private int rollingMinSamples = 10;
        private int rollingMaxWindow = 7;
        // Window = min(rollingMaxWindow, n / rollingWindowDivisor)
        private int rollingWindowDivisor = 3;
        private double rollingConfidenceCap = 0.9;

        private int seasonalMinBucketSamples = 2;
        private double seasonalConfidenceCap = 0.8;
    }

    @Data
    public static class Enrichment {
        private boolean parallel = true;
        private int poolSize = 4;
        // Deadline for the whole enrichment stage; outstanding lookups fall back.
        private long timeoutMs = 10_000;

        private double topUserCostThreshold = 50.0;
        private double queryVolumeMultiplier = 2.0;
        private double maxQueryCostThreshold = 25.0;
        private double datasetConcentrationThreshold = 0.8;

        private List<String> fallbackRemediation = new ArrayList<>(List.of(
                "Review warehouse audit logs for the anomaly date",
                "Check for scheduled batch jobs or ETL processes",
                "Verify if data volume changes occurred in source tables",
                "Contact users with high usage on the anomaly date"));
    }

    @Data
    public static class Summary {
        private int topFactorLimit = 5;
        private double systemicRateThreshold = 0.2;
        private double excessCostCallout = 100.0;
    }

    @Data
    public static class Risk {
        private int recentWindowDays = 7;

        private double trendRatio = 1.2;
        private int trendPoints = 2;

        // Strictly more than this many anomalies in the recent window scores points.
        private int recentAnomalyLimit = 2;
        private int frequencyPoints = 3;

        private double volatilityThreshold = 0.4;
        private int volatilityPoints = 2;

        private int highScore = 5;
        private int mediumScore = 3;

        private double increasingTrendRatio = 1.1;
    }
}
