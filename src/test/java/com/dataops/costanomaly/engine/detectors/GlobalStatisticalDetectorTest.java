package com.dataops.costanomaly.engine.detectors;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.engine.DeviationScorer;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DetectionMethod;
import com.dataops.costanomaly.model.Severity;
import com.dataops.costanomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GlobalStatisticalDetectorTest {

    private GlobalStatisticalDetector detector;

    @BeforeEach
    void setUp() {
        DetectionConfig config = new DetectionConfig();
        detector = new GlobalStatisticalDetector(config, new DeviationScorer(config));
    }

    @Test
    void getMethod_returnsStatisticalZScore() {
        assertThat(detector.getMethod()).isEqualTo(DetectionMethod.STATISTICAL_Z_SCORE);
    }

    @Test
    void singleSpike_flaggedAsCritical() {
        List<CostAnomaly> result = detector.detect(TestDataFactory.spikeSeries(), TestDataFactory.medium(), TestDataFactory.bands());

        assertThat(result).hasSize(1);
        CostAnomaly anomaly = result.get(0);
        assertThat(anomaly.getDate()).isEqualTo(LocalDate.of(2024, 1, 14));
        assertThat(anomaly.getActualCost()).isEqualTo(100.0);
        assertThat(anomaly.getExpectedCost()).isCloseTo(230.0 / 14.0, within(1e-9));
        assertThat(anomaly.getDeviationPercentage()).isCloseTo(508.7, within(0.1));
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        // z is about 3.47, so min(z / 3, 1) saturates
        assertThat(anomaly.getConfidenceScore()).isEqualTo(1.0);
        assertThat(anomaly.getContributingFactors()).containsExactly("statistical_deviation");
        assertThat(anomaly.getAnomalyId()).isEqualTo("statistical_z_score-2024-01-14");
    }

    @Test
    void constantSeries_noCandidatesAtAnySensitivity() {
        List<CostSample> flat = TestDataFactory.constantSeries(14, 10.0);

        assertThat(detector.detect(flat, TestDataFactory.low(), TestDataFactory.bands())).isEmpty();
        assertThat(detector.detect(flat, TestDataFactory.medium(), TestDataFactory.bands())).isEmpty();
        assertThat(detector.detect(flat, TestDataFactory.high(), TestDataFactory.bands())).isEmpty();
    }

    @Test
    void largeRelativeMoveInNoisySeries_doesNotFire() {
        // every point is 50% off the mean but z is below 1
        List<CostSample> noisy =
                TestDataFactory.createSeries(10, 30, 10, 30, 10, 30, 10, 30);

        assertThat(detector.detect(noisy, TestDataFactory.high(), TestDataFactory.bands())).isEmpty();
    }

    @Test
    void statisticallyUnusualButTinyMove_doesNotFire() {
        double[] costs = new double[14];
        Arrays.fill(costs, 100.0);
        costs[13] = 101.0;

        assertThat(detector.detect(TestDataFactory.createSeries(costs), TestDataFactory.high(), TestDataFactory.bands())).isEmpty();
    }

    @Test
    void lowSensitivity_stillCatchesLargeSpike() {
        assertThat(detector.detect(TestDataFactory.spikeSeries(), TestDataFactory.low(), TestDataFactory.bands())).hasSize(1);
    }
}
