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

class SeasonalDayOfWeekDetectorTest {

    private SeasonalDayOfWeekDetector detector;

    @BeforeEach
    void setUp() {
        DetectionConfig config = new DetectionConfig();
        detector = new SeasonalDayOfWeekDetector(config, new DeviationScorer(config));
    }

    @Test
    void getMethod_returnsSeasonalDayOfWeek() {
        assertThat(detector.getMethod()).isEqualTo(DetectionMethod.SEASONAL_DAY_OF_WEEK);
    }

    @Test
    void consistentlyHeavyWeekday_isNotFlagged() {
        assertThat(detector.detect(TestDataFactory.heavyMondaySeries(), TestDataFactory.medium(), TestDataFactory.bands())).isEmpty();
    }

    @Test
    void outlierWithinItsWeekday_isFlagged() {
        // eight weeks; Mondays cost 20 except the last one at 80
        double[] costs = new double[56];
        Arrays.fill(costs, 10.0);
        for (int i = 0; i < 56; i += 7) {
            costs[i] = 20.0;
        }
        costs[49] = 80.0;

        List<CostAnomaly> result = detector.detect(TestDataFactory.createSeries(costs), TestDataFactory.medium(), TestDataFactory.bands());

        assertThat(result).hasSize(1);
        CostAnomaly anomaly = result.get(0);
        assertThat(anomaly.getDate()).isEqualTo(LocalDate.of(2024, 2, 19));
        assertThat(anomaly.getExpectedCost()).isCloseTo(27.5, within(1e-9));
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        // z is about 2.47; min(z / 3, 0.8) hits the cap
        assertThat(anomaly.getConfidenceScore()).isEqualTo(0.8);
        assertThat(anomaly.getContributingFactors()).containsExactly("unusual_monday_pattern");
        assertThat(anomaly.getAnomalyId()).isEqualTo("seasonal_day_of_week-2024-02-19");
    }

    @Test
    void singleObservationPerWeekday_noBaseline() {
        List<CostSample> oneWeek = TestDataFactory.createSeries(10, 10, 10, 10, 10, 10, 500);

        assertThat(detector.detect(oneWeek, TestDataFactory.high(), TestDataFactory.bands())).isEmpty();
    }

    @Test
    void factorFor_usesFeedNumberingWithSundayFirst() {
        assertThat(SeasonalDayOfWeekDetector.factorFor(1)).isEqualTo("unusual_sunday_pattern");
        assertThat(SeasonalDayOfWeekDetector.factorFor(2)).isEqualTo("unusual_monday_pattern");
        assertThat(SeasonalDayOfWeekDetector.factorFor(7)).isEqualTo("unusual_saturday_pattern");
    }

    @Test
    void dayOfWeekOf_mapsCalendarDatesToFeedNumbering() {
        assertThat(CostSample.dayOfWeekOf(LocalDate.of(2024, 1, 7))).isEqualTo(1);  // Sunday
        assertThat(CostSample.dayOfWeekOf(LocalDate.of(2024, 1, 1))).isEqualTo(2);  // Monday
        assertThat(CostSample.dayOfWeekOf(LocalDate.of(2024, 1, 6))).isEqualTo(7);  // Saturday
    }
}
