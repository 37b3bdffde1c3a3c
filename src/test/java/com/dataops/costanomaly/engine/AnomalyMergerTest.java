package com.dataops.costanomaly.engine;

import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.Severity;
import com.dataops.costanomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyMergerTest {

    private static final LocalDate D1 = LocalDate.of(2024, 1, 5);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 6);
    private static final LocalDate D3 = LocalDate.of(2024, 1, 7);

    private final AnomalyMerger merger = new AnomalyMerger();

    @Test
    void filter_dropsCandidatesBelowAlertThreshold() {
        List<CostAnomaly> candidates = List.of(
                TestDataFactory.createAnomaly(D1, "statistical_z_score", Severity.LOW, 24.9, 0.9, "statistical_deviation"),
                TestDataFactory.createAnomaly(D2, "statistical_z_score", Severity.LOW, 25.0, 0.9, "statistical_deviation"));

        List<CostAnomaly> result = merger.mergeFilterSort(candidates, 0.25);

        assertThat(result).extracting(CostAnomaly::getDate).containsExactly(D2);
    }

    @Test
    void sameDate_mergedIntoMostConfidentCandidate() {
        List<CostAnomaly> candidates = List.of(
                TestDataFactory.createAnomaly(D1, "statistical_z_score", Severity.HIGH, 80.0, 0.7, "statistical_deviation"),
                TestDataFactory.createAnomaly(D1, "moving_average", Severity.CRITICAL, 150.0, 0.9, "trend_deviation"),
                TestDataFactory.createAnomaly(D1, "seasonal_day_of_week", Severity.HIGH, 90.0, 0.8, "unusual_friday_pattern"));

        List<CostAnomaly> result = merger.mergeFilterSort(candidates, 0.25);

        assertThat(result).hasSize(1);
        CostAnomaly merged = result.get(0);
        assertThat(merged.getDetectionMethod())
                .isEqualTo("statistical_z_score+moving_average+seasonal_day_of_week");
        assertThat(merged.getAnomalyId())
                .isEqualTo("statistical_z_score+moving_average+seasonal_day_of_week-2024-01-05");
        assertThat(merged.getConfidenceScore()).isEqualTo(0.9);
        assertThat(merged.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(merged.getDeviationPercentage()).isEqualTo(150.0);
        assertThat(merged.getContributingFactors())
                .containsExactly("statistical_deviation", "trend_deviation", "unusual_friday_pattern");
        assertThat(merged.getAffectedResources()).containsExactly("bigquery");
    }

    @Test
    void confidenceTie_keepsEarlierDetector() {
        List<CostAnomaly> candidates = List.of(
                TestDataFactory.createAnomaly(D1, "statistical_z_score", Severity.HIGH, 70.0, 0.8, "statistical_deviation"),
                TestDataFactory.createAnomaly(D1, "seasonal_day_of_week", Severity.CRITICAL, 120.0, 0.8, "unusual_friday_pattern"));

        CostAnomaly merged = merger.mergeFilterSort(candidates, 0.25).get(0);

        assertThat(merged.getDeviationPercentage()).isEqualTo(70.0);
        assertThat(merged.getDetectionMethod()).isEqualTo("statistical_z_score+seasonal_day_of_week");
    }

    @Test
    void subThresholdCandidate_doesNotContributeItsMethod() {
        List<CostAnomaly> candidates = List.of(
                TestDataFactory.createAnomaly(D1, "statistical_z_score", Severity.LOW, 20.0, 0.95, "statistical_deviation"),
                TestDataFactory.createAnomaly(D1, "moving_average", Severity.MEDIUM, 40.0, 0.9, "trend_deviation"));

        CostAnomaly merged = merger.mergeFilterSort(candidates, 0.25).get(0);

        assertThat(merged.getDetectionMethod()).isEqualTo("moving_average");
        assertThat(merged.getAnomalyId()).isEqualTo("moving_average-2024-01-05");
    }

    @Test
    void sort_bySeverityThenDeviationThenDate() {
        List<CostAnomaly> candidates = List.of(
                TestDataFactory.createAnomaly(D3, "statistical_z_score", Severity.HIGH, 70.0, 0.9, "statistical_deviation"),
                TestDataFactory.createAnomaly(D1, "statistical_z_score", Severity.HIGH, 90.0, 0.9, "statistical_deviation"),
                TestDataFactory.createAnomaly(D2, "statistical_z_score", Severity.HIGH, 70.0, 0.9, "statistical_deviation"),
                TestDataFactory.createAnomaly(LocalDate.of(2024, 1, 8), "statistical_z_score", Severity.CRITICAL, 101.0, 0.9,
                        "statistical_deviation"));

        List<CostAnomaly> result = merger.mergeFilterSort(candidates, 0.25);

        assertThat(result).extracting(CostAnomaly::getDate)
                .containsExactly(LocalDate.of(2024, 1, 8), D1, D2, D3);
    }

    @Test
    void merge_doesNotModifyInputCandidates() {
        CostAnomaly global = TestDataFactory.createAnomaly(D1, "statistical_z_score", Severity.HIGH, 80.0, 0.9, "statistical_deviation");
        CostAnomaly rolling = TestDataFactory.createAnomaly(D1, "moving_average", Severity.HIGH, 80.0, 0.6, "trend_deviation");

        CostAnomaly merged = merger.mergeFilterSort(List.of(global, rolling), 0.25).get(0);
        merged.getRemediationSteps().add("step");

        assertThat(global.getDetectionMethod()).isEqualTo("statistical_z_score");
        assertThat(global.getContributingFactors()).containsExactly("statistical_deviation");
        assertThat(global.getRemediationSteps()).isEmpty();
    }

    @Test
    void emptyInput_emptyOutput() {
        assertThat(merger.mergeFilterSort(List.of(), 0.25)).isEmpty();
    }
}
