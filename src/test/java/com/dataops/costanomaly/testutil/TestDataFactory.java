package com.dataops.costanomaly.testutil;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.model.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    // A Monday
    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    private TestDataFactory() {}

    public static CostSample createSample(LocalDate date, double cost) {
        return CostSample.builder()
                .date(date)
                .cost(cost)
                .queryCount(1000)
                .uniqueUsers(20)
                .avgDurationMs(2500.0)
                .maxSingleQueryCost(5.0)
                .dayOfWeek(CostSample.dayOfWeekOf(date))
                .build();
    }

    /**
     * One sample per consecutive day from {@link #START}.
     */
    public static List<CostSample> createSeries(double... costs) {
        return createSeries(START, costs);
    }

    public static List<CostSample> createSeries(LocalDate start, double... costs) {
        List<CostSample> series = new ArrayList<>(costs.length);
        for (int i = 0; i < costs.length; i++) {
            series.add(createSample(start.plusDays(i), costs[i]));
        }
        return series;
    }

    public static List<CostSample> constantSeries(int days, double cost) {
        double[] costs = new double[days];
        Arrays.fill(costs, cost);
        return createSeries(costs);
    }

    /**
     * 13 days at $10 followed by one day at $100.
     */
    public static List<CostSample> spikeSeries() {
        double[] costs = new double[14];
        Arrays.fill(costs, 10.0);
        costs[13] = 100.0;
        return createSeries(costs);
    }

    /**
     * Four weeks from Monday 2024-01-01; Mondays cost 49/51/49/51, every other day 10.
     */
    public static List<CostSample> heavyMondaySeries() {
        double[] costs = new double[28];
        Arrays.fill(costs, 10.0);
        costs[0] = 49.0;
        costs[7] = 51.0;
        costs[14] = 49.0;
        costs[21] = 51.0;
        return createSeries(costs);
    }

    public static CostAnomaly createAnomaly(LocalDate date, String method, Severity severity,
                                            double deviationPct, double confidence, String factor) {
        List<String> factors = new ArrayList<>();
        factors.add(factor);
        List<String> resources = new ArrayList<>();
        resources.add("bigquery");
        return CostAnomaly.builder()
                .anomalyId(CostAnomaly.idFor(method, date))
                .date(date)
                .actualCost(100.0 * (1 + deviationPct / 100.0))
                .expectedCost(100.0)
                .deviationPercentage(deviationPct)
                .severity(severity)
                .confidenceScore(confidence)
                .detectionMethod(method)
                .contributingFactors(factors)
                .affectedResources(resources)
                .remediationSteps(new ArrayList<>())
                .build();
    }

    public static DateBreakdown createBreakdown(LocalDate date, String topUser, double topUserCost,
                                                long queryCount, double maxQueryCost,
                                                List<String> topDatasets, double concentration) {
        return DateBreakdown.builder()
                .date(date)
                .totalCost(200.0)
                .queryCount(queryCount)
                .topUser(topUser)
                .topUserCost(topUserCost)
                .maxQueryCost(maxQueryCost)
                .topDatasets(topDatasets)
                .datasetConcentration(concentration)
                .build();
    }

    /**
     * A breakdown that triggers none of the enrichment rules.
     */
    public static DateBreakdown quietBreakdown(LocalDate date) {
        return createBreakdown(date, "someone@example.com", 10.0, 1000, 5.0, List.of("sales"), 0.3);
    }

    public static DetectionConfig.Thresholds medium() {
        return new DetectionConfig.Thresholds(2.0, 0.3);
    }

    public static DetectionConfig.Thresholds high() {
        return new DetectionConfig.Thresholds(1.5, 0.2);
    }

    public static DetectionConfig.Thresholds low() {
        return new DetectionConfig.Thresholds(2.5, 0.5);
    }

    /**
     * Default bands: MEDIUM from 30%, HIGH from 60%, CRITICAL from 100%.
     */
    public static DetectionConfig.SeverityBands bands() {
        return new DetectionConfig.SeverityBands();
    }
}
