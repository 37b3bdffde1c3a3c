package com.dataops.costanomaly.service;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.model.AnomalySummary;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.Severity;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Descriptive statistics and operator-facing narrative over the final anomaly list.
 */
@Service
public class AnomalySummaryService {

    static final String NO_ANOMALIES_INSIGHT = "No significant cost anomalies detected in the analysis period";

    private final DetectionConfig detectionConfig;

    public AnomalySummaryService(DetectionConfig detectionConfig) {
        this.detectionConfig = detectionConfig;
    }

    public AnomalySummary summarize(List<CostAnomaly> anomalies, int sampleCount) {
        if (anomalies.isEmpty()) {
            return AnomalySummary.builder()
                    .totalAnomalies(0)
                    .anomalyRate(0.0)
                    .totalExcessCost(0.0)
                    .severityBreakdown(new LinkedHashMap<>())
                    .mostCommonFactors(new ArrayList<>())
                    .insights(List.of(NO_ANOMALIES_INSIGHT))
                    .build();
        }

        DetectionConfig.Summary params = detectionConfig.getSummary();
        int total = anomalies.size();
        double rate = sampleCount > 0 ? (double) total / sampleCount : 0.0;
        double excess = anomalies.stream()
                .mapToDouble(a -> Math.max(0.0, a.getActualCost() - a.getExpectedCost()))
                .sum();
        List<String> topFactors = mostCommonFactors(anomalies, params.getTopFactorLimit());

        List<String> insights = new ArrayList<>();
        insights.add(String.format("Detected %d cost anomalies over the analysis period", total));
        if (excess > params.getExcessCostCallout()) {
            insights.add(String.format(Locale.US, "Anomalies resulted in approximately $%.2f in excess costs", excess));
        }
        if (rate > params.getSystemicRateThreshold()) {
            insights.add("High anomaly rate suggests systemic cost control issues");
        }
        if (!topFactors.isEmpty()) {
            insights.add("Most common contributing factor: " + topFactors.get(0));
        }

        LocalDate first = anomalies.stream().map(CostAnomaly::getDate).min(Comparator.naturalOrder()).orElse(null);
        LocalDate last = anomalies.stream().map(CostAnomaly::getDate).max(Comparator.naturalOrder()).orElse(null);

        return AnomalySummary.builder()
                .totalAnomalies(total)
                .anomalyRate(rate)
                .totalExcessCost(Math.round(excess * 100.0) / 100.0) // round to 2 decimal
                .severityBreakdown(severityBreakdown(anomalies))
                .mostCommonFactors(topFactors)
                .dateRange(new AnomalySummary.DateRange(first, last))
                .insights(insights)
                .build();
    }

    /**
     * Count per severity, most severe first; absent severities are omitted.
     */
    public Map<String, Integer> severityBreakdown(List<CostAnomaly> anomalies) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        Severity[] severities = Severity.values();
        for (int i = severities.length - 1; i >= 0; i--) {
            Severity severity = severities[i];
            int count = (int) anomalies.stream().filter(a -> a.getSeverity() == severity).count();
            if (count > 0) {
                breakdown.put(severity.name(), count);
            }
        }
        return breakdown;
    }

    // Ties keep first-seen order.
    private List<String> mostCommonFactors(List<CostAnomaly> anomalies, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CostAnomaly anomaly : anomalies) {
            for (String factor : anomaly.getContributingFactors()) {
                counts.merge(factor, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
