package com.dataops.costanomaly.engine;

import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fuses detector candidates into the final anomaly list.
 *
 * <ol>
 *   <li>Drops candidates whose deviation is below the alert threshold.</li>
 *   <li>Collapses candidates sharing a date into one record: the most confident
 *       candidate is kept, method tags are joined with '+' in detector order and
 *       contributing factors are unioned.</li>
 *   <li>Sorts by severity, then deviation (both descending), then date.</li>
 * </ol>
 *
 * Candidates must arrive in detector order; a confidence tie keeps the earlier detector.
 */
@Component
public class AnomalyMerger {

    static final Comparator<CostAnomaly> OUTPUT_ORDER = Comparator
            .comparingInt((CostAnomaly a) -> a.getSeverity().getRank()).reversed()
            .thenComparing(Comparator.comparingDouble(CostAnomaly::getDeviationPercentage).reversed())
            .thenComparing(CostAnomaly::getDate);

    public List<CostAnomaly> mergeFilterSort(List<CostAnomaly> candidates, double alertThreshold) {
        double minDeviationPct = alertThreshold * 100.0;

        Map<LocalDate, List<CostAnomaly>> byDate = new LinkedHashMap<>();
        for (CostAnomaly candidate : candidates) {
            if (candidate.getDeviationPercentage() < minDeviationPct) {
                continue;
            }
            byDate.computeIfAbsent(candidate.getDate(), d -> new ArrayList<>()).add(candidate);
        }

        List<CostAnomaly> merged = new ArrayList<>(byDate.size());
        for (Map.Entry<LocalDate, List<CostAnomaly>> entry : byDate.entrySet()) {
            merged.add(fuse(entry.getKey(), entry.getValue()));
        }

        merged.sort(OUTPUT_ORDER);
        return merged;
    }

    private CostAnomaly fuse(LocalDate date, List<CostAnomaly> sameDay) {
        CostAnomaly representative = sameDay.get(0);
        Set<String> methods = new LinkedHashSet<>();
        Set<String> factors = new LinkedHashSet<>();
        Set<String> resources = new LinkedHashSet<>();

        for (CostAnomaly candidate : sameDay) {
            if (candidate.getConfidenceScore() > representative.getConfidenceScore()) {
                representative = candidate;
            }
            methods.add(candidate.getDetectionMethod());
            factors.addAll(candidate.getContributingFactors());
            resources.addAll(candidate.getAffectedResources());
        }

        String joined = String.join(DetectionMethod.TAG_SEPARATOR, methods);
        return representative.toBuilder()
                .anomalyId(CostAnomaly.idFor(joined, date))
                .detectionMethod(joined)
                .contributingFactors(new ArrayList<>(factors))
                .affectedResources(new ArrayList<>(resources))
                .remediationSteps(new ArrayList<>(representative.getRemediationSteps()))
                .build();
    }
}
