package com.dataops.costanomaly.service;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.config.MetricsConfig;
import com.dataops.costanomaly.feed.CostBreakdownProvider;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DateBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Attaches root-cause context to each anomaly from the per-date cost breakdown.
 *
 * Rules (any subset may fire):
 * - top user cost above threshold      -> high_cost_single_user
 * - query count above N x series mean  -> unusual_query_volume
 * - most expensive query above limit   -> expensive_single_query
 * - dataset concentration above ratio  -> dataset_concentration (+ top datasets as resources)
 *
 * A failed, missing, late or uninformative breakdown gives the anomaly the generic
 * fallback remediation. Enrichment only appends; severity, confidence and
 * detection method are never touched.
 *
 * detection.enrichment.timeout-ms bounds the whole stage in both modes. Lookups still
 * running at the deadline are cancelled and fall back with reason "timeout"; lookups
 * the enrichment pool refuses to accept fall back with reason "lookup_failed".
 */
@Service
public class AnomalyEnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEnrichmentService.class);

    static final String FALLBACK_LOOKUP_FAILED = "lookup_failed";
    static final String FALLBACK_NOT_FOUND = "not_found";
    static final String FALLBACK_TIMEOUT = "timeout";
    static final String FALLBACK_NO_SIGNAL = "no_signal";

    private final CostBreakdownProvider breakdownProvider;
    private final DetectionConfig detectionConfig;
    private final MetricsConfig metricsConfig;
    private final Executor enrichmentExecutor;

    public AnomalyEnrichmentService(CostBreakdownProvider breakdownProvider,
                                    DetectionConfig detectionConfig,
                                    MetricsConfig metricsConfig,
                                    @Qualifier("enrichmentExecutor") Executor enrichmentExecutor) {
        this.breakdownProvider = breakdownProvider;
        this.detectionConfig = detectionConfig;
        this.metricsConfig = metricsConfig;
        this.enrichmentExecutor = enrichmentExecutor;
    }

    /**
     * Enrich every anomaly in place.
     *
     * @param sourceId  cost source the anomalies came from
     * @param anomalies merged anomalies, modified in place
     * @param series    the analysed series, for the query-volume baseline
     */
    public void enrich(String sourceId, List<CostAnomaly> anomalies, List<CostSample> series) {
        if (anomalies.isEmpty()) {
            return;
        }
        double meanQueryCount = series.stream().mapToLong(CostSample::getQueryCount).average().orElse(0.0);

        if (detectionConfig.getEnrichment().isParallel()) {
            enrichConcurrently(sourceId, anomalies, meanQueryCount);
        } else {
            enrichSequentially(sourceId, anomalies, meanQueryCount);
        }
    }

    private void enrichConcurrently(String sourceId, List<CostAnomaly> anomalies, double meanQueryCount) {
        List<CompletableFuture<Optional<DateBreakdown>>> lookups = new ArrayList<>(anomalies.size());
        for (CostAnomaly anomaly : anomalies) {
            lookups.add(submitLookup(sourceId, anomaly));
        }

        long timeoutMs = detectionConfig.getEnrichment().getTimeoutMs();
        try {
            CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0])).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Enrichment for source {} exceeded {} ms; outstanding lookups fall back", sourceId, timeoutMs);
        } catch (ExecutionException e) {
            log.debug("At least one breakdown lookup for source {} failed: {}", sourceId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Enrichment for source {} interrupted; outstanding lookups fall back", sourceId);
        }

        for (int i = 0; i < anomalies.size(); i++) {
            CostAnomaly anomaly = anomalies.get(i);
            CompletableFuture<Optional<DateBreakdown>> lookup = lookups.get(i);

            if (!lookup.isDone()) {
                lookup.cancel(true);
                applyFallback(anomaly, FALLBACK_TIMEOUT);
                continue;
            }
            try {
                applyBreakdown(anomaly, lookup.join().orElse(null), meanQueryCount);
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Breakdown lookup failed for {} on {}: {}", sourceId, anomaly.getDate(), cause.getMessage());
                applyFallback(anomaly, FALLBACK_LOOKUP_FAILED);
            }
        }
    }

    private void enrichSequentially(String sourceId, List<CostAnomaly> anomalies, double meanQueryCount) {
        long deadline = System.currentTimeMillis() + detectionConfig.getEnrichment().getTimeoutMs();
        for (CostAnomaly anomaly : anomalies) {
            long remainingMs = deadline - System.currentTimeMillis();
            if (remainingMs <= 0) {
                applyFallback(anomaly, FALLBACK_TIMEOUT);
                continue;
            }
            CompletableFuture<Optional<DateBreakdown>> lookup = submitLookup(sourceId, anomaly);
            try {
                Optional<DateBreakdown> breakdown = lookup.get(remainingMs, TimeUnit.MILLISECONDS);
                applyBreakdown(anomaly, breakdown.orElse(null), meanQueryCount);
            } catch (TimeoutException e) {
                lookup.cancel(true);
                log.warn("Breakdown lookup for {} on {} exceeded the enrichment deadline", sourceId, anomaly.getDate());
                applyFallback(anomaly, FALLBACK_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lookup.cancel(true);
                applyFallback(anomaly, FALLBACK_TIMEOUT);
            } catch (ExecutionException | RuntimeException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Breakdown lookup failed for {} on {}: {}", sourceId, anomaly.getDate(), cause.getMessage());
                applyFallback(anomaly, FALLBACK_LOOKUP_FAILED);
            }
        }
    }

    /**
     * Hand one lookup to the enrichment pool. A refused submission comes back as an
     * already failed lookup.
     */
    private CompletableFuture<Optional<DateBreakdown>> submitLookup(String sourceId, CostAnomaly anomaly) {
        try {
            return CompletableFuture.supplyAsync(
                    () -> breakdownProvider.fetchBreakdown(sourceId, anomaly.getDate()), enrichmentExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Enrichment pool rejected lookup for {} on {}: {}", sourceId, anomaly.getDate(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Apply the enrichment rules for one anomaly.
     *
     * @param breakdown      the date's breakdown, or null when the feed had none
     * @param meanQueryCount mean daily query count across the analysed series
     */
    void applyBreakdown(CostAnomaly anomaly, DateBreakdown breakdown, double meanQueryCount) {
        if (breakdown == null) {
            applyFallback(anomaly, FALLBACK_NOT_FOUND);
            return;
        }

        DetectionConfig.Enrichment rules = detectionConfig.getEnrichment();
        List<String> steps = new ArrayList<>();

        if (breakdown.getTopUserCost() > rules.getTopUserCostThreshold()) {
            anomaly.addContributingFactor("high_cost_single_user");
            steps.add("Review queries from top user: " + breakdown.getTopUser());
        }

        if (meanQueryCount > 0 && breakdown.getQueryCount() > rules.getQueryVolumeMultiplier() * meanQueryCount) {
            anomaly.addContributingFactor("unusual_query_volume");
            steps.add("Investigate increased query volume - possible automated process");
        }

        if (breakdown.getMaxQueryCost() > rules.getMaxQueryCostThreshold()) {
            anomaly.addContributingFactor("expensive_single_query");
            steps.add("Optimize expensive individual queries");
        }

        if (breakdown.getDatasetConcentration() > rules.getDatasetConcentrationThreshold()) {
            anomaly.addContributingFactor("dataset_concentration");
            List<String> datasets = breakdown.getTopDatasets() != null ? breakdown.getTopDatasets() : List.of();
            datasets.forEach(anomaly::addAffectedResource);
            steps.add("Review queries on concentrated datasets: " + String.join(", ", datasets));
        }

        if (steps.isEmpty()) {
            applyFallback(anomaly, FALLBACK_NO_SIGNAL);
            return;
        }
        log.debug("Enriched anomaly {} with factors {}", anomaly.getAnomalyId(), anomaly.getContributingFactors());
        anomaly.getRemediationSteps().addAll(steps);
    }

    private void applyFallback(CostAnomaly anomaly, String reason) {
        anomaly.getRemediationSteps().addAll(detectionConfig.getEnrichment().getFallbackRemediation());
        metricsConfig.recordEnrichmentFallback(reason);
        log.debug("Anomaly {} uses fallback remediation ({})", anomaly.getAnomalyId(), reason);
    }
}
