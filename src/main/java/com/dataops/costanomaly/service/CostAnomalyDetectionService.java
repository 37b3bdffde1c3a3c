package com.dataops.costanomaly.service;

import com.dataops.costanomaly.config.AlertConfig;
import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.config.MetricsConfig;
import com.dataops.costanomaly.engine.AnomalyMerger;
import com.dataops.costanomaly.engine.DetectorEnsemble;
import com.dataops.costanomaly.engine.EnsembleOutcome;
import com.dataops.costanomaly.exception.CostFeedException;
import com.dataops.costanomaly.exception.InsufficientDataException;
import com.dataops.costanomaly.exception.ValidationException;
import com.dataops.costanomaly.feed.CostTimeSeriesProvider;
import com.dataops.costanomaly.model.AlertDispatchResult;
import com.dataops.costanomaly.model.AnalysisMetadata;
import com.dataops.costanomaly.model.AnalysisRequest;
import com.dataops.costanomaly.model.AnomalySummary;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DetectionMethod;
import com.dataops.costanomaly.model.DetectionResult;
import com.dataops.costanomaly.model.ErrorType;
import com.dataops.costanomaly.model.FeedHealth;
import com.dataops.costanomaly.model.RiskAssessment;
import com.dataops.costanomaly.model.Severity;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Main orchestrator for cost anomaly detection.
 *
 * Flow:
 * 1. Validate the request and resolve defaults
 * 2. Fetch the daily cost series
 * 3. Run all detectors via the DetectorEnsemble
 * 4. Filter, merge same-day candidates and sort via the AnomalyMerger
 * 5. Enrich each anomaly with its date's cost breakdown
 * 6. Summarize and project risk
 * 7. Optionally dispatch an alert digest
 *
 * Every failure is returned as a DetectionResult envelope, never thrown.
 */
@Service
public class CostAnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(CostAnomalyDetectionService.class);

    static final int HEALTH_CHECK_DAYS = 7;

    private final RequestValidator requestValidator;
    private final CostTimeSeriesProvider timeSeriesProvider;
    private final DetectorEnsemble detectorEnsemble;
    private final AnomalyMerger anomalyMerger;
    private final AnomalyEnrichmentService enrichmentService;
    private final AnomalySummaryService summaryService;
    private final RiskProjectionService riskProjectionService;
    private final AlertDispatcher alertDispatcher;
    private final DetectionConfig detectionConfig;
    private final AlertConfig alertConfig;
    private final MetricsConfig metricsConfig;

    public CostAnomalyDetectionService(RequestValidator requestValidator,
                                       CostTimeSeriesProvider timeSeriesProvider,
                                       DetectorEnsemble detectorEnsemble,
                                       AnomalyMerger anomalyMerger,
                                       AnomalyEnrichmentService enrichmentService,
                                       AnomalySummaryService summaryService,
                                       RiskProjectionService riskProjectionService,
                                       AlertDispatcher alertDispatcher,
                                       DetectionConfig detectionConfig,
                                       AlertConfig alertConfig,
                                       MetricsConfig metricsConfig) {
        this.requestValidator = requestValidator;
        this.timeSeriesProvider = timeSeriesProvider;
        this.detectorEnsemble = detectorEnsemble;
        this.anomalyMerger = anomalyMerger;
        this.enrichmentService = enrichmentService;
        this.summaryService = summaryService;
        this.riskProjectionService = riskProjectionService;
        this.alertDispatcher = alertDispatcher;
        this.detectionConfig = detectionConfig;
        this.alertConfig = alertConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run one detection pass. This is the main entry point called by the REST controller.
     */
    @Observed(name = "cost.anomaly.detect", contextualName = "detect-cost-anomalies")
    public DetectionResult detect(AnalysisRequest request) {
        try {
            DetectionResult result = runDetection(request);
            metricsConfig.recordDetectionRun("success", result.getAnomaliesDetected().size());
            return result;
        } catch (ValidationException e) {
            log.info("Rejected detection request: {}", e.getMessage());
            return failed(DetectionResult.failure(ErrorType.VALIDATION_ERROR, e.getMessage()));
        } catch (InsufficientDataException e) {
            log.info("Not enough cost history: {}", e.getMessage());
            DetectionResult result = DetectionResult.failure(ErrorType.INSUFFICIENT_DATA, e.getMessage());
            result.setDataPointsAvailable(e.getDataPointsAvailable());
            return failed(result);
        } catch (CostFeedException e) {
            log.error("Cost feed unavailable: {}", e.getMessage(), e);
            return failed(DetectionResult.failure(ErrorType.PROVIDER_ERROR, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error during cost anomaly detection: {}", e.getMessage(), e);
            return failed(DetectionResult.failure(ErrorType.INTERNAL_ERROR,
                    "Anomaly detection failed: " + e.getMessage()));
        }
    }

    private DetectionResult runDetection(AnalysisRequest request) {
        // 1. Validate before touching the feed
        AnalysisParameters params = requestValidator.validate(request);
        log.info("Starting cost anomaly detection: source={}, days={}, sensitivity={}, alertThreshold={}",
                params.getSourceId(), params.getDays(), params.getSensitivity().value(), params.getAlertThreshold());

        // 2. Fetch and check the series
        List<CostSample> series = fetchSeries(params.getSourceId(), params.getDays());
        if (series.size() < detectionConfig.getMinDataPoints()) {
            throw new InsufficientDataException(series.size(), detectionConfig.getMinDataPoints());
        }

        // 3. Run all detectors
        EnsembleOutcome outcome = detectorEnsemble.runAll(series, params.getThresholds(), params.getSeverityBands());

        // 4. Filter, merge and sort
        List<CostAnomaly> anomalies = anomalyMerger.mergeFilterSort(outcome.getCandidates(), params.getAlertThreshold());

        // 5. Root-cause context
        enrichmentService.enrich(params.getSourceId(), anomalies, series);

        // 6. Summary and risk (risk uses the raw series, not the enrichment)
        AnomalySummary summary = summaryService.summarize(anomalies, series.size());
        RiskAssessment risk = riskProjectionService.assess(series, anomalies);

        AnalysisMetadata metadata = AnalysisMetadata.builder()
                .sourceId(params.getSourceId())
                .analysisPeriodDays(params.getDays())
                .sensitivity(params.getSensitivity().value())
                .alertThreshold(params.getAlertThreshold())
                .detectionMethods(outcome.getExecutedMethods().stream()
                        .map(DetectionMethod::getTag)
                        .collect(Collectors.toList()))
                .totalDataPoints(series.size())
                .analyzedAt(Instant.now())
                .build();

        // 7. Metrics and significant events
        for (CostAnomaly anomaly : anomalies) {
            metricsConfig.recordAnomaly(anomaly.getSeverity().name());
            if (anomaly.getSeverity().isAtLeast(Severity.HIGH)) {
                log.warn("Cost anomaly detected for source={} on {}: actual={}, expected={}, deviation={}%, severity={}, method={}",
                        params.getSourceId(), anomaly.getDate(),
                        String.format(Locale.US, "%.2f", anomaly.getActualCost()),
                        String.format(Locale.US, "%.2f", anomaly.getExpectedCost()),
                        String.format(Locale.US, "%.1f", anomaly.getDeviationPercentage()),
                        anomaly.getSeverity(), anomaly.getDetectionMethod());
            }
        }
        log.info("Cost anomaly detection finished: source={}, samples={}, candidates={}, anomalies={}, risk={}",
                params.getSourceId(), series.size(), outcome.getCandidates().size(), anomalies.size(),
                risk.getRiskLevel());

        DetectionResult result = DetectionResult.builder()
                .success(true)
                .anomaliesDetected(anomalies)
                .summary(summary)
                .riskAssessment(risk)
                .analysisMetadata(metadata)
                .build();

        // 8. Optional alert (async; bounded wait for the receipt)
        if (params.isSendAlert()) {
            result.setAlertStatus(dispatchAlert(params.getSourceId(), anomalies, summary));
        }
        return result;
    }

    /**
     * Fetches a one-week series and reports whether the feed answered with data.
     */
    public FeedHealth checkFeedHealth(String sourceId) {
        try {
            List<CostSample> series = timeSeriesProvider.fetchDailyCosts(sourceId, HEALTH_CHECK_DAYS);
            int size = series == null ? 0 : series.size();
            return FeedHealth.builder()
                    .sourceId(sourceId)
                    .healthy(size > 0)
                    .dataPoints(size)
                    .error(size > 0 ? null : "Feed returned no samples")
                    .build();
        } catch (RuntimeException e) {
            log.warn("Cost feed health check failed for source {}: {}", sourceId, e.getMessage());
            return FeedHealth.builder()
                    .sourceId(sourceId)
                    .healthy(false)
                    .dataPoints(0)
                    .error(e.getMessage())
                    .build();
        }
    }

    private List<CostSample> fetchSeries(String sourceId, int days) {
        List<CostSample> series;
        try {
            series = timeSeriesProvider.fetchDailyCosts(sourceId, days);
        } catch (CostFeedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CostFeedException("Failed to fetch cost data: " + e.getMessage(), e);
        }
        if (series == null) {
            throw new CostFeedException("Cost feed returned no series for source " + sourceId);
        }
        for (int i = 1; i < series.size(); i++) {
            if (!series.get(i).getDate().isAfter(series.get(i - 1).getDate())) {
                throw new CostFeedException("Cost feed returned samples out of order or with duplicate dates at "
                        + series.get(i).getDate());
            }
        }
        return series;
    }

    private AlertDispatchResult dispatchAlert(String sourceId, List<CostAnomaly> anomalies, AnomalySummary summary) {
        if (anomalies.isEmpty()) {
            return AlertDispatchResult.of(AlertDispatchResult.Status.SKIPPED, null, "No anomalies to alert on");
        }

        CompletableFuture<AlertDispatchResult> receipt;
        try {
            receipt = alertDispatcher.dispatch(sourceId, anomalies, summary.getSeverityBreakdown());
        } catch (RuntimeException e) {
            log.error("Alert dispatch could not be started for source {}: {}", sourceId, e.getMessage(), e);
            return AlertDispatchResult.of(AlertDispatchResult.Status.FAILED, null, e.getMessage());
        }

        try {
            return receipt.get(alertConfig.getStatusWaitMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("Alert dispatch for source {} still running after {} ms", sourceId, alertConfig.getStatusWaitMs());
            return AlertDispatchResult.of(AlertDispatchResult.Status.PENDING, null,
                    "Dispatch still in progress");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Alert dispatch failed for source {}: {}", sourceId, cause.getMessage(), cause);
            return AlertDispatchResult.of(AlertDispatchResult.Status.FAILED, null, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AlertDispatchResult.of(AlertDispatchResult.Status.PENDING, null,
                    "Interrupted while waiting for dispatch");
        }
    }

    private DetectionResult failed(DetectionResult result) {
        metricsConfig.recordDetectionRun(result.getErrorType().name().toLowerCase(Locale.ROOT), 0);
        return result;
    }
}
