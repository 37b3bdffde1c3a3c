package com.dataops.costanomaly.service;

import com.dataops.costanomaly.config.AlertConfig;
import com.dataops.costanomaly.config.CostFeedConfig;
import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.config.MetricsConfig;
import com.dataops.costanomaly.engine.AnomalyMerger;
import com.dataops.costanomaly.engine.DetectorEnsemble;
import com.dataops.costanomaly.engine.EnsembleOutcome;
import com.dataops.costanomaly.exception.CostFeedException;
import com.dataops.costanomaly.feed.CostTimeSeriesProvider;
import com.dataops.costanomaly.model.*;
import com.dataops.costanomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CostAnomalyDetectionServiceTest {

    private static final String SOURCE = "analytics-prod";

    @Mock private CostTimeSeriesProvider timeSeriesProvider;
    @Mock private DetectorEnsemble detectorEnsemble;
    @Mock private AnomalyEnrichmentService enrichmentService;
    @Mock private AlertDispatcher alertDispatcher;

    private DetectionConfig detectionConfig;
    private AlertConfig alertConfig;
    private SimpleMeterRegistry registry;
    private CostAnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        detectionConfig = new DetectionConfig();
        alertConfig = new AlertConfig();
        alertConfig.setStatusWaitMs(50);
        CostFeedConfig costFeedConfig = new CostFeedConfig();
        costFeedConfig.setSourceId(SOURCE);
        registry = new SimpleMeterRegistry();

        service = new CostAnomalyDetectionService(
                new RequestValidator(detectionConfig, costFeedConfig),
                timeSeriesProvider,
                detectorEnsemble,
                new AnomalyMerger(),
                enrichmentService,
                new AnomalySummaryService(detectionConfig),
                new RiskProjectionService(detectionConfig),
                alertDispatcher,
                detectionConfig,
                alertConfig,
                new MetricsConfig(registry));
    }

    private CostAnomaly spikeCandidate(List<CostSample> series) {
        return TestDataFactory.createAnomaly(series.get(series.size() - 1).getDate(), "statistical_z_score",
                Severity.CRITICAL, 900.0, 1.0, "statistical_deviation");
    }

    private void ensembleReturns(List<CostAnomaly> candidates) {
        when(detectorEnsemble.runAll(anyList(), any(), any())).thenReturn(new EnsembleOutcome(candidates,
                List.of(DetectionMethod.STATISTICAL_Z_SCORE, DetectionMethod.MOVING_AVERAGE,
                        DetectionMethod.SEASONAL_DAY_OF_WEEK)));
    }

    @Test
    void happyPath_assemblesResult() {
        List<CostSample> series = TestDataFactory.spikeSeries();
        when(timeSeriesProvider.fetchDailyCosts(SOURCE, 14)).thenReturn(series);
        ensembleReturns(new ArrayList<>(List.of(spikeCandidate(series))));

        DetectionResult result = service.detect(AnalysisRequest.builder().days(14).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAnomaliesDetected()).hasSize(1);
        assertThat(result.getSummary().getTotalAnomalies()).isEqualTo(1);
        assertThat(result.getRiskAssessment().getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(result.getAnalysisMetadata().getSourceId()).isEqualTo(SOURCE);
        assertThat(result.getAnalysisMetadata().getSensitivity()).isEqualTo("medium");
        assertThat(result.getAnalysisMetadata().getTotalDataPoints()).isEqualTo(14);
        assertThat(result.getAnalysisMetadata().getDetectionMethods())
                .containsExactly("statistical_z_score", "moving_average", "seasonal_day_of_week");
        assertThat(result.getAlertStatus()).isNull();
        verify(enrichmentService).enrich(eq(SOURCE), anyList(), eq(series));
        verifyNoInteractions(alertDispatcher);
        assertThat(registry.get("detection.run.count").tag("outcome", "success").counter().count()).isEqualTo(1.0);
    }

    @Test
    void invalidDays_validationErrorWithoutFetching() {
        DetectionResult result = service.detect(AnalysisRequest.builder().days(5).build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        assertThat(result.getError()).isEqualTo("Days must be between 7 and 90");
        verifyNoInteractions(timeSeriesProvider, detectorEnsemble);
        assertThat(registry.get("detection.run.count").tag("outcome", "validation_error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shortSeries_insufficientData() {
        when(timeSeriesProvider.fetchDailyCosts(SOURCE, 30))
                .thenReturn(TestDataFactory.constantSeries(5, 10.0));

        DetectionResult result = service.detect(new AnalysisRequest());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorType()).isEqualTo(ErrorType.INSUFFICIENT_DATA);
        assertThat(result.getDataPointsAvailable()).isEqualTo(5);
        assertThat(result.getError()).contains("minimum 7 days required");
        verifyNoInteractions(detectorEnsemble);
    }

    @Test
    void feedFailure_providerError() {
        when(timeSeriesProvider.fetchDailyCosts(anyString(), anyInt()))
                .thenThrow(new CostFeedException("Unknown cost source: analytics-prod"));

        DetectionResult result = service.detect(new AnalysisRequest());

        assertThat(result.getErrorType()).isEqualTo(ErrorType.PROVIDER_ERROR);
        assertThat(result.getError()).isEqualTo("Unknown cost source: analytics-prod");
    }

    @Test
    void unexpectedFeedException_wrappedAsProviderError() {
        when(timeSeriesProvider.fetchDailyCosts(anyString(), anyInt()))
                .thenThrow(new IllegalStateException("connection reset"));

        DetectionResult result = service.detect(new AnalysisRequest());

        assertThat(result.getErrorType()).isEqualTo(ErrorType.PROVIDER_ERROR);
        assertThat(result.getError()).contains("connection reset");
    }

    @Test
    void outOfOrderSeries_providerError() {
        List<CostSample> series = new ArrayList<>(TestDataFactory.constantSeries(10, 10.0));
        series.add(TestDataFactory.createSample(LocalDate.of(2024, 1, 3), 10.0));
        when(timeSeriesProvider.fetchDailyCosts(anyString(), anyInt())).thenReturn(series);

        DetectionResult result = service.detect(new AnalysisRequest());

        assertThat(result.getErrorType()).isEqualTo(ErrorType.PROVIDER_ERROR);
        assertThat(result.getError()).contains("out of order or with duplicate dates");
        verifyNoInteractions(detectorEnsemble);
    }

    @Test
    void unexpectedEngineFailure_internalError() {
        when(timeSeriesProvider.fetchDailyCosts(anyString(), anyInt())).thenReturn(TestDataFactory.spikeSeries());
        when(detectorEnsemble.runAll(anyList(), any(), any())).thenThrow(new IllegalStateException("boom"));

        DetectionResult result = service.detect(new AnalysisRequest());

        assertThat(result.getErrorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
        assertThat(result.getError()).isEqualTo("Anomaly detection failed: boom");
    }

    @Test
    void sendAlert_receiptReturned() {
        List<CostSample> series = TestDataFactory.spikeSeries();
        when(timeSeriesProvider.fetchDailyCosts(anyString(), anyInt())).thenReturn(series);
        ensembleReturns(new ArrayList<>(List.of(spikeCandidate(series))));
        AlertDispatchResult sent = AlertDispatchResult.builder()
                .status(AlertDispatchResult.Status.SENT).channel("sms").alertsSent(1).criticalAlerts(1).build();
        when(alertDispatcher.dispatch(eq(SOURCE), anyList(), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(sent));

        DetectionResult result = service.detect(AnalysisRequest.builder().sendAlert(true).build());

        assertThat(result.getAlertStatus()).isEqualTo(sent);
    }

    @Test
    void sendAlert_noAnomalies_skippedWithoutDispatch() {
        when(timeSeriesProvider.fetchDailyCosts(anyString(), anyInt()))
                .thenReturn(TestDataFactory.constantSeries(14, 10.0));
        ensembleReturns(new ArrayList<>());

        DetectionResult result = service.detect(AnalysisRequest.builder().sendAlert(true).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAlertStatus().getStatus()).isEqualTo(AlertDispatchResult.Status.SKIPPED);
        verify(alertDispatcher, never()).dispatch(anyString(), anyList(), anyMap());
    }

    @Test
    void sendAlert_slowDispatch_pendingButDetectionSucceeds() {
        List<CostSample> series = TestDataFactory.spikeSeries();
        when(timeSeriesProvider.fetchDailyCosts(anyString(), anyInt())).thenReturn(series);
        ensembleReturns(new ArrayList<>(List.of(spikeCandidate(series))));
        when(alertDispatcher.dispatch(anyString(), anyList(), anyMap())).thenReturn(new CompletableFuture<>());

        DetectionResult result = service.detect(AnalysisRequest.builder().sendAlert(true).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAlertStatus().getStatus()).isEqualTo(AlertDispatchResult.Status.PENDING);
    }

    @Test
    void sendAlert_dispatcherThrows_failedButDetectionSucceeds() {
        List<CostSample> series = TestDataFactory.spikeSeries();
        when(timeSeriesProvider.fetchDailyCosts(anyString(), anyInt())).thenReturn(series);
        ensembleReturns(new ArrayList<>(List.of(spikeCandidate(series))));
        when(alertDispatcher.dispatch(anyString(), anyList(), anyMap()))
                .thenThrow(new IllegalStateException("executor rejected"));

        DetectionResult result = service.detect(AnalysisRequest.builder().sendAlert(true).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAnomaliesDetected()).hasSize(1);
        assertThat(result.getAlertStatus().getStatus()).isEqualTo(AlertDispatchResult.Status.FAILED);
        assertThat(result.getAlertStatus().getMessage()).isEqualTo("executor rejected");
    }

    @Test
    void sendAlert_dispatchCompletesExceptionally_failed() {
        List<CostSample> series = TestDataFactory.spikeSeries();
        when(timeSeriesProvider.fetchDailyCosts(anyString(), anyInt())).thenReturn(series);
        ensembleReturns(new ArrayList<>(List.of(spikeCandidate(series))));
        when(alertDispatcher.dispatch(anyString(), anyList(), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("twilio 401")));

        DetectionResult result = service.detect(AnalysisRequest.builder().sendAlert(true).build());

        assertThat(result.getAlertStatus().getStatus()).isEqualTo(AlertDispatchResult.Status.FAILED);
        assertThat(result.getAlertStatus().getMessage()).isEqualTo("twilio 401");
    }

    @Test
    void feedHealth_healthyWhenSamplesReturned() {
        when(timeSeriesProvider.fetchDailyCosts(SOURCE, 7)).thenReturn(TestDataFactory.constantSeries(7, 10.0));

        FeedHealth health = service.checkFeedHealth(SOURCE);

        assertThat(health.isHealthy()).isTrue();
        assertThat(health.getDataPoints()).isEqualTo(7);
        assertThat(health.getError()).isNull();
    }

    @Test
    void feedHealth_unhealthyOnEmptyOrFailure() {
        when(timeSeriesProvider.fetchDailyCosts("empty", 7)).thenReturn(List.of());
        when(timeSeriesProvider.fetchDailyCosts("down", 7)).thenThrow(new CostFeedException("Connection refused"));

        FeedHealth empty = service.checkFeedHealth("empty");
        FeedHealth down = service.checkFeedHealth("down");

        assertThat(empty.isHealthy()).isFalse();
        assertThat(empty.getError()).isEqualTo("Feed returned no samples");
        assertThat(down.isHealthy()).isFalse();
        assertThat(down.getError()).isEqualTo("Connection refused");
    }
}
