package com.dataops.costanomaly.engine;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.config.MetricsConfig;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DetectionMethod;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs every registered detector over the same series.
 * Uses the Strategy pattern: each DetectionMethod is handled by one AnomalyDetector.
 */
@Component
public class DetectorEnsemble {

    private static final Logger log = LoggerFactory.getLogger(DetectorEnsemble.class);

    private final Map<DetectionMethod, AnomalyDetector> detectorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final DetectionConfig detectionConfig;
    private final Executor detectionExecutor;

    public DetectorEnsemble(List<AnomalyDetector> detectors, Tracer tracer, MetricsConfig metricsConfig,
                            DetectionConfig detectionConfig,
                            @Qualifier("detectionExecutor") Executor detectionExecutor) {
        this.detectorMap = new EnumMap<>(DetectionMethod.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.detectionConfig = detectionConfig;
        this.detectionExecutor = detectionExecutor;

        for (AnomalyDetector detector : detectors) {
            detectorMap.put(detector.getMethod(), detector);
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getMethod(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run all detectors against the series.
     *
     * @param series     ascending daily samples, never modified
     * @param thresholds sensitivity thresholds for this run
     * @param bands      severity bands for this run
     * @return candidates concatenated in detector order, and the detectors that completed
     */
    @Observed(name = "detectors.run_all", contextualName = "run-all-detectors")
    public EnsembleOutcome runAll(List<CostSample> series, DetectionConfig.Thresholds thresholds,
                                  DetectionConfig.SeverityBands bands) {
        List<CostSample> input = Collections.unmodifiableList(series);

        // EnumMap iteration follows declaration order, so results stay deterministic in both modes
        Map<DetectionMethod, List<CostAnomaly>> byMethod = new LinkedHashMap<>();
        if (detectionConfig.isParallelDetectors()) {
            Map<DetectionMethod, CompletableFuture<List<CostAnomaly>>> futures = new LinkedHashMap<>();
            for (AnomalyDetector detector : detectorMap.values()) {
                futures.put(detector.getMethod(), submit(detector, input, thresholds, bands));
            }
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
            futures.forEach((method, future) -> byMethod.put(method, future.join()));
        } else {
            for (AnomalyDetector detector : detectorMap.values()) {
                byMethod.put(detector.getMethod(), runOne(detector, input, thresholds, bands));
            }
        }

        List<CostAnomaly> candidates = new ArrayList<>();
        List<DetectionMethod> executed = new ArrayList<>();
        byMethod.forEach((method, result) -> {
            if (result != null) {
                executed.add(method);
                candidates.addAll(result);
            }
        });
        return new EnsembleOutcome(candidates, executed);
    }

    /**
     * Hand a detector to the detection pool, running it on the caller when the pool is full.
     */
    private CompletableFuture<List<CostAnomaly>> submit(AnomalyDetector detector, List<CostSample> series,
                                                        DetectionConfig.Thresholds thresholds,
                                                        DetectionConfig.SeverityBands bands) {
        try {
            return CompletableFuture.supplyAsync(() -> runOne(detector, series, thresholds, bands), detectionExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Detection pool rejected detector {}; running it inline", detector.getMethod().getTag());
            return CompletableFuture.completedFuture(runOne(detector, series, thresholds, bands));
        }
    }

    /**
     * @return the detector's candidates, or null if it failed
     */
    private List<CostAnomaly> runOne(AnomalyDetector detector, List<CostSample> series,
                                     DetectionConfig.Thresholds thresholds, DetectionConfig.SeverityBands bands) {
        DetectionMethod method = detector.getMethod();
        Span span = tracer.nextSpan()
                .name("detector.run." + method.getTag())
                .tag("detector.method", method.getTag())
                .tag("series.size", String.valueOf(series.size()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<CostAnomaly> result = detector.detect(series, thresholds, bands);
            span.tag("detector.candidates", String.valueOf(result.size()));
            metricsConfig.recordDetectorCandidates(method.getTag(), result.size());
            log.debug("Detector {} produced {} candidates over {} samples",
                    method.getTag(), result.size(), series.size());
            return result;
        } catch (Exception e) {
            span.error(e);
            metricsConfig.recordDetectorFailure(method.getTag());
            log.error("Error running detector {}: {}", method.getTag(), e.getMessage(), e);
            return null;
        } finally {
            span.end();
        }
    }
}
