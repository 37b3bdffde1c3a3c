package com.dataops.costanomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetectionRun(String outcome, int anomalyCount) {
        Counter.builder("detection.run.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.run.anomalies")
                .tag("outcome", outcome)
                .register(registry)
                .record(anomalyCount);
    }

    public void recordAnomaly(String severity) {
        Counter.builder("detection.anomalies.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordDetectorCandidates(String method, int candidates) {
        Counter.builder("detector.candidates.count")
                .tag("method", method)
                .register(registry)
                .increment(candidates);
    }

    public void recordDetectorFailure(String method) {
        Counter.builder("detector.failure.count")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    public void recordEnrichmentFallback(String reason) {
        Counter.builder("enrichment.fallback.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
