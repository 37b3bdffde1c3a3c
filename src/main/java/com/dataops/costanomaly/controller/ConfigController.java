package com.dataops.costanomaly.controller;

import com.dataops.costanomaly.config.AlertConfig;
import com.dataops.costanomaly.config.CostFeedConfig;
import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.model.Sensitivity;
import com.dataops.costanomaly.model.Severity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime detection configuration")
public class ConfigController {

    private final DetectionConfig detectionConfig;
    private final AlertConfig alertConfig;
    private final CostFeedConfig costFeedConfig;

    public ConfigController(DetectionConfig detectionConfig,
                            AlertConfig alertConfig,
                            CostFeedConfig costFeedConfig) {
        this.detectionConfig = detectionConfig;
        this.alertConfig = alertConfig;
        this.costFeedConfig = costFeedConfig;
    }

    // ── Detection ──

    @Operation(summary = "Get detection thresholds")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetectionConfig() {
        Map<String, Object> sensitivity = new LinkedHashMap<>();
        detectionConfig.getSensitivity().forEach((level, t) -> sensitivity.put(level.value(), Map.of(
                "zScore", t.getZScore(),
                "deviationThreshold", t.getDeviationThreshold())));

        DetectionConfig.SeverityBands bands = detectionConfig.getSeverityBands();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("defaultAlertThreshold", detectionConfig.getDefaultAlertThreshold());
        body.put("sensitivity", sensitivity);
        body.put("severityBands", Map.of(
                "mediumFromPct", bands.getMediumFromPct(),
                "highFromPct", bands.getHighFromPct(),
                "criticalFromPct", bands.getCriticalFromPct()));
        body.put("alertMinSeverity", alertConfig.getMinSeverity().name());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update detection thresholds",
            description = "Accepts defaultAlertThreshold, sensitivity.{low|medium|high}.{zScore,deviationThreshold}, " +
                    "severityBands.{mediumFromPct,highFromPct,criticalFromPct} and alertMinSeverity. " +
                    "Changes apply immediately but reset on restart.")
    @PutMapping("/detection")
    public ResponseEntity<?> updateDetectionConfig(@RequestBody Map<String, Object> body) {
        double alert = toDouble(body, "defaultAlertThreshold", detectionConfig.getDefaultAlertThreshold());
        if (alert < 0 || alert > detectionConfig.getMaxAlertThreshold()) {
            return badRequest("defaultAlertThreshold must be in [0, " + detectionConfig.getMaxAlertThreshold() + "]",
                    "defaultAlertThreshold");
        }

        Map<Sensitivity, DetectionConfig.Thresholds> levels = new EnumMap<>(Sensitivity.class);
        detectionConfig.getSensitivity().forEach((level, t) ->
                levels.put(level, new DetectionConfig.Thresholds(t.getZScore(), t.getDeviationThreshold())));

        Object rawSensitivity = body.get("sensitivity");
        if (rawSensitivity != null) {
            if (!(rawSensitivity instanceof Map<?, ?> sensitivityMap)) {
                return badRequest("sensitivity must be an object keyed by level", "sensitivity");
            }
            for (Map.Entry<?, ?> entry : sensitivityMap.entrySet()) {
                Sensitivity level;
                try {
                    level = Sensitivity.fromValue(String.valueOf(entry.getKey()));
                } catch (IllegalArgumentException e) {
                    return badRequest(e.getMessage(), "sensitivity");
                }
                if (!(entry.getValue() instanceof Map<?, ?> values)) {
                    return badRequest("sensitivity." + level.value() + " must be an object", "sensitivity");
                }
                DetectionConfig.Thresholds current = levels.get(level);
                double z = toDouble(values, "zScore", current != null ? current.getZScore() : 0);
                double dev = toDouble(values, "deviationThreshold", current != null ? current.getDeviationThreshold() : 0);
                if (z <= 0) return badRequest("sensitivity." + level.value() + ".zScore must be > 0", "sensitivity");
                if (dev < 0) return badRequest("sensitivity." + level.value() + ".deviationThreshold must be >= 0", "sensitivity");
                levels.put(level, new DetectionConfig.Thresholds(z, dev));
            }
        }

        DetectionConfig.SeverityBands bands = new DetectionConfig.SeverityBands();
        DetectionConfig.SeverityBands currentBands = detectionConfig.getSeverityBands();
        Map<?, ?> rawBands = body.get("severityBands") instanceof Map<?, ?> m ? m : Map.of();
        bands.setMediumFromPct(toDouble(rawBands, "mediumFromPct", currentBands.getMediumFromPct()));
        bands.setHighFromPct(toDouble(rawBands, "highFromPct", currentBands.getHighFromPct()));
        bands.setCriticalFromPct(toDouble(rawBands, "criticalFromPct", currentBands.getCriticalFromPct()));
        if (!bands.isOrdered()) {
            return badRequest("severityBands must satisfy 0 <= mediumFromPct < highFromPct < criticalFromPct",
                    "severityBands");
        }

        Severity minSeverity = alertConfig.getMinSeverity();
        Object rawSeverity = body.get("alertMinSeverity");
        if (rawSeverity != null) {
            try {
                minSeverity = Severity.valueOf(rawSeverity.toString().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return badRequest("alertMinSeverity must be one of " + Arrays.toString(Severity.values()),
                        "alertMinSeverity");
            }
        }

        detectionConfig.setDefaultAlertThreshold(alert);
        detectionConfig.setSensitivity(levels);
        detectionConfig.setSeverityBands(bands);
        alertConfig.setMinSeverity(minSeverity);

        return getDetectionConfig();
    }

    // ── Cost feed (read-only) ──

    @Operation(summary = "Get cost feed connection info (read-only)")
    @GetMapping("/cost-feed")
    public ResponseEntity<Map<String, Object>> getCostFeedInfo() {
        return ResponseEntity.ok(Map.of(
                "mode", costFeedConfig.getMode(),
                "baseUrl", costFeedConfig.getBaseUrl(),
                "sourceId", costFeedConfig.getSourceId(),
                "timeoutMs", costFeedConfig.getTimeoutMs()
        ));
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<?, ?> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
