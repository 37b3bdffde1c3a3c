package com.dataops.costanomaly.service;

import com.dataops.costanomaly.config.AlertConfig;
import com.dataops.costanomaly.config.MetricsConfig;
import com.dataops.costanomaly.config.TwilioNotificationConfig;
import com.dataops.costanomaly.model.AlertDispatchResult;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.Severity;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Sends one SMS or WhatsApp digest per detection run through Twilio, listing
 * anomalies at or above {@code alerts.min-severity}.
 */
@Service
public class TwilioAlertDispatcher implements AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertDispatcher.class);

    private final TwilioNotificationConfig config;
    private final AlertConfig alertConfig;
    private final MetricsConfig metricsConfig;

    public TwilioAlertDispatcher(TwilioNotificationConfig config, AlertConfig alertConfig,
                                 MetricsConfig metricsConfig) {
        this.config = config;
        this.alertConfig = alertConfig;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio alert dispatcher initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio alert dispatcher is DISABLED.");
        }
    }

    @Override
    @Async("alertExecutor")
    @Observed(name = "alert.dispatch", contextualName = "dispatch-cost-alert")
    public CompletableFuture<AlertDispatchResult> dispatch(String sourceId, List<CostAnomaly> anomalies,
                                                           Map<String, Integer> severityBreakdown) {
        if (!config.isEnabled()) {
            return CompletableFuture.completedFuture(
                    AlertDispatchResult.of(AlertDispatchResult.Status.DISABLED, config.getChannel(),
                            "Twilio notifications are disabled"));
        }

        List<CostAnomaly> alertable = anomalies.stream()
                .filter(a -> a.getSeverity().isAtLeast(alertConfig.getMinSeverity()))
                .collect(Collectors.toList());
        if (alertable.isEmpty()) {
            metricsConfig.recordNotification(config.getChannel(), "skipped");
            return CompletableFuture.completedFuture(
                    AlertDispatchResult.of(AlertDispatchResult.Status.SKIPPED, config.getChannel(),
                            "No anomalies at or above " + alertConfig.getMinSeverity()));
        }

        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (CostAnomaly anomaly : alertable) {
            bySeverity.merge(anomaly.getSeverity().name(), 1, Integer::sum);
        }

        try {
            String body = buildMessageBody(sourceId, alertable, severityBreakdown);
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Cost anomaly alert sent for source={}, anomalies={}, sid={}",
                    sourceId, alertable.size(), message.getSid());

            return CompletableFuture.completedFuture(AlertDispatchResult.builder()
                    .status(AlertDispatchResult.Status.SENT)
                    .channel(config.getChannel())
                    .alertsSent(alertable.size())
                    .criticalAlerts(bySeverity.getOrDefault(Severity.CRITICAL.name(), 0))
                    .highPriorityAlerts(bySeverity.getOrDefault(Severity.HIGH.name(), 0))
                    .bySeverity(bySeverity)
                    .message(message.getSid())
                    .build());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send cost anomaly alert for source={}: {}", sourceId, e.getMessage(), e);
            return CompletableFuture.completedFuture(
                    AlertDispatchResult.of(AlertDispatchResult.Status.FAILED, config.getChannel(), e.getMessage()));
        }
    }

    String buildMessageBody(String sourceId, List<CostAnomaly> alertable, Map<String, Integer> severityBreakdown) {
        StringBuilder body = new StringBuilder();
        body.append(config.getMessagePrefix()).append(' ').append(sourceId).append('\n');
        body.append("All anomalies: ").append(severityBreakdown.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "))).append('\n');

        int listed = Math.min(alertable.size(), alertConfig.getMaxListedAnomalies());
        for (int i = 0; i < listed; i++) {
            CostAnomaly a = alertable.get(i);
            body.append(String.format(Locale.US, "%s %s $%.2f vs $%.2f expected (%.1f%% deviation)\n",
                    a.getDate(), a.getSeverity(), a.getActualCost(), a.getExpectedCost(),
                    a.getDeviationPercentage()));
        }
        if (alertable.size() > listed) {
            body.append("... and ").append(alertable.size() - listed).append(" more");
        }

        String text = body.toString().trim();
        if (text.length() > config.getMaxBodyLength()) {
            return text.substring(0, config.getMaxBodyLength());
        }
        return text;
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
