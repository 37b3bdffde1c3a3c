package com.dataops.costanomaly.config;

import com.dataops.costanomaly.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerts")
public class AlertConfig {

    // Anomalies below this severity are left out of the alert digest.
    private volatile Severity minSeverity = Severity.HIGH;

    // How long a detection run waits for a dispatch receipt before reporting PENDING.
    private long statusWaitMs = 2_000;

    // Anomalies listed individually in the digest body.
    private int maxListedAnomalies = 5;

    private int poolSize = 2;
}
