package com.dataops.costanomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "cost-feed")
public class CostFeedConfig {

    // "memory" (in-process feed, optionally seeded) or "http" (billing/usage feed service)
    private String mode = "memory";

    private String baseUrl = "http://localhost:8090";
    private String apiKey;
    private long timeoutMs = 15_000;

    // Source analysed when a request does not name one.
    private String sourceId = "default";
}
