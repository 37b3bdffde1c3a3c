package com.dataops.costanomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"

    // First line of every alert digest
    private String messagePrefix = "[COST ANOMALY ALERT]";

    // Digests longer than this are truncated.
    private int maxBodyLength = 1500;
}
