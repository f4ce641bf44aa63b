package com.example.quotemonitor.config;

import jakarta.validation.constraints.AssertTrue;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Slack configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#market-watch";
    private String username = "quote-monitor";
    private boolean enabled = false;

    @AssertTrue(message = "slack.webhook-url is required when slack.enabled=true")
    public boolean isWebhookConfigured() {
        return !enabled || (webhookUrl != null && !webhookUrl.isBlank());
    }
}
