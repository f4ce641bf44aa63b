package com.example.quotemonitor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the quote monitor.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "quote-monitor")
public class QuoteMonitorProperties {

    public static final String DEFAULT_CRON = "0 0,30 13-21 * * MON-FRI";

    /**
     * Six-field cron expression (second minute hour day-of-month month day-of-week)
     */
    @NotBlank
    private String cron = DEFAULT_CRON;

    /**
     * Zone used for cron evaluation and message timestamps. Blank means the system zone.
     */
    private String zone;

    /**
     * Subject of the notification messages, e.g. "A Bovespa subiu :)"
     */
    @NotBlank
    private String subject = "A Bovespa";

    /**
     * Whether the trigger stream starts with the application context
     */
    private boolean autoStart = true;

    @Valid
    @NotNull
    private Backoff backoff = new Backoff();

    @Valid
    @NotNull
    private Shedding shedding = new Shedding();

    public ZoneId resolveZoneId() {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(zone);
    }

    @Data
    public static class Backoff {

        @NotNull
        private Duration min = Duration.ofSeconds(1);

        @NotNull
        private Duration max = Duration.ofSeconds(300);

        @DecimalMin("1.0")
        private double factor = 1.1;
    }

    @Data
    public static class Shedding {

        /**
         * How long a new trigger may wait for the running check before it is rejected
         */
        @NotNull
        private Duration maxWait = Duration.ZERO;
    }
}
