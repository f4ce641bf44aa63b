package com.example.quotemonitor.config;

import com.example.quotemonitor.service.backoff.BackoffPolicy;
import com.example.quotemonitor.service.store.ObservedValueStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for monitoring the quote checks.
 * <p>
 * Exposes metrics for:
 * - Check outcomes and execution times
 * - Fetch failures and retries
 * - Notification deliveries per channel
 * - Shed triggers
 * - Last observed value and current backoff
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ObservedValueStore observedValueStore;
    private final BackoffPolicy backoffPolicy;

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("quote_monitor_observed_value", observedValueStore, store -> store.current().orElse(Double.NaN))
                .description("Last successfully fetched quote")
                .register(meterRegistry);

        Gauge.builder("quote_monitor_backoff_seconds", backoffPolicy, policy -> policy.current().toMillis() / 1000.0)
                .description("Current wait between failed attempts")
                .register(meterRegistry);
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record time spent on one trigger, retries included
     */
    public void recordExecution(Timer.Sample sample, boolean success) {
        sample.stop(Timer.builder("quote_monitor_execution_time")
                .tag("success", String.valueOf(success))
                .description("Quote check execution time")
                .register(meterRegistry));
    }

    /**
     * Record a successful check by outcome (seeded, unchanged, increased, decreased)
     */
    public void recordCheck(String outcome) {
        meterRegistry.counter("quote_monitor_checks", "outcome", outcome).increment();
    }

    public void recordFetchFailure(String errorType) {
        meterRegistry.counter("quote_monitor_fetch_failures",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordRetry() {
        meterRegistry.counter("quote_monitor_retries").increment();
    }

    public void recordNotification(String channel, boolean success) {
        meterRegistry.counter("quote_monitor_notifications",
                "channel", channel,
                "success", String.valueOf(success)
        ).increment();
    }

    public void recordShedTrigger() {
        meterRegistry.counter("quote_monitor_triggers_shed").increment();
    }
}
