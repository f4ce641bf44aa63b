package com.example.quotemonitor.config;

import com.example.quotemonitor.service.backoff.BackoffPolicy;
import com.example.quotemonitor.service.executor.Sleeper;
import com.example.quotemonitor.service.scheduler.CronTriggerSource;
import com.example.quotemonitor.service.scheduler.TriggerSource;
import com.example.quotemonitor.service.store.ObservedValueStore;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring of the scheduling core: schedule, clock, backoff, shared state
 * and the bulkhead that sheds overlapping triggers.
 * <p>
 * A malformed cron expression or invalid backoff bounds fail here, before
 * the monitor starts.
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    public static final String BULKHEAD_NAME = "quoteCheck";

    @Bean
    public Clock quoteMonitorClock(QuoteMonitorProperties properties) {
        return Clock.system(properties.resolveZoneId());
    }

    @Bean
    public TriggerSource triggerSource(QuoteMonitorProperties properties) {
        var source = new CronTriggerSource(properties.getCron(), properties.resolveZoneId());
        log.info("Quote checks scheduled with {}", source.describe());
        return source;
    }

    @Bean
    public BackoffPolicy backoffPolicy(QuoteMonitorProperties properties) {
        var backoff = properties.getBackoff();
        return new BackoffPolicy(backoff.getMin(), backoff.getMax(), backoff.getFactor());
    }

    @Bean
    public ObservedValueStore observedValueStore() {
        return new ObservedValueStore();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    /**
     * One check at a time; a trigger waits at most the configured time for
     * the running check before it is rejected.
     */
    @Bean
    public Bulkhead quoteCheckBulkhead(BulkheadRegistry bulkheadRegistry, QuoteMonitorProperties properties) {
        var config = BulkheadConfig.custom()
                .maxConcurrentCalls(1)
                .maxWaitDuration(properties.getShedding().getMaxWait())
                .build();
        return bulkheadRegistry.bulkhead(BULKHEAD_NAME, config);
    }
}
