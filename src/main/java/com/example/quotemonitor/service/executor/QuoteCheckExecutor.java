package com.example.quotemonitor.service.executor;

import com.example.quotemonitor.client.QuoteClient;
import com.example.quotemonitor.config.MetricsConfig;
import com.example.quotemonitor.domain.PriceMovement;
import com.example.quotemonitor.domain.Trigger;
import com.example.quotemonitor.exception.QuoteFetchException;
import com.example.quotemonitor.notification.NotificationDispatcher;
import com.example.quotemonitor.service.backoff.BackoffPolicy;
import com.example.quotemonitor.service.store.ObservedValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Service responsible for running the quote check of one trigger.
 * <p>
 * Handles:
 * - Serializing checks (one lock, held for the whole run including retry waits)
 * - Fetch, compare and store of the observed value
 * - Unbounded retries with capped exponential backoff
 * - Dispatch of change notifications
 * <p>
 * Only failures to obtain the quote are retried. Once the fetched value is
 * stored, a failure is logged and the trigger ends without a retry, so a
 * detected change is never compared again against itself. Notification
 * failures are contained by the {@link NotificationDispatcher}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuoteCheckExecutor {

    static final String TRIGGER_MDC_KEY = "trigger";

    private final QuoteClient quoteClient;
    private final ObservedValueStore observedValueStore;
    private final BackoffPolicy backoffPolicy;
    private final QuoteMessageFormatter messageFormatter;
    private final NotificationDispatcher notificationDispatcher;
    private final MetricsConfig metricsConfig;
    private final Sleeper sleeper;

    // Guards backoffPolicy and serializes every check
    private final ReentrantLock executionLock = new ReentrantLock();

    /**
     * Run the check for a trigger, retrying until it succeeds.
     *
     * @param trigger The scheduled firing being processed
     * @return true once a check completed, false if interrupted or if it failed after storing the value
     */
    public boolean execute(Trigger trigger) {
        MDC.put(TRIGGER_MDC_KEY, trigger.getFiredAt().toString());
        try {
            executionLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to run check for trigger {}", trigger.getFiredAt());
            MDC.remove(TRIGGER_MDC_KEY);
            return false;
        }

        try {
            return executeWithRetry(trigger);
        } finally {
            executionLock.unlock();
            MDC.remove(TRIGGER_MDC_KEY);
        }
    }

    private boolean executeWithRetry(Trigger trigger) {
        var timerSample = metricsConfig.startExecutionTimer();
        var attempt = 1;

        while (true) {
            try {
                var outcome = executeInner(trigger);
                backoffPolicy.reset();
                log.info("Check for trigger {} completed on attempt {} ({})", trigger.getFiredAt(), attempt, outcome.getOutcomeName());
                metricsConfig.recordExecution(timerSample, true);
                return true;
            } catch (QuoteFetchException e) {
                var wait = backoffPolicy.advance();
                log.warn("Attempt {} for trigger {} failed: {}. Retrying in {}", attempt, trigger.getFiredAt(), e.getMessage(), wait);
                metricsConfig.recordFetchFailure(e.getErrorType());
                metricsConfig.recordRetry();

                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Retry loop for trigger {} interrupted after {} attempts", trigger.getFiredAt(), attempt);
                    metricsConfig.recordExecution(timerSample, false);
                    return false;
                }
                attempt++;
            } catch (RuntimeException e) {
                // the quote was fetched and stored; fetching again would hide the change
                backoffPolicy.reset();
                log.error("Check for trigger {} failed after storing the quote: {}", trigger.getFiredAt(), e.getMessage(), e);
                metricsConfig.recordExecution(timerSample, false);
                return false;
            }
        }
    }

    /**
     * One attempt: fetch, compare with the observed value, notify on change.
     *
     * @param trigger The scheduled firing being processed
     * @return what was observed and sent
     * @throws QuoteFetchException if the quote cannot be fetched; nothing was stored
     */
    public CheckOutcome executeInner(Trigger trigger) {
        var currentValue = fetch();

        var previousValue = observedValueStore.swap(currentValue);
        var movement = PriceMovement.classify(previousValue.orElse(currentValue), currentValue);
        var message = messageFormatter.format(movement, currentValue);

        var outcome = CheckOutcome.builder()
                .trigger(trigger)
                .movement(movement)
                .previousValue(previousValue)
                .currentValue(currentValue)
                .message(message);

        if (!movement.isChange()) {
            log.info("{}", message);
            var unchanged = outcome.build();
            metricsConfig.recordCheck(unchanged.getOutcomeName());
            return unchanged;
        }

        log.info("{}", message);
        var report = notificationDispatcher.dispatch(message);
        if (!report.isFullyDelivered()) {
            log.warn("Notification not delivered to {}", report.getFailedChannels().keySet());
        }

        var changed = outcome.dispatchReport(report).build();
        metricsConfig.recordCheck(changed.getOutcomeName());
        return changed;
    }

    private double fetch() {
        try {
            return quoteClient.fetchCurrentValue();
        } catch (QuoteFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new QuoteFetchException(quoteClient.getSourceName(), e);
        }
    }
}
