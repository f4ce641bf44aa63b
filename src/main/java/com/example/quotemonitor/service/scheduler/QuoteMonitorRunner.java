package com.example.quotemonitor.service.scheduler;

import com.example.quotemonitor.config.MetricsConfig;
import com.example.quotemonitor.config.QuoteMonitorProperties;
import com.example.quotemonitor.domain.Trigger;
import com.example.quotemonitor.service.executor.QuoteCheckExecutor;
import io.github.resilience4j.bulkhead.Bulkhead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Owns the lifetime of the monitor.
 * <p>
 * Runs the trigger stream on a dedicated timer thread and executes quote
 * checks on a single worker thread. A trigger that arrives while a check is
 * still running (including its retry waits) is shed, not queued: the
 * {@link Bulkhead} allows one check at a time and only waits for it up to
 * {@code quote-monitor.shedding.max-wait}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuoteMonitorRunner implements SmartLifecycle {

    private final QuoteMonitorScheduler scheduler;
    private final QuoteCheckExecutor checkExecutor;
    private final Bulkhead bulkhead;
    private final MetricsConfig metricsConfig;
    private final QuoteMonitorProperties properties;

    private final Object lifecycleMonitor = new Object();

    private volatile boolean running;
    private Thread timerThread;
    private volatile ExecutorService workerExecutor;

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) {
                return;
            }
            log.info("Starting quote monitor with cron: {}", properties.getCron());

            workerExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("quote-check-"));
            timerThread = new Thread(() -> scheduler.run(this::dispatch), "quote-monitor-timer");
            timerThread.setDaemon(true);
            running = true;
            timerThread.start();
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }
            running = false;
            log.info("Stopping quote monitor");

            timerThread.interrupt();
            workerExecutor.shutdownNow();
            try {
                if (!workerExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("Quote check worker did not terminate within 10s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    /**
     * Hand a trigger to the worker unless a check is already in flight.
     *
     * @param trigger The due trigger
     * @return true if accepted, false if shed
     */
    public boolean dispatch(Trigger trigger) {
        if (!bulkhead.tryAcquirePermission()) {
            log.warn("Previous quote check still running, shedding trigger {}", trigger.getFiredAt());
            metricsConfig.recordShedTrigger();
            return false;
        }

        var worker = workerExecutor;
        if (worker == null) {
            bulkhead.releasePermission();
            log.warn("Quote monitor is not running, dropping trigger {}", trigger.getFiredAt());
            return false;
        }

        try {
            worker.execute(() -> runCheck(trigger));
            return true;
        } catch (RejectedExecutionException e) {
            bulkhead.releasePermission();
            log.warn("Quote monitor is shutting down, dropping trigger {}", trigger.getFiredAt());
            return false;
        }
    }

    private void runCheck(Trigger trigger) {
        try {
            checkExecutor.execute(trigger);
        } catch (Exception e) {
            log.error("Unexpected error running check for trigger {}: {}", trigger.getFiredAt(), e.getMessage(), e);
        } finally {
            bulkhead.onComplete();
        }
    }
}
