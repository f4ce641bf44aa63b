package com.example.quotemonitor.service.scheduler;

import com.example.quotemonitor.domain.Trigger;
import com.example.quotemonitor.service.executor.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.function.Consumer;

/**
 * Turns the trigger source into timed hand-offs.
 * <p>
 * Flow:
 * 1. Start a fresh trigger sequence from the current time
 * 2. Wait until the next trigger is due
 * 3. Hand the trigger to the consumer (which must not block for long)
 * 4. Repeat until the sequence ends or the thread is interrupted
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuoteMonitorScheduler {

    private final TriggerSource triggerSource;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * Drive the trigger stream on the calling thread.
     *
     * @param onTrigger receives every trigger once it is due
     * @return number of triggers handed off
     */
    public long run(Consumer<Trigger> onTrigger) {
        var triggers = triggerSource.triggersAfter(ZonedDateTime.now(clock));
        long fired = 0;

        log.info("Trigger stream started for schedule {}", triggerSource.describe());

        while (!Thread.currentThread().isInterrupted() && triggers.hasNext()) {
            var trigger = triggers.next();
            var delay = Duration.between(clock.instant(), trigger.toInstant());
            log.debug("Next trigger at {} (in {})", trigger.getFiredAt(), delay);

            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                onTrigger.accept(trigger);
                fired++;
            } catch (Exception e) {
                log.error("Error handing off trigger {}: {}", trigger.getFiredAt(), e.getMessage(), e);
            }
        }

        log.info("Trigger stream stopped after {} triggers", fired);
        return fired;
    }
}
