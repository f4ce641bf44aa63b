package com.example.quotemonitor.service.scheduler;

import com.example.quotemonitor.domain.Trigger;
import com.example.quotemonitor.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Trigger source backed by a six-field cron expression
 * ({@code second minute hour day-of-month month day-of-week}).
 * <p>
 * Ranges, lists, steps and month/day names are supported, e.g.
 * {@code "0 0,30 13-21 * * MON-FRI"}. Instants are evaluated in the given zone.
 */
public class CronTriggerSource implements TriggerSource {

    private final String expressionText;
    private final CronExpression expression;
    private final ZoneId zone;

    public CronTriggerSource(String expression, ZoneId zone) {
        try {
            this.expression = CronExpression.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, e);
        }
        this.expressionText = expression;
        this.zone = zone;
    }

    @Override
    public Iterator<Trigger> triggersAfter(ZonedDateTime start) {
        return new CronIterator(start.withZoneSameInstant(zone));
    }

    @Override
    public String describe() {
        return expressionText + " (" + zone + ")";
    }

    private final class CronIterator implements Iterator<Trigger> {

        private ZonedDateTime cursor;
        private ZonedDateTime upcoming;

        private CronIterator(ZonedDateTime start) {
            this.cursor = start;
        }

        @Override
        public boolean hasNext() {
            if (upcoming == null && cursor != null) {
                upcoming = expression.next(cursor);
                if (upcoming == null) {
                    // schedule never fires again
                    cursor = null;
                }
            }
            return upcoming != null;
        }

        @Override
        public Trigger next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Schedule " + describe() + " has no further firings");
            }
            var firedAt = upcoming;
            cursor = firedAt;
            upcoming = null;
            return Trigger.at(firedAt);
        }
    }
}
