package com.example.quotemonitor.service.scheduler;

import com.example.quotemonitor.domain.Trigger;

import java.time.ZonedDateTime;
import java.util.Iterator;

/**
 * Produces the firing instants of the monitor.
 */
public interface TriggerSource {

    /**
     * Start a new lazy sequence of triggers strictly after {@code start}.
     * Each call returns an independent sequence.
     *
     * @param start instant to evaluate the schedule from
     * @return triggers in ascending order; may be infinite
     */
    Iterator<Trigger> triggersAfter(ZonedDateTime start);

    /**
     * Human-readable description of the schedule, used in logs
     */
    String describe();
}
