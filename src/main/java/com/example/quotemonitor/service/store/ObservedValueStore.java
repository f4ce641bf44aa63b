package com.example.quotemonitor.service.store;

import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the last successfully fetched quote.
 * <p>
 * Empty until the first successful fetch. Lives only as long as the process:
 * a restart starts over from an unknown value.
 */
public class ObservedValueStore {

    private final ReentrantLock lock = new ReentrantLock();

    private boolean present;
    private double value;

    /**
     * Store a newly fetched value and return the one it replaces.
     *
     * @param newValue freshly fetched quote
     * @return the previous value, or empty if nothing was observed before
     */
    public OptionalDouble swap(double newValue) {
        lock.lock();
        try {
            var previous = present ? OptionalDouble.of(value) : OptionalDouble.empty();
            value = newValue;
            present = true;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    public OptionalDouble current() {
        lock.lock();
        try {
            return present ? OptionalDouble.of(value) : OptionalDouble.empty();
        } finally {
            lock.unlock();
        }
    }
}
