package com.example.quotemonitor.client;

import com.example.quotemonitor.exception.QuoteFetchException;

/**
 * Source of the monitored quote.
 * <p>
 * Implementations make a single attempt per call: retrying is the caller's job.
 */
public interface QuoteClient {

    /**
     * Fetch the current quote
     *
     * @return a finite quote value
     * @throws QuoteFetchException if the value cannot be obtained
     */
    double fetchCurrentValue();

    /**
     * Human-readable name of the source, used in logs
     */
    String getSourceName();
}
