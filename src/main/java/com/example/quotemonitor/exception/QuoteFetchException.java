package com.example.quotemonitor.exception;

import lombok.Getter;

/**
 * Exception for failures to obtain the current quote.
 * Always retryable: the check executor retries it with backoff.
 */
@Getter
public class QuoteFetchException extends RuntimeException {

    private final String sourceName;
    private final Integer httpStatusCode;

    public QuoteFetchException(String sourceName, String message) {
        super(String.format("[%s] %s", sourceName, message));
        this.sourceName = sourceName;
        this.httpStatusCode = null;
    }

    public QuoteFetchException(String sourceName, Throwable cause) {
        super(String.format("[%s] %s", sourceName, cause.getMessage()), cause);
        this.sourceName = sourceName;
        this.httpStatusCode = null;
    }

    public QuoteFetchException(String sourceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", sourceName, httpStatusCode, responseBody));
        this.sourceName = sourceName;
        this.httpStatusCode = httpStatusCode;
    }

    /**
     * Classification used for metrics tags
     */
    public String getErrorType() {
        if (httpStatusCode != null) {
            return "HTTP_" + httpStatusCode;
        }
        return getCause() != null ? getCause().getClass().getSimpleName() : "INVALID_PAYLOAD";
    }
}
