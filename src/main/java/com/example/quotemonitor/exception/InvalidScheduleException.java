package com.example.quotemonitor.exception;

import lombok.Getter;

/**
 * Exception for a cron expression that cannot be parsed
 */
@Getter
public class InvalidScheduleException extends RuntimeException {

    private final String expression;

    public InvalidScheduleException(String expression, Throwable cause) {
        super(String.format("Invalid cron expression '%s': %s", expression, cause.getMessage()), cause);
        this.expression = expression;
    }
}
