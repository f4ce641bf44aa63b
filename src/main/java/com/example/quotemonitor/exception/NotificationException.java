package com.example.quotemonitor.exception;

import lombok.Getter;

/**
 * Exception for a notification channel that failed to deliver a message
 */
@Getter
public class NotificationException extends RuntimeException {

    private final String channelName;

    public NotificationException(String channelName, String message) {
        super(String.format("[%s] %s", channelName, message));
        this.channelName = channelName;
    }

    public NotificationException(String channelName, Throwable cause) {
        super(String.format("[%s] %s", channelName, cause.getMessage()), cause);
        this.channelName = channelName;
    }
}
