package com.example.quotemonitor.notification;

import com.example.quotemonitor.exception.NotificationException;

/**
 * Interface for notification channels.
 * <p>
 * Each channel delivers a finished message to one external service.
 * <p>
 * Channels should:
 * - Be stateless
 * - Translate their own errors into {@link NotificationException}
 * - Never retry on their own (delivery is best-effort)
 */
public interface NotificationChannel {

    /**
     * Short channel name used in logs and metrics
     */
    String getName();

    /**
     * Whether this channel is configured to receive messages
     */
    boolean isEnabled();

    /**
     * Deliver the message
     *
     * @param message The formatted notification text
     * @throws NotificationException if delivery fails
     */
    void send(String message);
}
