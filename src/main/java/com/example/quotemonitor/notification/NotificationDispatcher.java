package com.example.quotemonitor.notification;

import com.example.quotemonitor.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans a message out to every enabled {@link NotificationChannel}.
 * <p>
 * Channels are isolated from each other: a failing channel is logged and
 * reported, and the remaining channels still receive the message. Nothing
 * is thrown back to the caller.
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private final List<NotificationChannel> channels;
    private final MetricsConfig metricsConfig;

    public NotificationDispatcher(List<NotificationChannel> channels, MetricsConfig metricsConfig) {
        this.channels = List.copyOf(channels);
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void initialize() {
        for (var channel : channels) {
            log.info("Registered notification channel {} (enabled: {})", channel.getName(), channel.isEnabled());
        }
        if (getEnabledChannels().isEmpty()) {
            log.warn("No notification channel is enabled, quote changes will only be logged");
        }
    }

    /**
     * Send the message to every enabled channel
     *
     * @param message The formatted notification text
     * @return which channels delivered and which failed
     */
    public DispatchReport dispatch(String message) {
        var report = DispatchReport.builder();

        for (var channel : getEnabledChannels()) {
            try {
                channel.send(message);
                log.info("Notification sent via {}: {}", channel.getName(), message);
                metricsConfig.recordNotification(channel.getName(), true);
                report.delivered(channel.getName());
            } catch (Exception e) {
                log.error("Failed to send notification via {}: {}", channel.getName(), e.getMessage(), e);
                metricsConfig.recordNotification(channel.getName(), false);
                report.failed(channel.getName(), String.valueOf(e.getMessage()));
            }
        }

        return report.build();
    }

    public List<NotificationChannel> getEnabledChannels() {
        return channels.stream().filter(NotificationChannel::isEnabled).toList();
    }
}
