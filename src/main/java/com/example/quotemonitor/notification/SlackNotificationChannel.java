package com.example.quotemonitor.notification;

import com.example.quotemonitor.config.SlackProperties;
import com.example.quotemonitor.exception.NotificationException;
import com.slack.api.Slack;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Posts notifications to a Slack channel through an incoming webhook.
 */
@Slf4j
@Component
public class SlackNotificationChannel implements NotificationChannel {

    private static final String CHANNEL_NAME = "slack";

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Autowired
    public SlackNotificationChannel(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackNotificationChannel(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    @Override
    public String getName() {
        return CHANNEL_NAME;
    }

    @Override
    public boolean isEnabled() {
        return slackProperties.isEnabled()
                && slackProperties.getWebhookUrl() != null
                && !slackProperties.getWebhookUrl().isBlank();
    }

    @Override
    public void send(String message) {
        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(slackProperties.getUsername())
                .iconEmoji(":chart_with_upwards_trend:")
                .text(message)
                .build();

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                throw new NotificationException(CHANNEL_NAME,
                        "Response code: " + response.getCode() + ", body: " + response.getBody());
            }
        } catch (IOException e) {
            throw new NotificationException(CHANNEL_NAME, e);
        }
    }
}
