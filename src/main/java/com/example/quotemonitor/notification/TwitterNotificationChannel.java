package com.example.quotemonitor.notification;

import com.example.quotemonitor.config.TwitterProperties;
import com.example.quotemonitor.exception.NotificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Posts notifications as tweets through the Twitter API v2.
 * <p>
 * Requests are signed with the account's OAuth 1.0a user credentials.
 */
@Slf4j
@Component
public class TwitterNotificationChannel implements NotificationChannel {

    private static final String CHANNEL_NAME = "twitter";

    private final WebClient webClient;
    private final TwitterProperties properties;
    private final OAuth1Signer signer;

    public TwitterNotificationChannel(@Qualifier("twitterWebClient") WebClient webClient, TwitterProperties properties, Clock clock) {
        this.webClient = webClient;
        this.properties = properties;
        this.signer = new OAuth1Signer(properties.getConsumerKey(), properties.getConsumerSecret(),
                properties.getAccessToken(), properties.getAccessSecret(), clock);
    }

    @Override
    public String getName() {
        return CHANNEL_NAME;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public void send(String message) {
        var uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/2/tweets")
                .build()
                .toUri();

        try {
            var response = webClient.post()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, signer.authorizationHeader(HttpMethod.POST, uri))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("text", message))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(new NotificationException(CHANNEL_NAME,
                                            "HTTP " + clientResponse.statusCode().value() + ": " + body))))
                    .bodyToMono(Map.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
            log.debug("Tweet created: {}", response);
        } catch (NotificationException e) {
            throw e;
        } catch (Exception e) {
            throw new NotificationException(CHANNEL_NAME, e);
        }
    }
}
