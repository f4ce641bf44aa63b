package com.example.quotemonitor.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.stream.Stream;

/**
 * Twitter (X) API credentials and endpoint.
 * <p>
 * All four OAuth 1.0a credentials are mandatory while the channel is enabled,
 * so a missing one stops the application at startup.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "twitter")
public class TwitterProperties {

    private boolean enabled = true;

    @NotBlank
    private String baseUrl = "https://api.twitter.com";

    @Min(1)
    private int timeoutSeconds = 30;

    @ToString.Exclude
    private String consumerKey;

    @ToString.Exclude
    private String consumerSecret;

    @ToString.Exclude
    private String accessToken;

    @ToString.Exclude
    private String accessSecret;

    @AssertTrue(message = "TWITTER_CONSUMER_KEY, TWITTER_CONSUMER_SECRET, TWITTER_ACCESS_TOKEN and TWITTER_ACCESS_SECRET must be set")
    public boolean isCredentialsPresent() {
        if (!enabled) {
            return true;
        }
        return Stream.of(consumerKey, consumerSecret, accessToken, accessSecret)
                .allMatch(value -> value != null && !value.isBlank());
    }
}
