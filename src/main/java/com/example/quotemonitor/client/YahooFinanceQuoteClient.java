package com.example.quotemonitor.client;

import com.example.quotemonitor.config.QuoteSourceProperties;
import com.example.quotemonitor.exception.QuoteFetchException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the Yahoo Finance chart API.
 * <p>
 * Reads {@code chart.result[0].meta.regularMarketPrice} for the configured
 * symbol. Transport errors, error statuses, malformed payloads and
 * non-finite prices all surface as {@link QuoteFetchException}.
 */
@Slf4j
@Component
public class YahooFinanceQuoteClient implements QuoteClient {

    private static final String SOURCE_NAME = "Yahoo Finance";

    private final WebClient webClient;
    private final QuoteSourceProperties properties;

    public YahooFinanceQuoteClient(@Qualifier("quoteSourceWebClient") WebClient webClient, QuoteSourceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public double fetchCurrentValue() {
        var symbol = properties.getSymbol();
        log.info("Fetching {} value from {}", symbol, SOURCE_NAME);

        JsonNode body;
        try {
            body = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/v8/finance/chart/{symbol}")
                            .queryParam("interval", "1m")
                            .queryParam("includePrePost", "true")
                            .queryParam("events", "div|split|earn")
                            .queryParam("lang", "en-US")
                            .queryParam("region", "US")
                            .build(symbol))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(responseBody -> Mono.error(
                                            new QuoteFetchException(SOURCE_NAME, response.statusCode().value(), responseBody))))
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (QuoteFetchException e) {
            throw e;
        } catch (Exception e) {
            log.debug("Request for {} failed: {}", symbol, e.getMessage());
            throw new QuoteFetchException(SOURCE_NAME, e);
        }

        return extractPrice(body, symbol);
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    private double extractPrice(JsonNode body, String symbol) {
        if (body == null) {
            throw new QuoteFetchException(SOURCE_NAME, "Empty response for " + symbol);
        }

        var price = body.path("chart").path("result").path(0).path("meta").path("regularMarketPrice");
        if (!price.isNumber()) {
            throw new QuoteFetchException(SOURCE_NAME, "Failed to parse regularMarketPrice for " + symbol);
        }

        var value = price.asDouble();
        if (!Double.isFinite(value)) {
            throw new QuoteFetchException(SOURCE_NAME, "Non-finite price for " + symbol + ": " + value);
        }
        return value;
    }
}
