package com.example.quotemonitor.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Quote source (Yahoo Finance chart API) configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.quote-source")
public class QuoteSourceProperties {
    @NotBlank
    private String baseUrl = "https://query1.finance.yahoo.com";
    @NotBlank
    private String symbol = "^BVSP";
    @NotBlank
    private String userAgent = "Mozilla/5.0 (X11; Linux x86_64)";
    @Min(1)
    private int timeoutSeconds = 30;
}
