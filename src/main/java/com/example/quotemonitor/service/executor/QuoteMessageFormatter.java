package com.example.quotemonitor.service.executor;

import com.example.quotemonitor.config.QuoteMonitorProperties;
import com.example.quotemonitor.domain.PriceMovement;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders notification text, e.g. {@code "A Bovespa subiu :) - 105.50 às 02:30 PM"}.
 */
@Component
@RequiredArgsConstructor
public class QuoteMessageFormatter {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("hh:mm a", Locale.US);

    private final QuoteMonitorProperties properties;
    private final Clock clock;

    public String format(PriceMovement movement, double value) {
        return String.format(Locale.ROOT, "%s %s %s - %.2f às %s",
                properties.getSubject(),
                movement.getVerb(),
                movement.getSymbol(),
                value,
                TIME_FORMATTER.format(ZonedDateTime.now(clock)));
    }
}
