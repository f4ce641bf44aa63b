package com.example.quotemonitor.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.assertj.AssertableApplicationContext;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ContextConsumer;

import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Quote monitor properties binding Tests")
class QuoteMonitorPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(TestConfiguration.class);

    @Test
    @DisplayName("Should apply defaults when nothing is configured")
    void shouldApplyDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            var monitor = context.getBean(QuoteMonitorProperties.class);
            var source = context.getBean(QuoteSourceProperties.class);

            assertThat(monitor.getCron()).isEqualTo("0 0,30 13-21 * * MON-FRI");
            assertThat(monitor.getSubject()).isEqualTo("A Bovespa");
            assertThat(monitor.getBackoff().getMin()).isEqualTo(Duration.ofSeconds(1));
            assertThat(monitor.getBackoff().getMax()).isEqualTo(Duration.ofSeconds(300));
            assertThat(monitor.getBackoff().getFactor()).isEqualTo(1.1);
            assertThat(monitor.getShedding().getMaxWait()).isEqualTo(Duration.ZERO);
            assertThat(monitor.resolveZoneId()).isEqualTo(ZoneId.systemDefault());
            assertThat(source.getSymbol()).isEqualTo("^BVSP");
            assertThat(source.getBaseUrl()).isEqualTo("https://query1.finance.yahoo.com");
        });
    }

    @Test
    @DisplayName("Should bind schedule, zone and backoff durations")
    void shouldBindConfiguredValues() {
        contextRunner
                .withPropertyValues(
                        "quote-monitor.cron=0 */15 10-17 * * MON-FRI",
                        "quote-monitor.zone=America/Sao_Paulo",
                        "quote-monitor.subject=O Ibovespa",
                        "quote-monitor.backoff.min=2s",
                        "quote-monitor.backoff.max=5m",
                        "quote-monitor.backoff.factor=2.0",
                        "quote-monitor.shedding.max-wait=500ms")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    var monitor = context.getBean(QuoteMonitorProperties.class);

                    assertThat(monitor.getCron()).isEqualTo("0 */15 10-17 * * MON-FRI");
                    assertThat(monitor.resolveZoneId()).isEqualTo(ZoneId.of("America/Sao_Paulo"));
                    assertThat(monitor.getSubject()).isEqualTo("O Ibovespa");
                    assertThat(monitor.getBackoff().getMin()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(monitor.getBackoff().getMax()).isEqualTo(Duration.ofMinutes(5));
                    assertThat(monitor.getBackoff().getFactor()).isEqualTo(2.0);
                    assertThat(monitor.getShedding().getMaxWait()).isEqualTo(Duration.ofMillis(500));
                });
    }

    @Test
    @DisplayName("Should reject a blank cron expression")
    void shouldRejectBlankCron() {
        contextRunner
                .withPropertyValues("quote-monitor.cron=  ")
                .run(assertValidationFailure("cron"));
    }

    @Test
    @DisplayName("Should reject a shrinking backoff factor")
    void shouldRejectShrinkingFactor() {
        contextRunner
                .withPropertyValues("quote-monitor.backoff.factor=0.5")
                .run(assertValidationFailure("factor"));
    }

    private ContextConsumer<AssertableApplicationContext> assertValidationFailure(String expectedField) {
        return context -> {
            assertThat(context).hasFailed();
            var root = org.assertj.core.util.Throwables.getRootCause(context.getStartupFailure());
            assertThat(root).isInstanceOf(BindValidationException.class);
            assertThat(root.getMessage()).contains(expectedField);
        };
    }

    @org.springframework.boot.test.context.TestConfiguration
    @EnableConfigurationProperties({QuoteMonitorProperties.class, QuoteSourceProperties.class})
    static class TestConfiguration {
    }
}
