package com.example.quotemonitor;

import com.example.quotemonitor.client.QuoteClient;
import com.example.quotemonitor.domain.Trigger;
import com.example.quotemonitor.notification.NotificationDispatcher;
import com.example.quotemonitor.service.executor.QuoteCheckExecutor;
import com.example.quotemonitor.service.scheduler.QuoteMonitorRunner;
import com.example.quotemonitor.service.scheduler.TriggerSource;
import com.example.quotemonitor.service.store.ObservedValueStore;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Quote monitor application context Tests")
class QuoteMonitorApplicationTests {

    @MockBean
    private QuoteClient quoteClient;

    @Autowired
    private QuoteMonitorRunner runner;

    @Autowired
    private QuoteCheckExecutor checkExecutor;

    @Autowired
    private ObservedValueStore observedValueStore;

    @Autowired
    private NotificationDispatcher notificationDispatcher;

    @Autowired
    private TriggerSource triggerSource;

    @Autowired
    private Bulkhead quoteCheckBulkhead;

    @Autowired
    private Clock clock;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Should wire the monitor without starting it in tests")
    void contextLoads() {
        assertThat(runner.isRunning()).isFalse();
        assertThat(clock.getZone()).isEqualTo(ZoneId.of("America/Sao_Paulo"));
        assertThat(triggerSource.describe()).isEqualTo("0 0,30 13-21 * * MON-FRI (America/Sao_Paulo)");
        assertThat(quoteCheckBulkhead.getBulkheadConfig().getMaxConcurrentCalls()).isEqualTo(1);
        assertThat(notificationDispatcher.getEnabledChannels()).isEmpty();
    }

    @Test
    @DisplayName("Should run a check end to end and publish the observed value")
    void shouldRunCheckEndToEnd() {
        // Given
        when(quoteClient.fetchCurrentValue()).thenReturn(128456.78);
        var trigger = Trigger.at(ZonedDateTime.of(2024, 3, 4, 13, 0, 0, 0, ZoneId.of("America/Sao_Paulo")));

        // When
        var result = checkExecutor.execute(trigger);

        // Then
        assertThat(result).isTrue();
        assertThat(observedValueStore.current()).hasValue(128456.78);
        assertThat(meterRegistry.get("quote_monitor_observed_value").gauge().value()).isEqualTo(128456.78);
    }
}
