package com.example.quotemonitor.service.scheduler;

import com.example.quotemonitor.domain.Trigger;
import com.example.quotemonitor.exception.InvalidScheduleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CronTriggerSource Tests")
class CronTriggerSourceTest {

    private static final ZoneId ZONE = ZoneId.of("America/Sao_Paulo");
    private static final String MARKET_HOURS = "0 0,30 13-21 * * MON-FRI";

    private static ZonedDateTime at(int day, int hour, int minute) {
        return ZonedDateTime.of(2024, 3, day, hour, minute, 0, 0, ZONE);
    }

    private static List<ZonedDateTime> take(Iterator<Trigger> triggers, int count) {
        var result = new ArrayList<ZonedDateTime>();
        for (int i = 0; i < count; i++) {
            result.add(triggers.next().getFiredAt());
        }
        return result;
    }

    @Nested
    @DisplayName("Firing Time Tests")
    class FiringTimeTests {

        @Test
        @DisplayName("Should fire on the hour and half hour during market hours")
        void shouldFireDuringMarketHours() {
            // Given
            var source = new CronTriggerSource(MARKET_HOURS, ZONE);

            // When
            var firings = take(source.triggersAfter(at(4, 12, 0)), 3);

            // Then
            assertThat(firings).containsExactly(at(4, 13, 0), at(4, 13, 30), at(4, 14, 0));
        }

        @Test
        @DisplayName("Should move to the next morning after the last firing of the day")
        void shouldRollToNextDay() {
            // Given
            var source = new CronTriggerSource(MARKET_HOURS, ZONE);

            // When
            var firings = take(source.triggersAfter(at(4, 21, 0)), 2);

            // Then
            assertThat(firings).containsExactly(at(4, 21, 30), at(5, 13, 0));
        }

        @Test
        @DisplayName("Should skip the weekend")
        void shouldSkipWeekend() {
            // Given
            var source = new CronTriggerSource(MARKET_HOURS, ZONE);

            // When
            var next = source.triggersAfter(at(8, 21, 30)).next();

            // Then
            assertThat(next.getFiredAt()).isEqualTo(at(11, 13, 0));
        }

        @Test
        @DisplayName("Should only return instants strictly after the start")
        void shouldExcludeStartInstant() {
            // Given
            var source = new CronTriggerSource(MARKET_HOURS, ZONE);

            // When
            var next = source.triggersAfter(at(4, 13, 0)).next();

            // Then
            assertThat(next.getFiredAt()).isEqualTo(at(4, 13, 30));
        }

        @Test
        @DisplayName("Should evaluate the schedule in the configured zone")
        void shouldConvertStartToZone() {
            // Given
            var source = new CronTriggerSource(MARKET_HOURS, ZONE);
            var startUtc = at(4, 12, 0).withZoneSameInstant(ZoneId.of("UTC"));

            // When
            var next = source.triggersAfter(startUtc).next();

            // Then
            assertThat(next.getFiredAt()).isEqualTo(at(4, 13, 0));
            assertThat(next.getFiredAt().getZone()).isEqualTo(ZONE);
        }

        @Test
        @DisplayName("Should produce independent sequences on every call")
        void shouldRestartFromScratch() {
            // Given
            var source = new CronTriggerSource(MARKET_HOURS, ZONE);
            var first = source.triggersAfter(at(4, 12, 0));
            take(first, 5);

            // When
            var second = source.triggersAfter(at(4, 12, 0));

            // Then
            assertThat(second.next().getFiredAt()).isEqualTo(at(4, 13, 0));
        }

        @Test
        @DisplayName("Should keep hasNext idempotent")
        void shouldKeepHasNextIdempotent() {
            // Given
            var triggers = new CronTriggerSource(MARKET_HOURS, ZONE).triggersAfter(at(4, 12, 0));

            // When
            triggers.hasNext();
            triggers.hasNext();

            // Then
            assertThat(triggers.next().getFiredAt()).isEqualTo(at(4, 13, 0));
        }

        @Test
        @DisplayName("Should end the sequence when the schedule never fires again")
        void shouldEndExhaustedSequence() {
            // Given
            var source = new CronTriggerSource("0 0 0 30 2 *", ZONE);

            // When
            var triggers = source.triggersAfter(at(4, 12, 0));

            // Then
            assertThat(triggers.hasNext()).isFalse();
            assertThatThrownBy(triggers::next).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Nested
    @DisplayName("Parsing Tests")
    class ParsingTests {

        @Test
        @DisplayName("Should accept mixed-case day names")
        void shouldAcceptMixedCaseDayNames() {
            // Given
            var source = new CronTriggerSource("0 0,30 13-21 * * Mon-Fri", ZONE);

            // When
            var next = source.triggersAfter(at(8, 21, 30)).next();

            // Then
            assertThat(next.getFiredAt()).isEqualTo(at(11, 13, 0));
        }

        @Test
        @DisplayName("Should reject malformed expressions")
        void shouldRejectMalformedExpression() {
            assertThatThrownBy(() -> new CronTriggerSource("not a cron", ZONE))
                    .isInstanceOf(InvalidScheduleException.class)
                    .hasMessageContaining("not a cron");
        }

        @Test
        @DisplayName("Should reject five-field expressions")
        void shouldRejectFiveFieldExpression() {
            assertThatThrownBy(() -> new CronTriggerSource("0,30 13-21 * * MON-FRI", ZONE))
                    .isInstanceOf(InvalidScheduleException.class);
        }

        @Test
        @DisplayName("Should describe expression and zone")
        void shouldDescribeSchedule() {
            assertThat(new CronTriggerSource(MARKET_HOURS, ZONE).describe())
                    .isEqualTo("0 0,30 13-21 * * MON-FRI (America/Sao_Paulo)");
        }
    }
}
