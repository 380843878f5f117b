package com.openforge.promptyoself.schedule;

import com.openforge.promptyoself.domain.ScheduleType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrenceCalculatorTest {

    private static final LocalDateTime T = LocalDateTime.of(2025, 1, 1, 10, 0);

    private final RecurrenceCalculator calculator = new RecurrenceCalculator();

    // ------------------------------------------------------------------
    // Interval
    // ------------------------------------------------------------------

    @ParameterizedTest
    @CsvSource({
            "30s, 30",
            "5m,  300",
            "2h,  7200",
            "45,  45",
            "' 10m ', 600"
    })
    void interval_addsDurationToBase(String token, long seconds) {
        assertThat(calculator.nextOccurrence(ScheduleType.INTERVAL, token, T))
                .contains(T.plusSeconds(seconds));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "5 m", "5d", "-5m", "1.5h", "0", "0s", "99999999999999999999"})
    void interval_rejectsMalformedTokens(String token) {
        assertThatThrownBy(() -> calculator.nextOccurrence(ScheduleType.INTERVAL, token, T))
                .isInstanceOf(ScheduleException.InvalidScheduleValue.class);
    }

    @Test
    void interval_overflowingTheCalendarIsInvalid() {
        assertThatThrownBy(() -> calculator.nextOccurrence(ScheduleType.INTERVAL, "9000000000000h", T))
                .isInstanceOf(ScheduleException.InvalidScheduleValue.class);
    }

    // ------------------------------------------------------------------
    // Cron
    // ------------------------------------------------------------------

    @Test
    void cron_rollsToNextDayWhenTodaysSlotHasPassed() {
        assertThat(calculator.nextOccurrence(ScheduleType.CRON, "0 9 * * *", T))
                .contains(LocalDateTime.of(2025, 1, 2, 9, 0));
    }

    @Test
    void cron_isStrictlyAfterBase() {
        LocalDateTime nine = LocalDateTime.of(2025, 1, 1, 9, 0);
        assertThat(calculator.nextOccurrence(ScheduleType.CRON, "0 9 * * *", nine))
                .contains(LocalDateTime.of(2025, 1, 2, 9, 0));
    }

    @Test
    void cron_everyFifteenMinutes() {
        assertThat(calculator.nextOccurrence(ScheduleType.CRON, "*/15 * * * *", T.plusMinutes(7)))
                .contains(T.plusMinutes(15));
    }

    @Test
    void cron_invalidExpressionIsInvalidValue() {
        assertThatThrownBy(() -> calculator.nextOccurrence(ScheduleType.CRON, "not a cron", T))
                .isInstanceOf(ScheduleException.InvalidScheduleValue.class);
    }

    // ------------------------------------------------------------------
    // Once / type errors
    // ------------------------------------------------------------------

    @Test
    void once_hasNoNextOccurrence() {
        assertThat(calculator.nextOccurrence(ScheduleType.ONCE, "2025-01-01T12:00:00Z", T)).isEmpty();
    }

    @Test
    void missingTypeIsUnknownScheduleType() {
        assertThatThrownBy(() -> calculator.nextOccurrence(null, "5m", T))
                .isInstanceOf(ScheduleException.UnknownScheduleType.class);
    }

    @Test
    void typedSpecDispatchesWithoutTypeLookup() {
        ScheduleSpec spec = ScheduleSpec.Interval.parse("2h");
        assertThat(spec.type()).isEqualTo(ScheduleType.INTERVAL);
        assertThat(calculator.nextOccurrence(spec, T)).contains(T.plusHours(2));
    }
}
