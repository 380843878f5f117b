package com.openforge.promptyoself.schedule;

import com.openforge.promptyoself.domain.ScheduleType;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Maps (schedule_type, schedule_value, base time) to the next fire time.
 *
 *   once     → empty; one-shot reminders never recompute
 *   cron     → next match strictly after base (see {@link CronSchedule})
 *   interval → base + duration
 *
 * Stateless and side-effect free.  Used at registration (first next_run)
 * and by the execution pass after every successful recurring delivery.
 * The stored value is re-validated on every call because schedule_value
 * is free text in the table.
 */
@Component
public class RecurrenceCalculator {

    public Optional<LocalDateTime> nextOccurrence(ScheduleType type, String value, LocalDateTime base) {
        if (type == null) {
            throw new ScheduleException.UnknownScheduleType(null);
        }
        return nextOccurrence(ScheduleSpec.of(type, value), base);
    }

    public Optional<LocalDateTime> nextOccurrence(ScheduleSpec spec, LocalDateTime base) {
        try {
            return spec.nextAfter(base);
        } catch (DateTimeException | ArithmeticException e) {
            throw new ScheduleException.InvalidScheduleValue(
                    "Next run for %s '%s' is out of range".formatted(spec.type().wireName(), spec.value()), e);
        }
    }
}
