package com.openforge.promptyoself.schedule;

import com.openforge.promptyoself.domain.ScheduleType;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed view of a reminder's (schedule_type, schedule_value) pair.
 *
 * Each kind computes its own next fire time, so callers never branch on the
 * type string.
 */
public sealed interface ScheduleSpec permits ScheduleSpec.Once, ScheduleSpec.Cron, ScheduleSpec.Interval {

    ScheduleType type();

    /** The text persisted as schedule_value. */
    String value();

    /** Next fire time strictly after {@code base}; empty when the schedule never fires again. */
    Optional<LocalDateTime> nextAfter(LocalDateTime base);

    /**
     * Rebuilds the typed spec from its stored form.
     *
     * @throws ScheduleException.InvalidScheduleValue if the value does not fit the type
     */
    static ScheduleSpec of(ScheduleType type, String value) {
        switch (type) {
            case ONCE:
                return new Once(value);
            case CRON:
                return new Cron(CronSchedule.parse(value));
            case INTERVAL:
                return Interval.parse(value);
            default:
                throw new ScheduleException.UnknownScheduleType(type.name());
        }
    }

    // ── Once ─────────────────────────────────────────────────────────────────

    /** The fire time lives in next_run; the value is only kept for display. */
    record Once(String value) implements ScheduleSpec {

        @Override
        public ScheduleType type() {
            return ScheduleType.ONCE;
        }

        @Override
        public Optional<LocalDateTime> nextAfter(LocalDateTime base) {
            return Optional.empty();
        }
    }

    // ── Cron ─────────────────────────────────────────────────────────────────

    record Cron(CronSchedule schedule) implements ScheduleSpec {

        @Override
        public ScheduleType type() {
            return ScheduleType.CRON;
        }

        @Override
        public String value() {
            return schedule.expression();
        }

        @Override
        public Optional<LocalDateTime> nextAfter(LocalDateTime base) {
            return Optional.of(schedule.next(base));
        }
    }

    // ── Interval ─────────────────────────────────────────────────────────────

    /**
     * Fixed-delay recurrence.  Token grammar: digits with an optional
     * s / m / h suffix; bare digits are seconds.
     */
    record Interval(String value, Duration duration) implements ScheduleSpec {

        private static final Pattern TOKEN = Pattern.compile("^(\\d+)([smh]?)$");

        public static Interval parse(String token) {
            if (token == null) {
                throw new ScheduleException.InvalidScheduleValue("Interval is empty");
            }
            String trimmed = token.trim();
            Matcher m = TOKEN.matcher(trimmed);
            if (!m.matches()) {
                throw new ScheduleException.InvalidScheduleValue("Invalid interval format: " + token);
            }
            long amount;
            try {
                amount = Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                throw new ScheduleException.InvalidScheduleValue("Interval out of range: " + token, e);
            }
            if (amount <= 0) {
                throw new ScheduleException.InvalidScheduleValue("Interval must be positive: " + token);
            }
            Duration duration;
            try {
                duration = switch (m.group(2)) {
                    case "m" -> Duration.ofMinutes(amount);
                    case "h" -> Duration.ofHours(amount);
                    default  -> Duration.ofSeconds(amount);
                };
            } catch (ArithmeticException e) {
                throw new ScheduleException.InvalidScheduleValue("Interval out of range: " + token, e);
            }
            return new Interval(trimmed, duration);
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.INTERVAL;
        }

        @Override
        public Optional<LocalDateTime> nextAfter(LocalDateTime base) {
            return Optional.of(base.plus(duration));
        }
    }
}
