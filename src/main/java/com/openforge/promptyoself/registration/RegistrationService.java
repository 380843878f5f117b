package com.openforge.promptyoself.registration;

import com.openforge.promptyoself.delivery.AgentDirectory;
import com.openforge.promptyoself.domain.ScheduleType;
import com.openforge.promptyoself.registration.RegistrationException.Reason;
import com.openforge.promptyoself.schedule.CronSchedule;
import com.openforge.promptyoself.schedule.RecurrenceCalculator;
import com.openforge.promptyoself.schedule.ScheduleException;
import com.openforge.promptyoself.schedule.ScheduleSpec;
import com.openforge.promptyoself.schedule.ScheduleTimeParser;
import com.openforge.promptyoself.schedule.ScheduleTimeParser.ParsedTime;
import com.openforge.promptyoself.store.ReminderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.stream.Stream;

/**
 * Validates a schedule request and stores it.
 *
 * Rules, in order:
 *   1. agent id and prompt are present
 *   2. exactly one of time / cron / every
 *   3. the agent exists (unless skipValidation)
 *   4. the chosen option parses and its first fire time is in the future
 *   5. max_repetitions, when given, is a positive integer
 *
 * Any failure raises {@link RegistrationException} before the store is touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationService {

    private static final String TIME_FORMAT_HINT =
            "Use ISO 8601 like 2025-12-25T10:00:00Z or include offset, e.g. 2025-12-25T10:00:00-05:00";

    private final ReminderStore        store;
    private final RecurrenceCalculator calculator;
    private final AgentDirectory       agentDirectory;
    private final Clock                clock;

    public RegistrationResult register(RegisterCommand cmd) {
        if (isBlank(cmd.agentId()) || isBlank(cmd.prompt())) {
            throw new RegistrationException(Reason.MISSING_ARGUMENT,
                    "Missing required arguments: agent-id and prompt");
        }

        long options = Stream.of(cmd.time(), cmd.cron(), cmd.every()).filter(v -> !isBlank(v)).count();
        if (options == 0) {
            throw new RegistrationException(Reason.NO_SCHEDULE_OPTION,
                    "Must specify one of --time, --cron, or --every");
        }
        if (options > 1) {
            throw new RegistrationException(Reason.CONFLICTING_SCHEDULE_OPTIONS,
                    "Cannot specify multiple scheduling options");
        }

        if (!cmd.skipValidation()) {
            validateAgent(cmd.agentId());
        }

        Schedule schedule;
        if (!isBlank(cmd.time())) {
            schedule = once(cmd.time());
        } else if (!isBlank(cmd.cron())) {
            schedule = cron(cmd.cron());
        } else {
            schedule = interval(cmd.every(), cmd.startAt());
        }

        Integer maxRepetitions = parseMaxRepetitions(cmd.maxRepetitions());

        long id = store.create(cmd.agentId(), cmd.prompt(),
                schedule.type(), schedule.value(), schedule.nextRun(), maxRepetitions);

        log.info("[Register] Reminder {} scheduled for agent {}: type={} value='{}' next_run={} max_repetitions={}",
                id, cmd.agentId(), schedule.type().wireName(), schedule.value(), schedule.nextRun(), maxRepetitions);

        return new RegistrationResult(id, schedule.type(), schedule.nextRun());
    }

    // ── Per-option parsing ───────────────────────────────────────────────────

    private Schedule once(String time) {
        ParsedTime at = ScheduleTimeParser.parse(time)
                .orElseThrow(() -> new RegistrationException(Reason.INVALID_TIME_FORMAT,
                        "Invalid time format: %s. %s".formatted(time, TIME_FORMAT_HINT)));
        if (!at.isAfter(clock)) {
            throw new RegistrationException(Reason.TIME_NOT_IN_FUTURE,
                    "Scheduled time must be in the future");
        }
        return new Schedule(ScheduleType.ONCE, time.trim(), at.toUtc());
    }

    private Schedule cron(String expression) {
        if (!CronSchedule.isValid(expression)) {
            throw new RegistrationException(Reason.INVALID_CRON_EXPRESSION,
                    "Invalid cron expression: " + expression);
        }
        try {
            ScheduleSpec spec = ScheduleSpec.of(ScheduleType.CRON, expression);
            LocalDateTime next = calculator.nextOccurrence(spec, now())
                    .orElseThrow(() -> new ScheduleException.InvalidScheduleValue("no next run"));
            return new Schedule(ScheduleType.CRON, spec.value(), next);
        } catch (ScheduleException e) {
            throw new RegistrationException(Reason.INVALID_CRON_EXPRESSION,
                    "Invalid cron expression: " + expression);
        }
    }

    private Schedule interval(String every, String startAt) {
        ScheduleSpec.Interval spec;
        try {
            spec = ScheduleSpec.Interval.parse(every);
        } catch (ScheduleException e) {
            throw invalidInterval(every);
        }

        if (!isBlank(startAt)) {
            ParsedTime start = ScheduleTimeParser.parse(startAt)
                    .orElseThrow(() -> new RegistrationException(Reason.INVALID_TIME_FORMAT,
                            "Invalid start time format: %s. %s".formatted(startAt, TIME_FORMAT_HINT)));
            if (!start.isAfter(clock)) {
                throw new RegistrationException(Reason.START_TIME_NOT_IN_FUTURE,
                        "Start time must be in the future");
            }
            return new Schedule(ScheduleType.INTERVAL, spec.value(), start.toUtc());
        }

        try {
            LocalDateTime next = calculator.nextOccurrence(spec, now()).orElseThrow();
            return new Schedule(ScheduleType.INTERVAL, spec.value(), next);
        } catch (ScheduleException e) {
            throw invalidInterval(every);
        }
    }

    private Integer parseMaxRepetitions(String raw) {
        if (raw == null) return null;
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new RegistrationException(Reason.INVALID_MAX_REPETITIONS,
                    "max-repetitions must be a valid integer");
        }
        if (value <= 0) {
            throw new RegistrationException(Reason.INVALID_MAX_REPETITIONS,
                    "max-repetitions must be a positive integer");
        }
        return value;
    }

    private void validateAgent(String agentId) {
        AgentDirectory.AgentValidation validation;
        try {
            validation = agentDirectory.validate(agentId);
        } catch (RuntimeException e) {
            log.warn("[Register] Agent lookup for {} threw: {}", agentId, e.getMessage());
            validation = AgentDirectory.AgentValidation.missing(
                    "Failed to validate agent %s: %s".formatted(agentId, e.getMessage()));
        }
        if (!validation.exists()) {
            throw new RegistrationException(Reason.AGENT_VALIDATION_FAILED,
                    "Agent validation failed: " + validation.message());
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static RegistrationException invalidInterval(String every) {
        return new RegistrationException(Reason.INVALID_INTERVAL_FORMAT,
                "Invalid interval format: %s. Use formats like '30s', '5m', '1h'".formatted(every));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Normalized (type, value, first next_run) ready for the store. */
    private record Schedule(ScheduleType type, String value, LocalDateTime nextRun) {}
}
