package com.openforge.promptyoself.registration;

import lombok.Getter;

/**
 * A rejected registration.  Raised before any store write, so a failed
 * registration never leaves a row behind.
 */
@Getter
public class RegistrationException extends RuntimeException {

    public enum Reason {
        MISSING_ARGUMENT,
        NO_SCHEDULE_OPTION,
        CONFLICTING_SCHEDULE_OPTIONS,
        INVALID_TIME_FORMAT,
        TIME_NOT_IN_FUTURE,
        INVALID_CRON_EXPRESSION,
        INVALID_INTERVAL_FORMAT,
        START_TIME_NOT_IN_FUTURE,
        INVALID_MAX_REPETITIONS,
        AGENT_VALIDATION_FAILED
    }

    private final Reason reason;

    public RegistrationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
