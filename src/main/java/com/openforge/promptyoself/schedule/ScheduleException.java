package com.openforge.promptyoself.schedule;

/**
 * Faults raised while interpreting a stored schedule.  They indicate a row
 * that was corrupted or edited outside the registration path; the execution
 * pass records them against the single reminder and moves on.
 */
public abstract class ScheduleException extends RuntimeException {

    protected ScheduleException(String message) {
        super(message);
    }

    protected ScheduleException(String message, Throwable cause) {
        super(message, cause);
    }

    public static class InvalidScheduleValue extends ScheduleException {
        public InvalidScheduleValue(String message) { super(message); }
        public InvalidScheduleValue(String message, Throwable cause) { super(message, cause); }
    }

    public static class UnknownScheduleType extends ScheduleException {
        public UnknownScheduleType(String type) { super("Unknown schedule type: " + type); }
    }
}
