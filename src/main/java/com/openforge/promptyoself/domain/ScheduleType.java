package com.openforge.promptyoself.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The three kinds of reminder schedule. Persisted and serialized as the
 * lowercase wire name ("once", "cron", "interval").
 */
public enum ScheduleType {

    /** Fires a single time at next_run, then deactivates. */
    ONCE("once"),

    /** Recurs on a 5-field cron expression. */
    CRON("cron"),

    /** Recurs every fixed duration ("30s", "5m", "2h", "45"). */
    INTERVAL("interval");

    private final String wireName;

    ScheduleType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<ScheduleType> fromWireName(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScheduleType type : values()) {
            if (type.wireName.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
