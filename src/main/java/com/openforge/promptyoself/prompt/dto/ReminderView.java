package com.openforge.promptyoself.prompt.dto;

import com.openforge.promptyoself.domain.Reminder;

import java.time.LocalDateTime;

/**
 * Read model of a stored reminder, as returned by list.
 * The schedule type is the stored text, so a row with an unrecognised
 * type can still be listed.
 */
public record ReminderView(
        Long          id,
        String        agentId,
        String        promptText,
        String        scheduleType,
        String        scheduleValue,
        LocalDateTime nextRun,
        boolean       active,
        LocalDateTime createdAt,
        LocalDateTime lastRun,
        Integer       maxRepetitions,
        int           repetitionCount
) {

    public static ReminderView from(Reminder r) {
        return new ReminderView(
                r.getId(),
                r.getAgentId(),
                r.getMessage(),
                r.getRawScheduleType(),
                r.getScheduleValue(),
                r.getNextRun(),
                r.isActive(),
                r.getCreatedAt(),
                r.getLastRun(),
                r.getMaxRepetitions(),
                r.repetitions()
        );
    }
}
