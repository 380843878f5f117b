package com.openforge.promptyoself.store;

import lombok.Builder;

import java.time.LocalDateTime;

/**
 * A field-level patch for one reminder.  Null fields are left untouched.
 *
 * Only the columns the post-delivery transition and cancellation may
 * change are patchable; agent, message and schedule are immutable.
 *
 * @param clearNextRun set next_run to null (the reminder has fired for the last time)
 */
@Builder
public record ReminderUpdate(
        LocalDateTime lastRun,
        LocalDateTime nextRun,
        boolean       clearNextRun,
        Boolean       active,
        Integer       repetitionCount
) {

    public static ReminderUpdate cancel() {
        return ReminderUpdate.builder().active(false).build();
    }
}
