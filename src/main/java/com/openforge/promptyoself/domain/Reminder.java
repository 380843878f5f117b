package com.openforge.promptyoself.domain;

import com.openforge.promptyoself.schedule.ScheduleException;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One scheduled prompt for one agent.
 *
 * Lifecycle:
 *   created by RegistrationService → mutated only by the execution pass
 *   (post-delivery patch) and by cancellation → deleted only by the
 *   explicit retention cleanup.
 *
 * Column notes:
 *
 *  scheduleType   - stored as the raw lowercase wire name.  Rows are only
 *                   written through {@link #setScheduleType(ScheduleType)},
 *                   but the column is free text, so the read side is checked
 *                   per row in {@link #getScheduleType()}.
 *
 *  scheduleValue  - once: the original time text; cron: the 5-field
 *                   expression; interval: the duration token.
 *
 *  nextRun        - UTC, timezone-naive.  Null once the reminder has fired
 *                   for the last time.
 *
 *  repetitionCount never exceeds maxRepetitions; reaching it deactivates
 *                   the row in the same update.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "prompt_schedules",
    indexes = {
        @Index(name = "idx_schedules_due", columnList = "next_run, active"),
        @Index(name = "idx_schedules_agent_active", columnList = "agent_id, active"),
        @Index(name = "idx_schedules_created_at", columnList = "created_at")
    }
)
public class Reminder extends BaseEntity {

    @Column(name = "agent_id", nullable = false, length = 100, updatable = false)
    private String agentId;

    /** Delivered verbatim to the agent. */
    @Column(name = "message", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String message;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Column(name = "schedule_type", nullable = false, length = 50, updatable = false)
    private String scheduleType;

    @Column(name = "schedule_value", nullable = false, length = 200, updatable = false)
    private String scheduleValue;

    @Column(name = "next_run")
    private LocalDateTime nextRun;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private Boolean active = true;

    /** Null means unbounded. */
    @Column(name = "max_repetitions")
    private Integer maxRepetitions;

    @Builder.Default
    @Column(name = "repetition_count", nullable = false)
    private Integer repetitionCount = 0;

    /** Last delivery attempt, successful or not. */
    @Column(name = "last_run")
    private LocalDateTime lastRun;

    public ScheduleType getScheduleType() {
        return ScheduleType.fromWireName(scheduleType)
                .orElseThrow(() -> new ScheduleException.UnknownScheduleType(scheduleType));
    }

    public void setScheduleType(ScheduleType type) {
        this.scheduleType = type.wireName();
    }

    /** The stored type text, unchecked. */
    public String getRawScheduleType() {
        return scheduleType;
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public int repetitions() {
        return repetitionCount == null ? 0 : repetitionCount;
    }

    /** Builder hook so callers pass the enum, not the raw column text. */
    public static class ReminderBuilder {
        public ReminderBuilder scheduleType(ScheduleType type) {
            this.scheduleType = type.wireName();
            return this;
        }
    }
}
