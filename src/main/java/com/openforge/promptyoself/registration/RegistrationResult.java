package com.openforge.promptyoself.registration;

import com.openforge.promptyoself.domain.ScheduleType;

import java.time.LocalDateTime;

/** A stored registration: the assigned id and the first fire time (UTC). */
public record RegistrationResult(long id, ScheduleType scheduleType, LocalDateTime nextRun) {}
