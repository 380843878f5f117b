package com.openforge.promptyoself.registration;

import lombok.Builder;

/**
 * Raw registration input, exactly as the caller supplied it.
 * Exactly one of {@code time}, {@code cron}, {@code every} is expected;
 * {@link RegistrationService} enforces that and every other rule.
 *
 * @param time           one-shot fire time (ISO-8601 or a common human format)
 * @param cron           5-field cron expression
 * @param every          interval token: "30s", "5m", "2h" or bare seconds
 * @param maxRepetitions optional cap for cron / interval, as text so that
 *                       non-numeric input is reported rather than rejected by binding
 * @param startAt        first fire time of an interval schedule
 * @param skipValidation skip the agent-existence lookup
 */
@Builder
public record RegisterCommand(
        String  agentId,
        String  prompt,
        String  time,
        String  cron,
        String  every,
        String  maxRepetitions,
        String  startAt,
        boolean skipValidation
) {}
